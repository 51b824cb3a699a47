package com.glossarymetrics.vacfetch.fetch.export;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Component
public class OutputPathResolver {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Path DEFAULT_DIRECTORY = Path.of("output");

    private final Clock clock;

    public OutputPathResolver(Clock clock) {
        this.clock = clock;
    }

    public Path resolve(String explicitPath) throws IOException {
        return resolve(explicitPath, DEFAULT_DIRECTORY);
    }

    Path resolve(String explicitPath, Path defaultDirectory) throws IOException {
        if (explicitPath != null && !explicitPath.isBlank()) {
            Path path = Path.of(explicitPath.trim());
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return path;
        }
        Files.createDirectories(defaultDirectory);
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        return defaultDirectory.resolve("hh_vacancies_" + timestamp + ".csv");
    }
}
