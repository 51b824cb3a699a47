package com.glossarymetrics.vacfetch.fetch.service;

import com.glossarymetrics.vacfetch.config.FetcherProperties;
import com.glossarymetrics.vacfetch.fetch.export.OutputPathResolver;
import com.glossarymetrics.vacfetch.fetch.export.VacancyCsvWriter;
import com.glossarymetrics.vacfetch.fetch.http.FatalHttpException;
import com.glossarymetrics.vacfetch.fetch.model.FetchRequest;
import com.glossarymetrics.vacfetch.fetch.model.FlatRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

@Component
public class FetchCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(FetchCliRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FETCH_FAILED = 1;
    static final int EXIT_BAD_CONFIGURATION = 2;

    private final FetcherProperties properties;
    private final VacancyFetchOrchestrator orchestrator;
    private final VacancyCsvWriter csvWriter;
    private final OutputPathResolver outputPathResolver;
    private final ConfigurableApplicationContext applicationContext;

    public FetchCliRunner(
        FetcherProperties properties,
        VacancyFetchOrchestrator orchestrator,
        VacancyCsvWriter csvWriter,
        OutputPathResolver outputPathResolver,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.csvWriter = csvWriter;
        this.outputPathResolver = outputPathResolver;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode;
        try {
            exitCode = fetchToCsv(buildRequest(properties));
        } catch (FetchConfigurationException e) {
            log.error("Invalid fetch configuration: {}", e.getMessage());
            if (!properties.getCli().isExitAfterRun()) {
                throw e;
            }
            exitCode = EXIT_BAD_CONFIGURATION;
        } catch (FatalHttpException e) {
            log.error("Vacancy fetch aborted: status={} url={}", e.statusCode(), e.url(), e);
            if (!properties.getCli().isExitAfterRun()) {
                throw e;
            }
            exitCode = EXIT_FETCH_FAILED;
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalCode = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> finalCode));
        }
    }

    int fetchToCsv(FetchRequest request) throws IOException {
        try (Stream<FlatRow> rows = orchestrator.run(request)) {
            Path target = outputPathResolver.resolve(properties.getOutput().getPath());
            long total = csvWriter.write(rows, target);
            log.info("Saved {} rows to {}", total, target);
        }
        return EXIT_OK;
    }

    static FetchRequest buildRequest(FetcherProperties properties) {
        FetcherProperties.Search search = properties.getSearch();
        return new FetchRequest(
            search.getText(),
            FetchRequest.splitCsv(search.getAreas()),
            search.getPerPage(),
            search.getMaxPages(),
            search.getDateFrom(),
            search.getDateTo(),
            search.getLastDays(),
            search.getWindowDays(),
            FetchRequest.splitCsv(search.getEmployment()),
            FetchRequest.splitCsv(search.getSchedule()),
            Duration.ofMillis(properties.getRequestDelayMs()),
            search.isDetails(),
            properties.getUserAgent()
        );
    }
}
