package com.glossarymetrics.vacfetch.fetch.export;

import com.glossarymetrics.vacfetch.fetch.model.FlatRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.stream.Stream;

@Component
public class VacancyCsvWriter {
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader(FlatRow.COLUMNS.toArray(new String[0]))
        .setRecordSeparator("\n")
        .build();

    public long write(Stream<FlatRow> rows, Path target) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            return write(rows, writer);
        }
    }

    public long write(Stream<FlatRow> rows, Writer writer) throws IOException {
        long count = 0;
        CSVPrinter printer = new CSVPrinter(writer, FORMAT);
        Iterator<FlatRow> iterator = rows.iterator();
        try {
            while (iterator.hasNext()) {
                printer.printRecord(iterator.next().values());
                count++;
            }
        } finally {
            printer.flush();
        }
        return count;
    }
}
