package com.glossarymetrics.vacfetch.fetch.model;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public record FetchRequest(
    String text,
    List<String> areas,
    int perPage,
    Integer maxPages,
    LocalDate dateFrom,
    LocalDate dateTo,
    Integer lastDays,
    int windowDays,
    List<String> employment,
    List<String> schedule,
    Duration requestDelay,
    boolean details,
    String userAgent
) {
    public FetchRequest {
        areas = areas == null ? List.of() : List.copyOf(areas);
        employment = employment == null ? List.of() : List.copyOf(employment);
        schedule = schedule == null ? List.of() : List.copyOf(schedule);
        requestDelay = requestDelay == null || requestDelay.isNegative() ? Duration.ZERO : requestDelay;
    }

    public List<String> normalizedAreas() {
        return normalize(areas);
    }

    public List<String> normalizedEmployment() {
        return normalize(employment);
    }

    public List<String> normalizedSchedule() {
        return normalize(schedule);
    }

    public static List<String> splitCsv(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return normalize(List.of(raw.split(",")));
    }

    private static List<String> normalize(List<String> values) {
        List<String> out = new ArrayList<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }
}
