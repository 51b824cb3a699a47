package com.glossarymetrics.vacfetch.fetch.model;

import java.util.List;

public record SearchCriteria(
    String text,
    String area,
    DateWindow window,
    List<String> employment,
    List<String> schedule,
    int perPage,
    Integer maxPages
) {
    public SearchCriteria {
        window = window == null ? DateWindow.open() : window;
        employment = employment == null ? List.of() : List.copyOf(employment);
        schedule = schedule == null ? List.of() : List.copyOf(schedule);
        perPage = Math.min(100, Math.max(1, perPage));
    }
}
