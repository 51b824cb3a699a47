package com.glossarymetrics.vacfetch.fetch.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record VacancyPage(List<JsonNode> items, int pages) {
    public static final VacancyPage EMPTY = new VacancyPage(List.of(), 0);

    public VacancyPage {
        items = items == null ? List.of() : List.copyOf(items);
        pages = Math.max(0, pages);
    }
}
