package com.glossarymetrics.vacfetch.fetch.model;

import java.time.LocalDate;

/**
 * Inclusive date range for one search query. Either bound may be {@code null}, which
 * leaves that side of the query unfiltered.
 */
public record DateWindow(LocalDate start, LocalDate end) {

    public DateWindow {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("window start " + start + " is after end " + end);
        }
    }

    public static DateWindow open() {
        return new DateWindow(null, null);
    }

    @Override
    public String toString() {
        return (start == null ? "*" : start.toString()) + ".." + (end == null ? "*" : end.toString());
    }
}
