package com.glossarymetrics.vacfetch.fetch.service;

import com.glossarymetrics.vacfetch.fetch.model.DateWindow;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Component
public class DateWindowPlanner {

    public List<DateWindow> plan(LocalDate overallStart, LocalDate overallEnd, int windowSizeDays) {
        if (overallStart == null || overallEnd == null) {
            return List.of(new DateWindow(overallStart, overallEnd));
        }
        if (overallStart.isAfter(overallEnd)) {
            throw new IllegalArgumentException("start " + overallStart + " is after end " + overallEnd);
        }
        int width = Math.max(1, windowSizeDays);
        List<DateWindow> windows = new ArrayList<>();
        LocalDate cursor = overallStart;
        while (!cursor.isAfter(overallEnd)) {
            LocalDate windowEnd = cursor.plusDays(width - 1L);
            if (windowEnd.isAfter(overallEnd)) {
                windowEnd = overallEnd;
            }
            windows.add(new DateWindow(cursor, windowEnd));
            cursor = windowEnd.plusDays(1);
        }
        return windows;
    }
}
