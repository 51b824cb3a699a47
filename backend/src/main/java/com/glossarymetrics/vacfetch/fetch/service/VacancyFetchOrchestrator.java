package com.glossarymetrics.vacfetch.fetch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.glossarymetrics.vacfetch.config.FetcherProperties;
import com.glossarymetrics.vacfetch.fetch.http.FatalHttpException;
import com.glossarymetrics.vacfetch.fetch.http.Sleeper;
import com.glossarymetrics.vacfetch.fetch.model.DateWindow;
import com.glossarymetrics.vacfetch.fetch.model.FetchRequest;
import com.glossarymetrics.vacfetch.fetch.model.FlatRow;
import com.glossarymetrics.vacfetch.fetch.model.SearchCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Produces the flattened vacancy rows for one run: every date window in ascending order,
 * every area in the supplied order within a window, then the paginated search results.
 * Rows are not deduplicated.
 */
@Service
public class VacancyFetchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(VacancyFetchOrchestrator.class);

    private final DateWindowPlanner windowPlanner;
    private final VacancyPaginator paginator;
    private final VacancyDetailEnricher detailEnricher;
    private final VacancyRowMapper rowMapper;
    private final Sleeper sleeper;
    private final Clock clock;
    private final FetcherProperties properties;

    public VacancyFetchOrchestrator(
        DateWindowPlanner windowPlanner,
        VacancyPaginator paginator,
        VacancyDetailEnricher detailEnricher,
        VacancyRowMapper rowMapper,
        Sleeper sleeper,
        Clock clock,
        FetcherProperties properties
    ) {
        this.windowPlanner = windowPlanner;
        this.paginator = paginator;
        this.detailEnricher = detailEnricher;
        this.rowMapper = rowMapper;
        this.sleeper = sleeper;
        this.clock = clock;
        this.properties = properties;
    }

    // validation happens here; search page failures surface while the stream is consumed
    public Stream<FlatRow> run(FetchRequest request) {
        List<String> areas = request.normalizedAreas();
        List<DateWindow> windows = planWindows(request, areas);
        Map<String, String> headers = Map.of("User-Agent", FetcherProperties.normalizeUserAgent(request.userAgent()));
        RowCursor cursor = new RowCursor(request, windows, areas, headers, detailDelay(request));
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(cursor, Spliterator.ORDERED | Spliterator.NONNULL),
            false
        );
    }

    List<DateWindow> planWindows(FetchRequest request, List<String> areas) {
        if (areas.isEmpty()) {
            throw new FetchConfigurationException("No valid areas provided");
        }
        LocalDate from = request.dateFrom();
        LocalDate to = request.dateTo();
        if (request.lastDays() != null) {
            if (from != null || to != null) {
                throw new FetchConfigurationException("last-days cannot be combined with date-from/date-to");
            }
            if (request.lastDays() < 1) {
                throw new FetchConfigurationException("last-days must be at least 1, got " + request.lastDays());
            }
            to = LocalDate.now(clock);
            from = to.minusDays(request.lastDays() - 1L);
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new FetchConfigurationException("date-from " + from + " is after date-to " + to);
        }
        List<DateWindow> windows = windowPlanner.plan(from, to, request.windowDays());
        log.info("Planned {} date window(s) x {} area(s)", windows.size(), areas.size());
        return windows;
    }

    Duration detailDelay(FetchRequest request) {
        Duration minimum = Duration.ofMillis(properties.getDetailMinDelayMs());
        return request.requestDelay().compareTo(minimum) > 0 ? request.requestDelay() : minimum;
    }

    private FlatRow toRow(JsonNode vacancy, boolean details, Map<String, String> headers, Duration detailDelay) {
        if (!details) {
            return rowMapper.toRow(vacancy, null);
        }
        JsonNode idNode = vacancy.path("id");
        if (idNode.isMissingNode() || idNode.isNull() || idNode.asText().isBlank()) {
            return rowMapper.toRow(vacancy, null);
        }
        Optional<JsonNode> detail = detailEnricher.fetchDetail(idNode.asText(), headers);
        try {
            sleeper.sleep(detailDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalHttpException(null, 0, "Interrupted while pacing vacancy detail requests", e);
        }
        return rowMapper.toRow(vacancy, detail.orElse(null));
    }

    private final class RowCursor implements Iterator<FlatRow> {
        private final FetchRequest request;
        private final List<DateWindow> windows;
        private final List<String> areas;
        private final Map<String, String> headers;
        private final Duration detailDelay;
        private int windowIndex;
        private int areaIndex;
        private Iterator<JsonNode> vacancies = Collections.emptyIterator();

        RowCursor(
            FetchRequest request,
            List<DateWindow> windows,
            List<String> areas,
            Map<String, String> headers,
            Duration detailDelay
        ) {
            this.request = request;
            this.windows = windows;
            this.areas = areas;
            this.headers = headers;
            this.detailDelay = detailDelay;
        }

        @Override
        public boolean hasNext() {
            while (!vacancies.hasNext()) {
                if (windowIndex >= windows.size()) {
                    return false;
                }
                vacancies = openNextSearch();
            }
            return true;
        }

        @Override
        public FlatRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return toRow(vacancies.next(), request.details(), headers, detailDelay);
        }

        // areas inner, windows outer
        private Iterator<JsonNode> openNextSearch() {
            DateWindow window = windows.get(windowIndex);
            String area = areas.get(areaIndex);
            areaIndex++;
            if (areaIndex >= areas.size()) {
                areaIndex = 0;
                windowIndex++;
            }
            log.info("Fetching vacancies for area {} window {}", area, window);
            SearchCriteria criteria = new SearchCriteria(
                request.text(),
                area,
                window,
                request.normalizedEmployment(),
                request.normalizedSchedule(),
                request.perPage(),
                request.maxPages()
            );
            return paginator.cursor(criteria, headers, request.requestDelay());
        }
    }
}
