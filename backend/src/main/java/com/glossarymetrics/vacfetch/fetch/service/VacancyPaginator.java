package com.glossarymetrics.vacfetch.fetch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.glossarymetrics.vacfetch.config.FetcherProperties;
import com.glossarymetrics.vacfetch.fetch.http.FatalHttpException;
import com.glossarymetrics.vacfetch.fetch.http.ResilientHttpClient;
import com.glossarymetrics.vacfetch.fetch.http.Sleeper;
import com.glossarymetrics.vacfetch.fetch.model.DateWindow;
import com.glossarymetrics.vacfetch.fetch.model.HttpFetchResult;
import com.glossarymetrics.vacfetch.fetch.model.SearchCriteria;
import com.glossarymetrics.vacfetch.fetch.model.VacancyPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

@Component
public class VacancyPaginator {
    private static final Logger log = LoggerFactory.getLogger(VacancyPaginator.class);

    enum State {
        INIT,
        ACTIVE,
        DONE
    }

    private final ResilientHttpClient httpClient;
    private final VacancyPageParser pageParser;
    private final Sleeper sleeper;
    private final String vacanciesUrl;

    public VacancyPaginator(
        ResilientHttpClient httpClient,
        VacancyPageParser pageParser,
        Sleeper sleeper,
        FetcherProperties properties
    ) {
        this.httpClient = httpClient;
        this.pageParser = pageParser;
        this.sleeper = sleeper;
        this.vacanciesUrl = properties.getApiBaseUrl() + "/vacancies";
    }

    public Stream<JsonNode> stream(SearchCriteria criteria, Map<String, String> headers, Duration pageDelay) {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(cursor(criteria, headers, pageDelay), Spliterator.ORDERED | Spliterator.NONNULL),
            false
        );
    }

    PageCursor cursor(SearchCriteria criteria, Map<String, String> headers, Duration pageDelay) {
        return new PageCursor(criteria, headers, pageDelay);
    }

    static MultiValueMap<String, String> queryParams(SearchCriteria criteria, int page) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        if (criteria.text() != null && !criteria.text().isBlank()) {
            params.add("text", criteria.text());
        }
        params.add("area", criteria.area());
        params.add("per_page", Integer.toString(criteria.perPage()));
        params.add("page", Integer.toString(page));
        DateWindow window = criteria.window();
        if (window.start() != null) {
            params.add("date_from", window.start().toString());
        }
        if (window.end() != null) {
            params.add("date_to", window.end().toString());
        }
        for (String employment : criteria.employment()) {
            params.add("employment", employment);
        }
        for (String schedule : criteria.schedule()) {
            params.add("schedule", schedule);
        }
        return params;
    }

    final class PageCursor implements Iterator<JsonNode> {
        private final SearchCriteria criteria;
        private final Map<String, String> headers;
        private final Duration pageDelay;
        private State state = State.INIT;
        private int page;
        private int totalPages;
        private int requestCount;
        private Iterator<JsonNode> buffer = Collections.emptyIterator();

        PageCursor(SearchCriteria criteria, Map<String, String> headers, Duration pageDelay) {
            this.criteria = criteria;
            this.headers = headers == null ? Map.of() : headers;
            this.pageDelay = pageDelay == null ? Duration.ZERO : pageDelay;
        }

        @Override
        public boolean hasNext() {
            while (!buffer.hasNext()) {
                if (state == State.DONE) {
                    return false;
                }
                fetchNextPage();
            }
            return true;
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.next();
        }

        State state() {
            return state;
        }

        int requestCount() {
            return requestCount;
        }

        private void fetchNextPage() {
            if (state == State.INIT && exceedsCap(page)) {
                state = State.DONE;
                return;
            }
            if (state == State.ACTIVE) {
                pause();
            }

            HttpFetchResult result = httpClient.execute(vacanciesUrl, queryParams(criteria, page), headers);
            requestCount++;
            VacancyPage vacancyPage = pageParser.parse(result.body(), result.requestedUrl());
            if (state == State.INIT) {
                totalPages = vacancyPage.pages();
                state = State.ACTIVE;
                log.debug("Area {} window {} reports {} pages", criteria.area(), criteria.window(), totalPages);
            }
            buffer = vacancyPage.items().iterator();

            page++;
            if (page >= totalPages || exceedsCap(page)) {
                state = State.DONE;
            }
        }

        private boolean exceedsCap(int candidatePage) {
            return criteria.maxPages() != null && candidatePage > criteria.maxPages();
        }

        private void pause() {
            try {
                sleeper.sleep(pageDelay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FatalHttpException(vacanciesUrl, 0, "Interrupted between vacancy pages", e);
            }
        }
    }
}
