package com.glossarymetrics.vacfetch.fetch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glossarymetrics.vacfetch.config.FetcherProperties;
import com.glossarymetrics.vacfetch.fetch.http.FatalHttpException;
import com.glossarymetrics.vacfetch.fetch.http.RecordingSleeper;
import com.glossarymetrics.vacfetch.fetch.http.ResilientHttpClient;
import com.glossarymetrics.vacfetch.fetch.model.DateWindow;
import com.glossarymetrics.vacfetch.fetch.model.SearchCriteria;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static com.glossarymetrics.vacfetch.fetch.service.VacancyApiFixtures.json;
import static com.glossarymetrics.vacfetch.fetch.service.VacancyApiFixtures.pageJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VacancyPaginatorTest {
    private static final Duration PAGE_DELAY = Duration.ofMillis(500);

    private MockWebServer server;
    private RecordingSleeper sleeper;
    private VacancyPaginator paginator;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        sleeper = new RecordingSleeper();

        FetcherProperties properties = new FetcherProperties();
        properties.setApiBaseUrl(server.url("/").toString());
        properties.setRequestTimeoutSeconds(5);
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setInitialBackoffMs(1000);
        ResilientHttpClient client = new ResilientHttpClient(properties, sleeper);
        paginator = new VacancyPaginator(client, new VacancyPageParser(new ObjectMapper()), sleeper, properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private static SearchCriteria criteria(Integer maxPages) {
        return new SearchCriteria("Product Manager", "1", DateWindow.open(), List.of(), List.of(), 2, maxPages);
    }

    private void servePages(int totalPages) {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                int page = Integer.parseInt(request.getRequestUrl().queryParameter("page"));
                return json(pageJson(totalPages, "p" + page + "a", "p" + page + "b"));
            }
        });
    }

    private static List<String> ids(Stream<JsonNode> stream) {
        return stream.map(node -> node.path("id").asText()).toList();
    }

    @Test
    void emitsEveryPageInOrderThenStops() {
        servePages(3);

        List<String> ids = ids(paginator.stream(criteria(null), Map.of(), PAGE_DELAY));

        assertThat(ids).containsExactly("p0a", "p0b", "p1a", "p1b", "p2a", "p2b");
        assertThat(server.getRequestCount()).isEqualTo(3);
        assertThat(sleeper.sleeps()).containsExactly(PAGE_DELAY, PAGE_DELAY);
    }

    @Test
    void zeroPagesMakesOneRequestAndYieldsNothing() {
        server.enqueue(json("{\"items\":[],\"pages\":0,\"found\":0}"));

        List<String> ids = ids(paginator.stream(criteria(null), Map.of(), PAGE_DELAY));

        assertThat(ids).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void maxPageCapLimitsRequestsToCapPlusOne() {
        servePages(20);

        List<String> ids = ids(paginator.stream(criteria(2), Map.of(), PAGE_DELAY));

        assertThat(ids).containsExactly("p0a", "p0b", "p1a", "p1b", "p2a", "p2b");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void capOfZeroStillFetchesFirstPage() {
        servePages(20);

        List<String> ids = ids(paginator.stream(criteria(0), Map.of(), PAGE_DELAY));

        assertThat(ids).containsExactly("p0a", "p0b");
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void malformedPageCountIsTreatedAsEmptyResult() {
        server.enqueue(json("{\"items\":[" + VacancyApiFixtures.vacancyJson("x") + "],\"pages\":\"lots\"}"));

        List<String> ids = ids(paginator.stream(criteria(null), Map.of(), PAGE_DELAY));

        assertThat(ids).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void floatingPointPageCountIsAccepted() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String page = request.getRequestUrl().queryParameter("page");
                return json("{\"items\":[" + VacancyApiFixtures.vacancyJson("p" + page) + "],\"pages\":2.0}");
            }
        });

        List<String> ids = ids(paginator.stream(criteria(null), Map.of(), PAGE_DELAY));

        assertThat(ids).containsExactly("p0", "p1");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void unparseableBodyIsTreatedAsEmptyResult() {
        server.enqueue(json("<html>maintenance</html>"));

        assertThat(ids(paginator.stream(criteria(null), Map.of(), PAGE_DELAY))).isEmpty();
    }

    @Test
    void retriedPageIsEmittedOnce() {
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(json(pageJson(1, "a", "b")));

        List<String> ids = ids(paginator.stream(criteria(null), Map.of(), PAGE_DELAY));

        assertThat(ids).containsExactly("a", "b");
        assertThat(server.getRequestCount()).isEqualTo(3);
        assertThat(sleeper.sleepMillis()).containsExactly(1000L, 2000L);
    }

    @Test
    void doesNotRequestUntilConsumed() {
        servePages(3);

        Stream<JsonNode> stream = paginator.stream(criteria(null), Map.of(), PAGE_DELAY);
        assertThat(server.getRequestCount()).isZero();

        assertThat(stream.limit(1).count()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void cursorReachesDoneAfterLastPage() {
        servePages(2);

        VacancyPaginator.PageCursor cursor = paginator.cursor(criteria(null), Map.of(), PAGE_DELAY);
        assertThat(cursor.state()).isEqualTo(VacancyPaginator.State.INIT);

        int count = 0;
        while (cursor.hasNext()) {
            cursor.next();
            count++;
        }

        assertThat(count).isEqualTo(4);
        assertThat(cursor.state()).isEqualTo(VacancyPaginator.State.DONE);
        assertThat(cursor.requestCount()).isEqualTo(2);
        assertThat(cursor.hasNext()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void encodesCriteriaAndOmitsAbsentOnes() throws Exception {
        server.enqueue(json(pageJson(1, "a")));
        SearchCriteria criteria = new SearchCriteria(
            "Data Scientist",
            "2",
            new DateWindow(LocalDate.of(2025, 9, 1), LocalDate.of(2025, 9, 24)),
            List.of("full", "part"),
            List.of("remote"),
            50,
            null
        );

        ids(paginator.stream(criteria, Map.of("User-Agent", "Test/1.0"), PAGE_DELAY));

        HttpUrl url = server.takeRequest().getRequestUrl();
        assertThat(url.encodedPath()).isEqualTo("/vacancies");
        assertThat(url.queryParameter("text")).isEqualTo("Data Scientist");
        assertThat(url.queryParameter("area")).isEqualTo("2");
        assertThat(url.queryParameter("per_page")).isEqualTo("50");
        assertThat(url.queryParameter("page")).isEqualTo("0");
        assertThat(url.queryParameter("date_from")).isEqualTo("2025-09-01");
        assertThat(url.queryParameter("date_to")).isEqualTo("2025-09-24");
        assertThat(url.queryParameterValues("employment")).containsExactly("full", "part");
        assertThat(url.queryParameterValues("schedule")).containsExactly("remote");
    }

    @Test
    void absentCriteriaAreNotSent() throws Exception {
        server.enqueue(json(pageJson(1, "a")));
        SearchCriteria criteria = new SearchCriteria(null, "1", DateWindow.open(), List.of(), List.of(), 100, null);

        ids(paginator.stream(criteria, Map.of(), PAGE_DELAY));

        HttpUrl url = server.takeRequest().getRequestUrl();
        assertThat(url.queryParameterNames()).containsExactlyInAnyOrder("area", "per_page", "page");
    }

    @Test
    void fatalPageErrorPropagates() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if ("1".equals(request.getRequestUrl().queryParameter("page"))) {
                    return new MockResponse().setResponseCode(403);
                }
                return json(pageJson(3, "ok"));
            }
        });

        Stream<JsonNode> stream = paginator.stream(criteria(null), Map.of(), PAGE_DELAY);

        assertThatThrownBy(() -> ids(stream))
            .isInstanceOfSatisfying(FatalHttpException.class, e -> assertThat(e.statusCode()).isEqualTo(403));
        assertThat(server.getRequestCount()).isEqualTo(2);
    }
}
