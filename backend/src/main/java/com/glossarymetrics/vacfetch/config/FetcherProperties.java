package com.glossarymetrics.vacfetch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.Duration;
import java.time.LocalDate;

@ConfigurationProperties(prefix = "fetcher")
public class FetcherProperties {
    private static final String DEFAULT_USER_AGENT = "GlossaryMetricsVacFetcher/1.0 (+contact: your-email@example.com)";
    private static final String DEFAULT_API_BASE_URL = "https://api.hh.ru";

    private String apiBaseUrl = DEFAULT_API_BASE_URL;
    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private long requestDelayMs = 500;
    private long detailMinDelayMs = 250;
    private Retry retry = new Retry();
    private Search search = new Search();
    private Output output = new Output();
    private Cli cli = new Cli();

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
            this.apiBaseUrl = DEFAULT_API_BASE_URL;
            return;
        }
        String trimmed = apiBaseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.apiBaseUrl = trimmed;
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public long getRequestDelayMs() {
        return Math.max(0, requestDelayMs);
    }

    public void setRequestDelayMs(long requestDelayMs) {
        this.requestDelayMs = Math.max(0, requestDelayMs);
    }

    public long getDetailMinDelayMs() {
        return Math.max(0, detailMinDelayMs);
    }

    public void setDetailMinDelayMs(long detailMinDelayMs) {
        this.detailMinDelayMs = Math.max(0, detailMinDelayMs);
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Retry {
        private int maxAttempts = 5;
        private long initialBackoffMs = 1000;
        private long maxBackoffMs = 30000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getInitialBackoffMs() {
            return Math.max(0, initialBackoffMs);
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = Math.max(0, initialBackoffMs);
        }

        public long getMaxBackoffMs() {
            return Math.max(getInitialBackoffMs(), maxBackoffMs);
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = Math.max(0, maxBackoffMs);
        }

        public Duration initialBackoff() {
            return Duration.ofMillis(getInitialBackoffMs());
        }

        public Duration maxBackoff() {
            return Duration.ofMillis(getMaxBackoffMs());
        }
    }

    public static class Search {
        private String text;
        private String areas = "1";
        private int perPage = 100;
        private Integer maxPages;
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate dateFrom;
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate dateTo;
        private Integer lastDays;
        private int windowDays = 1;
        private String employment = "";
        private String schedule = "";
        private boolean details;

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public String getAreas() {
            return areas;
        }

        public void setAreas(String areas) {
            this.areas = areas;
        }

        public int getPerPage() {
            return Math.min(100, Math.max(1, perPage));
        }

        public void setPerPage(int perPage) {
            this.perPage = Math.min(100, Math.max(1, perPage));
        }

        public Integer getMaxPages() {
            return maxPages == null ? null : Math.max(0, maxPages);
        }

        public void setMaxPages(Integer maxPages) {
            this.maxPages = maxPages == null ? null : Math.max(0, maxPages);
        }

        public LocalDate getDateFrom() {
            return dateFrom;
        }

        public void setDateFrom(LocalDate dateFrom) {
            this.dateFrom = dateFrom;
        }

        public LocalDate getDateTo() {
            return dateTo;
        }

        public void setDateTo(LocalDate dateTo) {
            this.dateTo = dateTo;
        }

        public Integer getLastDays() {
            return lastDays;
        }

        public void setLastDays(Integer lastDays) {
            this.lastDays = lastDays;
        }

        public int getWindowDays() {
            return Math.max(1, windowDays);
        }

        public void setWindowDays(int windowDays) {
            this.windowDays = Math.max(1, windowDays);
        }

        public String getEmployment() {
            return employment;
        }

        public void setEmployment(String employment) {
            this.employment = employment;
        }

        public String getSchedule() {
            return schedule;
        }

        public void setSchedule(String schedule) {
            this.schedule = schedule;
        }

        public boolean isDetails() {
            return details;
        }

        public void setDetails(boolean details) {
            this.details = details;
        }
    }

    public static class Output {
        private String path;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
