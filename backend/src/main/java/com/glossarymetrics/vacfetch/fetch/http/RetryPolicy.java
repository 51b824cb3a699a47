package com.glossarymetrics.vacfetch.fetch.http;

import com.glossarymetrics.vacfetch.config.FetcherProperties;

import java.time.Duration;

public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(30));

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        initialBackoff = initialBackoff == null || initialBackoff.isNegative() ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0 ? initialBackoff : maxBackoff;
    }

    public static RetryPolicy from(FetcherProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.initialBackoff(), retry.maxBackoff());
    }

    public RetryState start() {
        return new RetryState(1, initialBackoff);
    }

    public boolean isRetryableStatus(int status) {
        return status == 429 || (status >= 500 && status < 600);
    }
}
