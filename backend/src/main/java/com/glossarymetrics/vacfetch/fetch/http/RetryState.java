package com.glossarymetrics.vacfetch.fetch.http;

import java.time.Duration;

public record RetryState(int attempt, Duration backoff) {

    public boolean hasAttemptsLeft(RetryPolicy policy) {
        return attempt < policy.maxAttempts();
    }

    public RetryState next(RetryPolicy policy) {
        Duration doubled = backoff.multipliedBy(2);
        Duration capped = doubled.compareTo(policy.maxBackoff()) > 0 ? policy.maxBackoff() : doubled;
        return new RetryState(attempt + 1, capped);
    }
}
