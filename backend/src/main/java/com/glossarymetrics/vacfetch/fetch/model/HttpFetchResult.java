package com.glossarymetrics.vacfetch.fetch.model;

public record HttpFetchResult(String requestedUrl, int statusCode, String body, int attempts) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
