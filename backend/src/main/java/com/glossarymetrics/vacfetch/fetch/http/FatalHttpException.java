package com.glossarymetrics.vacfetch.fetch.http;

public class FatalHttpException extends RuntimeException {
    private final String url;
    private final int statusCode;

    public FatalHttpException(String url, int statusCode, String message) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
    }

    public FatalHttpException(String url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public String url() {
        return url;
    }

    // 0 when no response was received
    public int statusCode() {
        return statusCode;
    }
}
