package com.glossarymetrics.vacfetch.fetch.service;

public class FetchConfigurationException extends RuntimeException {
    public FetchConfigurationException(String message) {
        super(message);
    }
}
