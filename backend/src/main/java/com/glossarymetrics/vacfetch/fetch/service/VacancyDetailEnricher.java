package com.glossarymetrics.vacfetch.fetch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glossarymetrics.vacfetch.config.FetcherProperties;
import com.glossarymetrics.vacfetch.fetch.http.FatalHttpException;
import com.glossarymetrics.vacfetch.fetch.http.ResilientHttpClient;
import com.glossarymetrics.vacfetch.fetch.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

@Service
public class VacancyDetailEnricher {
    private static final Logger log = LoggerFactory.getLogger(VacancyDetailEnricher.class);

    private final ResilientHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBaseUrl;

    public VacancyDetailEnricher(ResilientHttpClient httpClient, ObjectMapper objectMapper, FetcherProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBaseUrl = properties.getApiBaseUrl();
    }

    // failures are per record; pacing between calls is the caller's job
    public Optional<JsonNode> fetchDetail(String vacancyId, Map<String, String> headers) {
        if (vacancyId == null || vacancyId.isBlank()) {
            return Optional.empty();
        }
        try {
            HttpFetchResult result = httpClient.execute(detailUri(vacancyId.trim()), headers);
            JsonNode detail = objectMapper.readTree(result.body() == null ? "" : result.body());
            if (detail == null || !detail.isObject()) {
                log.warn("Vacancy detail {} is not a JSON object", vacancyId);
                return Optional.empty();
            }
            return Optional.of(detail);
        } catch (FatalHttpException e) {
            log.warn("Vacancy detail {} unavailable (status={}): {}", vacancyId, e.statusCode(), e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse vacancy detail {}", vacancyId, e);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Vacancy detail {} skipped: {}", vacancyId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    URI detailUri(String vacancyId) {
        return UriComponentsBuilder.fromUriString(apiBaseUrl)
            .pathSegment("vacancies", vacancyId)
            .build()
            .encode()
            .toUri();
    }
}
