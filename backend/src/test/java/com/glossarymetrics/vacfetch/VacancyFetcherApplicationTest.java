package com.glossarymetrics.vacfetch;

import com.glossarymetrics.vacfetch.config.FetcherProperties;
import com.glossarymetrics.vacfetch.fetch.http.ResilientHttpClient;
import com.glossarymetrics.vacfetch.fetch.service.VacancyFetchOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class VacancyFetcherApplicationTest {

    @Autowired
    private FetcherProperties properties;

    @Autowired
    private ResilientHttpClient httpClient;

    @Autowired
    private VacancyFetchOrchestrator orchestrator;

    @Test
    void contextWiresFetchEngineWithTestProperties() {
        assertThat(orchestrator).isNotNull();
        assertThat(properties.getCli().isRun()).isFalse();
        assertThat(properties.getApiBaseUrl()).isEqualTo("http://localhost:1");
        assertThat(httpClient.retryPolicy().maxAttempts()).isEqualTo(2);
        assertThat(properties.getSearch().getAreas()).isEqualTo("1");
    }
}
