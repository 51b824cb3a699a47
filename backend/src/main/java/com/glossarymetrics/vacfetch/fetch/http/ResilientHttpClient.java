package com.glossarymetrics.vacfetch.fetch.http;

import com.glossarymetrics.vacfetch.config.FetcherProperties;
import com.glossarymetrics.vacfetch.fetch.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class ResilientHttpClient {
    private static final Logger log = LoggerFactory.getLogger(ResilientHttpClient.class);

    private final HttpClient client;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Duration requestTimeout;
    private final String defaultUserAgent;

    public ResilientHttpClient(FetcherProperties properties, Sleeper sleeper) {
        this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(requestTimeout)
            .version(HttpClient.Version.HTTP_1_1)
            .build();
        this.retryPolicy = RetryPolicy.from(properties.getRetry());
        this.sleeper = sleeper;
        this.defaultUserAgent = properties.getUserAgent();
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public HttpFetchResult execute(String url, MultiValueMap<String, String> queryParams, Map<String, String> headers) {
        return execute(buildUri(url, queryParams), headers);
    }

    public HttpFetchResult execute(URI uri, Map<String, String> headers) {
        RetryState state = retryPolicy.start();
        while (true) {
            HttpFetchResult result;
            try {
                result = executeOnce(uri, headers, state.attempt());
            } catch (HttpTimeoutException e) {
                state = retryOrFail(uri, 0, "timeout", state, e);
                continue;
            } catch (IOException e) {
                state = retryOrFail(uri, 0, "io_error", state, e);
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FatalHttpException(uri.toString(), 0, "Interrupted while requesting " + uri, e);
            }

            if (result.isSuccessful()) {
                return result;
            }
            int status = result.statusCode();
            if (!retryPolicy.isRetryableStatus(status)) {
                throw new FatalHttpException(uri.toString(), status, "HTTP " + status + " for " + uri);
            }
            state = retryOrFail(uri, status, "http_" + status, state, null);
        }
    }

    private RetryState retryOrFail(URI uri, int status, String reason, RetryState state, Exception cause) {
        if (!state.hasAttemptsLeft(retryPolicy)) {
            String message = "Giving up on " + uri + " after " + state.attempt() + " attempts (" + reason + ")";
            if (cause != null) {
                throw new FatalHttpException(uri.toString(), status, message, cause);
            }
            throw new FatalHttpException(uri.toString(), status, message);
        }
        log.warn(
            "Transient failure {} for {}; retrying in {} ms (attempt {}/{})",
            reason,
            uri,
            state.backoff().toMillis(),
            state.attempt(),
            retryPolicy.maxAttempts()
        );
        try {
            sleeper.sleep(state.backoff());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalHttpException(uri.toString(), status, "Interrupted during backoff for " + uri, e);
        }
        return state.next(retryPolicy);
    }

    private HttpFetchResult executeOnce(URI uri, Map<String, String> headers, int attempt)
        throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(requestTimeout)
            .header("Accept", "application/json");
        boolean userAgentSet = false;
        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                if (header.getKey() == null || header.getValue() == null) {
                    continue;
                }
                if ("User-Agent".equalsIgnoreCase(header.getKey())) {
                    builder.header("User-Agent", FetcherProperties.normalizeUserAgent(header.getValue()));
                    userAgentSet = true;
                } else {
                    builder.setHeader(header.getKey(), header.getValue());
                }
            }
        }
        if (!userAgentSet) {
            builder.header("User-Agent", defaultUserAgent);
        }

        HttpResponse<byte[]> response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofByteArray());
        byte[] responseBytes = response.body();
        return new HttpFetchResult(
            uri.toString(),
            response.statusCode(),
            responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
            attempt
        );
    }

    // values go through URI variables so that reserved characters such as '+' are encoded
    static URI buildUri(String url, MultiValueMap<String, String> queryParams) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        Map<String, String> variables = new HashMap<>();
        MultiValueMap<String, String> params = queryParams == null ? new LinkedMultiValueMap<>() : queryParams;
        int index = 0;
        for (Map.Entry<String, List<String>> entry : params.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            for (String value : entry.getValue()) {
                if (value == null) {
                    continue;
                }
                String variable = "p" + index++;
                variables.put(variable, value);
                builder.queryParam(entry.getKey(), "{" + variable + "}");
            }
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }
}
