package com.di.fleetnova.source;

import com.di.fleetnova.config.ApiProperties;
import com.di.fleetnova.exception.FetchException;
import com.di.fleetnova.util.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;

/**
 * {@link FleetDataSource} backed by the Hoppe fleet REST API.
 *
 * <p>I/O failures (timeouts, refused connections) are retried by a Resilience4j
 * {@link Retry}: up to {@code fleetnova.api.max-retries} attempts, waiting
 * {@code backoff-base * 2^n} before retry n (0-based). HTTP error statuses are not retried:
 * their JSON body is handed back as-is.
 */
@Slf4j
public class HoppeApiDataSource implements FleetDataSource {

    static final String RETRY_NAME = "hoppe-api";

    private final RestClient restClient;
    private final String baseUrl;
    private final Retry retry;
    private final ObjectMapper mapper = JsonMappers.raw();

    /**
     * @param builder pre-configured builder (request factory, timeouts); tests bind a mock server to it
     */
    public HoppeApiDataSource(ApiProperties props, RestClient.Builder builder) {
        this.baseUrl = props.getBaseUrl().endsWith("/") ? props.getBaseUrl() : props.getBaseUrl() + "/";
        this.retry = Retry.of(RETRY_NAME, retryConfig(props));
        this.retry.getEventPublisher().onRetry(event -> log.warn("[FETCH] attempt {} failed, retrying in {} ms: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable().getMessage()));
        this.restClient = builder
                .defaultHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + props.getApiKey())
                .build();
    }

    @Override
    public JsonNode fetch(String vesselId, ResourceKind kind) {
        if (kind.isPerVessel() && (vesselId == null || vesselId.isBlank())) {
            throw new IllegalArgumentException(kind + " requires a vessel id");
        }
        String template = baseUrl + kind.getPathTemplate();

        Response response;
        try {
            response = retry.executeSupplier(() -> kind.isPerVessel()
                    ? exchange(restClient.get().uri(template, vesselId))
                    : exchange(restClient.get().uri(template)));
        } catch (ResourceAccessException e) {
            throw new FetchException(String.format("%s vessel=%s: giving up after %d attempt(s)",
                    kind, vesselId, retry.getRetryConfig().getMaxAttempts()), e);
        }
        return parse(response, kind, vesselId);
    }

    /** Retries only I/O failures; backoff doubles from {@code backoff-base} (at least 1 ms). */
    static RetryConfig retryConfig(ApiProperties props) {
        return RetryConfig.custom()
                .maxAttempts(props.getMaxRetries())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1L, props.getBackoffBase().toMillis()), 2.0))
                .retryExceptions(ResourceAccessException.class)
                .build();
    }

    Retry retry() {
        return retry;
    }

    private Response exchange(RestClient.RequestHeadersSpec<?> spec) {
        return spec.accept(MediaType.APPLICATION_JSON)
                .exchange((request, response) -> new Response(
                        response.getStatusCode().value(),
                        new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8)));
    }

    private JsonNode parse(Response response, ResourceKind kind, String vesselId) {
        try {
            JsonNode body = mapper.readTree(response.body());
            if (body == null || body.isMissingNode()) {
                throw new FetchException(String.format("%s vessel=%s: empty body (HTTP %d)",
                        kind, vesselId, response.status()));
            }
            if (response.status() >= 400) {
                log.warn("[FETCH] {} vessel={} answered HTTP {}", kind, vesselId, response.status());
            }
            return body;
        } catch (JsonProcessingException e) {
            throw new FetchException(String.format("%s vessel=%s: non-JSON body (HTTP %d)",
                    kind, vesselId, response.status()), e);
        }
    }

    private record Response(int status, String body) {
    }
}
