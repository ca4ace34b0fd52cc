package com.nomadtap.tap.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nomadtap.tap.config.TapNomadProperties;
import com.nomadtap.tap.error.SourceRequestException;
import com.nomadtap.tap.error.SourceUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Thin client over the Nomad HTTP API list endpoints.
 *
 * Pagination: {@code per_page} and {@code next_token} query parameters, the continuation token
 * comes back in the {@code X-Nomad-NextToken} header.
 *
 * Failures: 5xx, 429 and connection errors are retried with exponential backoff and surface as
 * {@link SourceUnavailableException} once the attempts run out. Any other 4xx fails immediately
 * with {@link SourceRequestException}.
 */
@Service
@Slf4j
public class NomadApiClient {

    public static final String NEXT_TOKEN_HEADER = "X-Nomad-NextToken";
    public static final String TOKEN_HEADER = "X-Nomad-Token";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TapNomadProperties properties;
    private final RetryConfig retryConfig;

    public NomadApiClient(RestTemplate nomadRestTemplate, ObjectMapper objectMapper, TapNomadProperties properties) {
        this.restTemplate = nomadRestTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;

        TapNomadProperties.Retry retry = properties.getRetry();
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, retry.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        retry.getInitialBackoff(), retry.getMultiplier(), retry.getMaxBackoff()))
                .retryOnException(TransientFailure.class::isInstance)
                .build();
    }

    /**
     * Start a fresh paginated listing of {@code path}.
     *
     * @param path   endpoint relative to the base URL, e.g. {@code /v1/jobs}
     * @param params extra query parameters (filters); namespace, region and page size are added here
     */
    public PageCursor fetchPages(String path, Map<String, String> params) {
        return new PageCursor(this, path, params);
    }

    /**
     * Lazily flatten every page of {@code path} into its raw elements.
     */
    public Iterator<JsonNode> fetch(String path, Map<String, String> params) {
        return new ElementIterator(fetchPages(path, params));
    }

    Page fetchPage(String path, Map<String, String> params, String nextToken) {
        URI uri = buildUri(path, params, nextToken);
        Retry retry = Retry.of("nomad" + path, retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} (attempt {}) after {}: {}",
                uri, event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        try {
            return retry.executeSupplier(() -> callApi(path, uri));
        } catch (TransientFailure e) {
            log.error("Giving up on {} after {} attempts", uri, retryConfig.getMaxAttempts());
            throw new SourceUnavailableException(path, retryConfig.getMaxAttempts(), e.getCause() != null ? e.getCause() : e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Page callApi(String path, URI uri) {
        log.debug("Calling Nomad API: {}", uri);
        applyRateLimit();
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(requestHeaders()), String.class);
            Page page = toPage(path, response);
            log.debug("API returned {} items for {} (next token: {})", page.items().size(), uri, page.nextToken());
            return page;

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by Nomad API on {}", path);
            throw new TransientFailure(e);

        } catch (HttpClientErrorException e) {
            throw new SourceRequestException(path, e.getStatusCode().value(), e.getResponseBodyAsString());

        } catch (HttpServerErrorException e) {
            log.warn("Nomad API returned {} for {}", e.getStatusCode().value(), path);
            throw new TransientFailure(e);

        } catch (ResourceAccessException e) {
            log.warn("Nomad API unreachable for {}: {}", path, e.getMessage());
            throw new TransientFailure(e);
        }
    }

    private Page toPage(String path, ResponseEntity<String> response) {
        String body = response.getBody();
        List<JsonNode> items = new ArrayList<>();
        if (body != null && !body.isBlank()) {
            JsonNode root;
            try {
                root = objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                throw new SourceRequestException(path, response.getStatusCode().value(), "response is not valid JSON");
            }
            if (root.isArray()) {
                root.forEach(items::add);
            } else if (!root.isNull()) {
                throw new SourceRequestException(path, response.getStatusCode().value(), "expected a JSON array");
            }
        }
        String nextToken = response.getHeaders().getFirst(NEXT_TOKEN_HEADER);
        return new Page(items, nextToken == null || nextToken.isBlank() ? null : nextToken);
    }

    /**
     * Query values go in as template variables so they are encoded strictly: a literal {@code +}
     * in a token or namespace would otherwise reach Nomad as a space.
     */
    private URI buildUri(String path, Map<String, String> params, String nextToken) {
        TapNomadProperties.Api api = properties.getApi();
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(stripTrailingSlash(api.getBaseUrl()) + path);
        Map<String, Object> vars = new LinkedHashMap<>();

        if (api.getNamespace() != null && !api.getNamespace().isBlank()) {
            addQueryVar(builder, vars, "namespace", api.getNamespace());
        }
        if (api.getRegion() != null && !api.getRegion().isBlank()) {
            addQueryVar(builder, vars, "region", api.getRegion());
        }
        if (api.getPageSize() > 0) {
            builder.queryParam("per_page", api.getPageSize());
        }
        params.forEach((name, value) -> addQueryVar(builder, vars, name, value));
        if (nextToken != null) {
            addQueryVar(builder, vars, "next_token", nextToken);
        }
        return builder.encode().buildAndExpand(vars).toUri();
    }

    private static void addQueryVar(UriComponentsBuilder builder, Map<String, Object> vars, String name, String value) {
        String var = "v" + vars.size();
        builder.queryParam(name, "{" + var + "}");
        vars.put(var, value);
    }

    private HttpHeaders requestHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        String token = properties.getApi().getToken();
        if (token != null && !token.isBlank()) {
            headers.set(TOKEN_HEADER, token);
        }
        return headers;
    }

    private void applyRateLimit() {
        long delayMs = properties.getApi().getRequestDelay().toMillis();
        if (delayMs > 0) {
            sleepMs(delayMs);
        }
    }

    private void sleepMs(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /** Marks a failure as worth retrying; never escapes this class. */
    private static final class TransientFailure extends RuntimeException {
        TransientFailure(Throwable cause) {
            super(cause.getMessage(), cause);
        }
    }

    private static final class ElementIterator implements Iterator<JsonNode> {

        private final PageCursor cursor;
        private Iterator<JsonNode> current = Collections.emptyIterator();

        ElementIterator(PageCursor cursor) {
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                Optional<Page> page = cursor.nextPage();
                if (page.isEmpty()) {
                    return false;
                }
                current = page.get().items().iterator();
            }
            return true;
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
