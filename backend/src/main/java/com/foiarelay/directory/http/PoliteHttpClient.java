package com.foiarelay.directory.http;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Shared outbound HTTP client for the registry API and static page fetches.
 *
 * <p>Never throws for transport problems: every failure is reported through
 * {@link HttpFetchResult#errorCode()} so callers can decide whether to degrade.
 * Requests to one host are spaced by {@code perHostDelayMs}; a 403 or 429 pushes
 * that host back by {@link #THROTTLED_COOLDOWN}.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final Duration THROTTLED_COOLDOWN = Duration.ofSeconds(30);

    private final DirectoryProperties properties;
    private final HttpClient client;
    private final Semaphore inFlight;
    private final Map<String, HostGate> gates = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        DirectoryProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .executor(httpExecutor)
            .build();
        this.inFlight = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String accept) {
        return get(url, accept, Map.of());
    }

    /** GET with retries on timeouts, transport errors, 408 and 5xx. Blank header values are skipped. */
    public HttpFetchResult get(String url, String accept, Map<String, String> headers) {
        return get(url, accept, headers, null);
    }

    /**
     * As {@link #get(String, String, Map)}, with each attempt limited to {@code timeout} when
     * that is shorter than the configured request timeout.
     */
    public HttpFetchResult get(String url, String accept, Map<String, String> headers, Duration timeout) {
        Duration attemptTimeout = attemptTimeout(timeout);
        int attempts = 1 + properties.getRequestMaxRetries();
        int attempt = 1;
        HttpFetchResult result = fetch(url, accept, headers, attemptTimeout, attempt);
        while (attempt < attempts && isRetryable(result)) {
            long delayMs = retryDelayMs(attempt);
            log.debug("Retrying {} after {} ({} ms)", url, result.describeFailure(), delayMs);
            if (!pause(delayMs)) {
                break;
            }
            attempt++;
            result = fetch(url, accept, headers, attemptTimeout, attempt);
        }
        return result;
    }

    private HttpFetchResult fetch(
        String url,
        String accept,
        Map<String, String> headers,
        Duration timeout,
        int attempt
    ) {
        Instant started = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return failure(url, started, attempt, "invalid_url", "URL missing host or malformed");
        }
        HostGate gate = gates.computeIfAbsent(uri.getHost().toLowerCase(Locale.ROOT), host -> new HostGate());

        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(url, started, attempt, "interrupted", e.getMessage());
        }
        try {
            gate.awaitTurn(properties.getPerHostDelayMs());
            HttpResponse<byte[]> response = client.send(buildRequest(uri, accept, headers, timeout), HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status == 403 || status == 429) {
                gate.coolDown(THROTTLED_COOLDOWN);
                log.info("Host {} answered {}; cooling down for {}", uri.getHost(), status, THROTTLED_COOLDOWN);
            }
            byte[] body = response.body();
            return new HttpFetchResult(
                url,
                response.uri(),
                status,
                body == null ? null : new String(body, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(started, Instant.now()),
                attempt,
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return failure(url, started, attempt, "timeout", e.getMessage());
        } catch (IOException e) {
            return failure(url, started, attempt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(url, started, attempt, "interrupted", e.getMessage());
        } catch (RuntimeException e) {
            return failure(url, started, attempt, "http_error", e.getMessage());
        } finally {
            inFlight.release();
        }
    }

    private HttpRequest buildRequest(URI uri, String accept, Map<String, String> headers, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", accept == null || accept.isBlank() ? "*/*" : accept);
        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                if (header.getValue() != null && !header.getValue().isBlank()) {
                    builder.header(header.getKey(), header.getValue());
                }
            }
        }
        return builder.GET().build();
    }

    private Duration attemptTimeout(Duration requested) {
        Duration configured = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        if (requested == null || requested.isZero() || requested.isNegative() || requested.compareTo(configured) > 0) {
            return configured;
        }
        return requested;
    }

    static boolean isRetryable(HttpFetchResult result) {
        String code = result.errorCode();
        if (code != null) {
            return !"invalid_url".equals(code) && !"interrupted".equals(code);
        }
        return result.statusCode() == 408 || result.statusCode() >= 500;
    }

    /** Exponential from the base delay, capped, then jittered into the upper half. */
    long retryDelayMs(int attempt) {
        long base = properties.getRequestRetryBaseDelayMs();
        if (base <= 0) {
            return 0;
        }
        long delay = base << Math.min(attempt - 1, 20);
        long cap = properties.getRequestRetryMaxDelayMs();
        if (cap > 0 && delay > cap) {
            delay = cap;
        }
        long half = delay / 2;
        return half + ThreadLocalRandom.current().nextLong(Math.max(1, delay - half));
    }

    private static boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static HttpFetchResult failure(String url, Instant started, int attempt, String code, String message) {
        Instant now = Instant.now();
        return new HttpFetchResult(url, null, 0, null, null, now, Duration.between(started, now), attempt, code, message);
    }

    private static URI toUri(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** Earliest instant the next request to one host may go out. */
    private static final class HostGate {
        private Instant nextAllowedAt = Instant.EPOCH;

        synchronized void awaitTurn(long spacingMs) throws InterruptedException {
            long waitMs = Duration.between(Instant.now(), nextAllowedAt).toMillis();
            if (waitMs > 0) {
                Thread.sleep(waitMs);
            }
            nextAllowedAt = Instant.now().plusMillis(spacingMs);
        }

        synchronized void coolDown(Duration duration) {
            Instant candidate = Instant.now().plus(duration);
            if (candidate.isAfter(nextAllowedAt)) {
                nextAllowedAt = candidate;
            }
        }
    }
}
