package com.foiarelay.directory.http;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);

        DirectoryProperties properties = new DirectoryProperties();
        properties.setGlobalConcurrency(1);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(2);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        properties.setUserAgent("foia-relay-test/1.0");
        client = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesServerErrorsUntilSuccess() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"ok\":true}"));

        HttpFetchResult result = client.get(server.url("/data").toString(), "application/json");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.body()).isEqualTo("{\"ok\":true}");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void clientErrorsAreNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(404));

        HttpFetchResult result = client.get(server.url("/missing").toString(), "text/html");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.describeFailure()).isEqualTo("http_404");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void sendsUserAgentAndNonBlankExtraHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        client.get(server.url("/headers").toString(), "application/json", Map.of("X-API-Key", "k1", "X-Empty", " "));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("User-Agent")).isEqualTo("foia-relay-test/1.0");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
        assertThat(request.getHeader("X-API-Key")).isEqualTo("k1");
        assertThat(request.getHeader("X-Empty")).isNull();
    }

    @Test
    void malformedUrlIsReportedWithoutRequest() {
        HttpFetchResult result = client.get("http://bad host/with spaces", "text/html");

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(server.getRequestCount()).isZero();
    }
}
