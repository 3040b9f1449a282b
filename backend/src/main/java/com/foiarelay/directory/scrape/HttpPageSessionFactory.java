package com.foiarelay.directory.scrape;

import com.foiarelay.directory.extract.PageSnapshots;
import com.foiarelay.directory.http.PoliteHttpClient;
import com.foiarelay.directory.model.HttpFetchResult;
import com.foiarelay.directory.model.PageSnapshot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Browserless sessions for pages whose contact block is already in the served markup.
 * Nothing is rendered, so reveal and settle are no-ops. The navigation timeout bounds each
 * fetch attempt; configured retries may add further attempts.
 */
@Component
@ConditionalOnProperty(prefix = "directory.scrape", name = "engine", havingValue = "http")
public class HttpPageSessionFactory implements PageSessionFactory {
    private final PoliteHttpClient httpClient;

    public HttpPageSessionFactory(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String engine() {
        return "http";
    }

    @Override
    public PageSession open(int workerIndex) {
        return new HttpPageSession(httpClient);
    }

    static final class HttpPageSession implements PageSession {
        private final PoliteHttpClient httpClient;
        private String currentUrl;
        private String currentHtml;

        HttpPageSession(PoliteHttpClient httpClient) {
            this.httpClient = httpClient;
        }

        @Override
        public void navigate(String url, Duration timeout) {
            currentUrl = null;
            currentHtml = null;
            HttpFetchResult result = httpClient.get(url, "text/html,application/xhtml+xml", Map.of(), timeout);
            if (!result.isSuccessful()) {
                throw new PageSessionException("Fetch failed for " + url + ": " + result.describeFailure());
            }
            currentUrl = result.finalUrlOrRequested();
            currentHtml = result.body();
        }

        @Override
        public void settle(Duration duration) {
        }

        @Override
        public boolean reveal(String label, Duration settle) {
            return false;
        }

        @Override
        public PageSnapshot capture() {
            if (currentUrl == null) {
                throw new IllegalStateException("capture() called before a successful navigate()");
            }
            return PageSnapshots.fromHtml(currentUrl, currentHtml);
        }

        @Override
        public void close() {
            currentUrl = null;
            currentHtml = null;
        }
    }
}
