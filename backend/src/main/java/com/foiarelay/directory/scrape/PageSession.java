package com.foiarelay.directory.scrape;

import com.foiarelay.directory.model.PageSnapshot;

import java.time.Duration;

/**
 * One reusable page context owned by a single scrape worker. Implementations may be
 * thread-confined: every call for a given session arrives on the same worker thread.
 */
public interface PageSession extends AutoCloseable {

    /**
     * @throws PageSessionException when the page cannot be loaded within {@code timeout}
     */
    void navigate(String url, Duration timeout);

    void settle(Duration duration);

    /**
     * Clicks the affordance labelled {@code label} when the current page has one, then waits
     * {@code settle}. Returns false when there was nothing to reveal.
     */
    boolean reveal(String label, Duration settle);

    PageSnapshot capture();

    @Override
    void close();
}
