package com.foiarelay.directory.scrape;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * A long-lived execution context: one thread plus the page session confined to it.
 * The session is opened lazily on that thread and reused by every task the worker runs.
 */
final class ScrapeWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScrapeWorker.class);
    private static final long CLOSE_WAIT_SECONDS = 10;

    private final int index;
    private final PageSessionFactory sessionFactory;
    private final ExecutorService thread;
    private PageSession session;

    ScrapeWorker(int index, PageSessionFactory sessionFactory) {
        this.index = index;
        this.sessionFactory = sessionFactory;
        this.thread = Executors.newSingleThreadExecutor(runnable -> {
            Thread worker = new Thread(runnable, "scrape-worker-" + index);
            worker.setDaemon(true);
            return worker;
        });
    }

    /** {@code onStart} runs on the worker thread just before the session is obtained. */
    <T> Future<T> submit(Runnable onStart, Function<PageSession, T> task) {
        return thread.submit(() -> {
            onStart.run();
            return task.apply(session());
        });
    }

    private PageSession session() {
        if (session == null) {
            session = sessionFactory.open(index);
        }
        return session;
    }

    @Override
    public void close() {
        thread.submit(() -> {
            if (session != null) {
                try {
                    session.close();
                } catch (RuntimeException e) {
                    log.warn("Failed to close page session for worker {}", index, e);
                }
                session = null;
            }
        });
        thread.shutdown();
        try {
            if (!thread.awaitTermination(CLOSE_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Scrape worker {} did not stop within {}s; interrupting", index, CLOSE_WAIT_SECONDS);
                thread.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            thread.shutdownNow();
        }
    }
}
