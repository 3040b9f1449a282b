package com.foiarelay.directory.store;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.persistence.DirectoryRepository;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DirectoryStoreTest {

    @Test
    void servesCachedRecordsUntilTtlExpires() {
        CountingRepository repository = new CountingRepository(List.of(record("a")));
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        DirectoryStore store = new DirectoryStore(repository, properties(60), clock);

        assertThat(store.records()).extracting(CanonicalRecord::unitId).containsExactly("a");
        repository.stored = List.of(record("b"));
        clock.advance(Duration.ofMinutes(59));
        assertThat(store.records()).extracting(CanonicalRecord::unitId).containsExactly("a");
        assertThat(repository.loads).isEqualTo(1);

        clock.advance(Duration.ofMinutes(1));
        assertThat(store.records()).extracting(CanonicalRecord::unitId).containsExactly("b");
        assertThat(repository.loads).isEqualTo(2);
    }

    @Test
    void replaceAllWritesThroughAndRefreshesCache() {
        CountingRepository repository = new CountingRepository(List.of(record("a")));
        DirectoryStore store = new DirectoryStore(repository, properties(60), new MutableClock(Instant.EPOCH));

        store.replaceAll(List.of(record("x"), record("y")));

        assertThat(repository.stored).extracting(CanonicalRecord::unitId).containsExactly("x", "y");
        assertThat(store.records()).extracting(CanonicalRecord::unitId).containsExactly("x", "y");
        assertThat(repository.loads).isZero();
    }

    @Test
    void invalidateForcesReload() {
        CountingRepository repository = new CountingRepository(List.of(record("a")));
        DirectoryStore store = new DirectoryStore(repository, properties(60), new MutableClock(Instant.EPOCH));

        store.records();
        store.invalidate();
        store.records();

        assertThat(repository.loads).isEqualTo(2);
    }

    @Test
    void reloadInFlightDoesNotHideConcurrentReplace() throws Exception {
        BlockingRepository repository = new BlockingRepository(List.of(record("old")));
        DirectoryStore store = new DirectoryStore(repository, properties(60), new MutableClock(Instant.EPOCH));
        ExecutorService reader = Executors.newSingleThreadExecutor();
        try {
            Future<List<CanonicalRecord>> inFlight = reader.submit(store::records);
            assertThat(repository.loadStarted.await(5, TimeUnit.SECONDS)).isTrue();

            store.replaceAll(List.of(record("new")));
            repository.releaseLoad.countDown();

            assertThat(inFlight.get(5, TimeUnit.SECONDS)).extracting(CanonicalRecord::unitId).containsExactly("new");
            assertThat(store.records()).extracting(CanonicalRecord::unitId).containsExactly("new");
            assertThat(repository.loads.get()).isEqualTo(1);
        } finally {
            repository.releaseLoad.countDown();
            reader.shutdownNow();
        }
    }

    @Test
    void findsByUnitId() {
        CountingRepository repository = new CountingRepository(List.of(record("a"), record("b")));
        DirectoryStore store = new DirectoryStore(repository, properties(60), new MutableClock(Instant.EPOCH));

        assertThat(store.findByUnitId(" b ")).map(CanonicalRecord::unitId).contains("b");
        assertThat(store.findByUnitId("missing")).isEmpty();
        assertThat(store.findByUnitId(null)).isEmpty();
    }

    private static DirectoryProperties properties(long ttlMinutes) {
        DirectoryProperties properties = new DirectoryProperties();
        properties.getStore().setCacheTtlMinutes(ttlMinutes);
        return properties;
    }

    private static CanonicalRecord record(String unitId) {
        return new CanonicalRecord(unitId, "Unit " + unitId, "", "", "", List.of(), "", "", "", "", Instant.EPOCH);
    }

    private static final class CountingRepository implements DirectoryRepository {
        private List<CanonicalRecord> stored;
        private int loads;

        private CountingRepository(List<CanonicalRecord> stored) {
            this.stored = new ArrayList<>(stored);
        }

        @Override
        public List<CanonicalRecord> loadAll() {
            loads++;
            return stored;
        }

        @Override
        public void replaceAll(List<CanonicalRecord> records) {
            stored = new ArrayList<>(records);
        }

        @Override
        public String backend() {
            return "memory";
        }
    }

    /** Hands out the list it held when a load began, after the test lets the load finish. */
    private static final class BlockingRepository implements DirectoryRepository {
        private final CountDownLatch loadStarted = new CountDownLatch(1);
        private final CountDownLatch releaseLoad = new CountDownLatch(1);
        private final AtomicInteger loads = new AtomicInteger();
        private volatile List<CanonicalRecord> stored;

        private BlockingRepository(List<CanonicalRecord> stored) {
            this.stored = List.copyOf(stored);
        }

        @Override
        public List<CanonicalRecord> loadAll() {
            List<CanonicalRecord> atStart = stored;
            loads.incrementAndGet();
            loadStarted.countDown();
            try {
                if (!releaseLoad.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("load was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return atStart;
        }

        @Override
        public void replaceAll(List<CanonicalRecord> records) {
            stored = List.copyOf(records);
        }

        @Override
        public String backend() {
            return "blocking";
        }
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
