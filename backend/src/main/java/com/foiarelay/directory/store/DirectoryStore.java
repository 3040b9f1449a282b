package com.foiarelay.directory.store;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.persistence.DirectoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory view of the canonical directory, reloaded from the repository once the
 * cached snapshot is older than the configured TTL.
 *
 * <p>Readers racing at expiry may each trigger a reload. A reload only publishes its result
 * when no {@link #replaceAll} or {@link #invalidate} happened since it began, so a slow
 * reader can never hide a freshly written directory behind its older copy.
 */
@Service
public class DirectoryStore {
    private static final Logger log = LoggerFactory.getLogger(DirectoryStore.class);

    private final DirectoryRepository repository;
    private final Clock clock;
    private final Duration ttl;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();
    private final AtomicLong generation = new AtomicLong();

    public DirectoryStore(DirectoryRepository repository, DirectoryProperties properties, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.ttl = Duration.ofMinutes(properties.getStore().getCacheTtlMinutes());
    }

    public List<CanonicalRecord> records() {
        Snapshot current = snapshot.get();
        Instant now = clock.instant();
        if (current != null && !current.isExpired(now, ttl)) {
            return current.records();
        }
        long observedGeneration = generation.get();
        List<CanonicalRecord> loaded = List.copyOf(repository.loadAll());
        log.debug("Loaded {} directory record(s) from {} backend", loaded.size(), repository.backend());
        Snapshot fresh = new Snapshot(loaded, now);
        if (generation.get() == observedGeneration && snapshot.compareAndSet(current, fresh)) {
            return loaded;
        }
        Snapshot newer = snapshot.get();
        if (newer == null) {
            log.debug("Directory invalidated during reload; serving the records just loaded");
            return loaded;
        }
        log.debug("Directory replaced during reload; discarding the records just loaded");
        return newer.records();
    }

    public Optional<CanonicalRecord> findByUnitId(String unitId) {
        if (unitId == null || unitId.isBlank()) {
            return Optional.empty();
        }
        String wanted = unitId.trim();
        return records().stream()
            .filter(record -> wanted.equals(record.unitId()))
            .findFirst();
    }

    public void replaceAll(List<CanonicalRecord> records) {
        List<CanonicalRecord> safe = records == null ? List.of() : List.copyOf(records);
        repository.replaceAll(safe);
        generation.incrementAndGet();
        snapshot.set(new Snapshot(safe, clock.instant()));
    }

    public void invalidate() {
        generation.incrementAndGet();
        snapshot.set(null);
    }

    private record Snapshot(List<CanonicalRecord> records, Instant loadedAt) {
        boolean isExpired(Instant now, Duration ttl) {
            return !now.isBefore(loadedAt.plus(ttl));
        }
    }
}
