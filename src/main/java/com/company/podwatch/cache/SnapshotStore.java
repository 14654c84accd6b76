package com.company.podwatch.cache;

import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.ResourceSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory baseline: the last successfully persisted observation per resource.
 * The poll loop is the only writer; queries read immutable copies.
 */
@Component
@Slf4j
public class SnapshotStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Map<ResourceKey, ResourceSnapshot> baseline = Collections.emptyMap();
    private boolean initialized;
    private Instant lastSwapAt;

    /**
     * Replaces the whole baseline. Later snapshots for the same key win.
     */
    public void swap(Collection<ResourceSnapshot> snapshots) {
        Map<ResourceKey, ResourceSnapshot> next = index(snapshots);
        lock.writeLock().lock();
        try {
            baseline = next;
            initialized = true;
            lastSwapAt = Instant.now();
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Baseline swapped: {} resources", next.size());
    }

    /**
     * Restores a baseline from persisted state. An empty collection leaves the store uninitialized so the
     * next cycle is treated as the first one.
     */
    public void seed(Collection<ResourceSnapshot> persisted) {
        if (persisted == null || persisted.isEmpty()) {
            log.info("No persisted state, first cycle will establish the baseline");
            return;
        }
        swap(persisted);
        log.info("Baseline restored from persisted state: {} resources", persisted.size());
    }

    public boolean isInitialized() {
        lock.readLock().lock();
        try {
            return initialized;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return an immutable copy keyed and ordered by resource key, empty if no baseline exists yet
     */
    public Map<ResourceKey, ResourceSnapshot> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(baseline));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param namespace null or blank returns every resource
     */
    public List<ResourceSnapshot> findByNamespace(String namespace) {
        lock.readLock().lock();
        try {
            return baseline.values().stream()
                    .filter(s -> namespace == null || namespace.isBlank() || namespace.equals(s.getNamespace()))
                    .sorted((a, b) -> a.getKey().compareTo(b.getKey()))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return baseline.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Instant> getLastSwapAt() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(lastSwapAt);
        } finally {
            lock.readLock().unlock();
        }
    }

    private static Map<ResourceKey, ResourceSnapshot> index(Collection<ResourceSnapshot> snapshots) {
        Map<ResourceKey, ResourceSnapshot> map = new TreeMap<>();
        for (ResourceSnapshot snapshot : snapshots) {
            map.put(snapshot.getKey(), snapshot);
        }
        return map;
    }
}
