package com.company.podwatch.service;

import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.ResourceSnapshot;
import com.company.podwatch.domain.enums.ChangeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compares the previous baseline with a fresh observation. Pure: no I/O, no clock, no state.
 */
@Service
@Slf4j
public class ChangeDetectionService {

    /**
     * Computes the change events between two observations.
     *
     * <p>Keys are visited in {@link ResourceKey} order. For one key, NEW or REMOVED comes first, then
     * STATUS_CHANGE, then IMAGE_CHANGE. Usage figures are never compared.
     *
     * @param previous the baseline, or {@code null} when none has ever been established
     * @param current  the fresh observation
     * @param now      timestamp for the produced events
     */
    public List<ChangeEvent> diff(Map<ResourceKey, ResourceSnapshot> previous,
                                  Collection<ResourceSnapshot> current,
                                  Instant now) {
        Map<ResourceKey, ResourceSnapshot> next = index(current);
        List<ChangeEvent> events = new ArrayList<>();

        if (previous == null) {
            next.values().forEach(s -> events.add(newResource(s, true, now)));
            log.debug("Initial observation: {} resources", events.size());
            return events;
        }

        Set<ResourceKey> keys = new TreeSet<>(previous.keySet());
        keys.addAll(next.keySet());

        for (ResourceKey key : keys) {
            ResourceSnapshot before = previous.get(key);
            ResourceSnapshot after = next.get(key);

            if (before == null) {
                events.add(newResource(after, false, now));
            } else if (after == null) {
                events.add(event(before, ChangeType.REMOVED, before.getStatus(), null, now));
            } else {
                if (!Objects.equals(before.getStatus(), after.getStatus())) {
                    events.add(event(after, ChangeType.STATUS_CHANGE, before.getStatus(), after.getStatus(), now));
                }
                if (after.isPod() && !Objects.equals(before.getPrimaryImage(), after.getPrimaryImage())) {
                    events.add(event(after, ChangeType.IMAGE_CHANGE, before.getPrimaryImage(), after.getPrimaryImage(), now));
                }
            }
        }
        return events;
    }

    /**
     * Keys present in the baseline but missing from the fresh observation
     */
    public Set<ResourceKey> removedKeys(Map<ResourceKey, ResourceSnapshot> previous,
                                        Collection<ResourceSnapshot> current) {
        if (previous == null) {
            return Set.of();
        }
        Set<ResourceKey> removed = new TreeSet<>(previous.keySet());
        current.forEach(s -> removed.remove(s.getKey()));
        return removed;
    }

    private static ChangeEvent newResource(ResourceSnapshot snapshot, boolean initial, Instant now) {
        ChangeEvent event = event(snapshot, ChangeType.NEW, null, snapshot.getStatus(), now);
        event.setInitialObservation(initial);
        return event;
    }

    private static ChangeEvent event(ResourceSnapshot snapshot, ChangeType type,
                                     String oldValue, String newValue, Instant now) {
        ResourceKey key = snapshot.getKey();
        return ChangeEvent.builder()
                .kind(key.getKind())
                .namespace(key.getNamespace())
                .name(key.getName())
                .changeType(type)
                .oldValue(oldValue)
                .newValue(newValue)
                .occurredAt(now)
                .build();
    }

    private static Map<ResourceKey, ResourceSnapshot> index(Collection<ResourceSnapshot> snapshots) {
        Map<ResourceKey, ResourceSnapshot> map = new TreeMap<>();
        for (ResourceSnapshot snapshot : snapshots) {
            map.put(snapshot.getKey(), snapshot);
        }
        return map;
    }
}
