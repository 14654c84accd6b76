package com.company.podwatch.service;

import com.company.podwatch.event.HistoryPrunedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class RetentionService {

    private final HistoryStore historyStore;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Deletes history older than {@code retentionDays} days
     *
     * @return deleted row count per table
     */
    public Map<String, Integer> prune(int retentionDays) {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("Retention must be at least one day");
        }
        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(retentionDays));
        Map<String, Integer> deleted = historyStore.prune(cutoff);
        eventPublisher.publishEvent(new HistoryPrunedEvent(cutoff, deleted));
        return deleted;
    }
}
