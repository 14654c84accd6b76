package com.company.podwatch.service;

import com.company.podwatch.event.CycleCompletedEvent;
import com.company.podwatch.event.HistoryPrunedEvent;
import com.company.podwatch.event.SettingsUpdatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

import static com.company.podwatch.config.RedisCacheConfig.HISTORY_CACHES;
import static com.company.podwatch.config.RedisCacheConfig.METRIC_SAMPLES;
import static com.company.podwatch.config.RedisCacheConfig.NODE_STATS;
import static com.company.podwatch.config.RedisCacheConfig.RECENT_ALERTS;

@Service
@Slf4j
@RequiredArgsConstructor
public class CacheEvictionService {

    private final CacheManager cacheManager;

    @EventListener
    @Async
    public void onCycleCompleted(CycleCompletedEvent event) {
        if (event.getChangeCount() == 0) {
            // samples, alerts and node stats still moved on
            clear(List.of(METRIC_SAMPLES, RECENT_ALERTS, NODE_STATS));
            return;
        }
        clear(HISTORY_CACHES);
    }

    @EventListener
    @Async
    public void onHistoryPruned(HistoryPrunedEvent event) {
        clear(HISTORY_CACHES);
    }

    @EventListener
    @Async
    public void onSettingsUpdated(SettingsUpdatedEvent event) {
        clear(HISTORY_CACHES);
    }

    private void clear(List<String> cacheNames) {
        for (String cacheName : cacheNames) {
            Cache cache = cacheManager.getCache(cacheName);
            if (cache != null) {
                cache.clear();
                log.debug("Cleared {} cache", cacheName);
            }
        }
    }
}
