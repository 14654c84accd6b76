package com.company.podwatch.scheduled;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Delay before the next poll. After the n-th consecutive failure the delay is
 * {@code min(initial * multiplier^(n-1), maxWait)}; success, or reaching the failure ceiling, returns to the
 * regular refresh interval.
 */
@Component
@Slf4j
public class BackoffPolicy {

    private final Duration initial;
    private final double multiplier;
    private final Duration maxWait;
    private final int maxConsecutiveFailures;

    private int consecutiveFailures;

    public BackoffPolicy(@Value("${podwatch.poll.backoff.initial:60s}") Duration initial,
                         @Value("${podwatch.poll.backoff.multiplier:2.0}") double multiplier,
                         @Value("${podwatch.poll.backoff.max-wait:15m}") Duration maxWait,
                         @Value("${podwatch.poll.backoff.max-consecutive-failures:8}") int maxConsecutiveFailures) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1");
        }
        this.initial = initial;
        this.multiplier = multiplier;
        this.maxWait = maxWait;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
    }

    public synchronized void recordFailure() {
        consecutiveFailures++;
        if (consecutiveFailures >= maxConsecutiveFailures) {
            log.warn("{} consecutive poll failures, resetting backoff and continuing at the regular interval",
                    consecutiveFailures);
            consecutiveFailures = 0;
        }
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Duration nextDelay(Duration refreshInterval) {
        if (consecutiveFailures == 0) {
            return refreshInterval;
        }
        return delayAfterFailures(consecutiveFailures);
    }

    Duration delayAfterFailures(int failures) {
        double millis = initial.toMillis() * Math.pow(multiplier, failures - 1);
        if (millis >= maxWait.toMillis()) {
            return maxWait;
        }
        return Duration.ofMillis((long) millis);
    }
}
