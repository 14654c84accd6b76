package com.company.podwatch.service;

import com.company.podwatch.channel.AlertMessage;
import com.company.podwatch.channel.ChannelAdapter;
import com.company.podwatch.channel.ChannelAdapterRegistry;
import com.company.podwatch.domain.AlertDestination;
import com.company.podwatch.domain.AlertRecord;
import com.company.podwatch.domain.DeliveryOutcome;
import com.company.podwatch.domain.enums.ChannelType;
import com.company.podwatch.domain.enums.DeliveryStatus;
import com.company.podwatch.exception.ChannelDeliveryException;
import com.company.podwatch.exception.HistoryWriteException;
import com.company.podwatch.settings.DestinationSettings;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans an alert out to its destinations. Every destination is handled on its own: a failing
 * channel never keeps the others from being tried, and every attempt leaves a {@link DeliveryOutcome}.
 */
@Service
@Slf4j
public class AlertDispatchService {

    public static final String DELIVERY_INSTANCE = "channelDelivery";

    private final ChannelAdapterRegistry adapterRegistry;
    private final HistoryStore historyStore;
    private final RetryRegistry retryRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService deliveryExecutor;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public AlertDispatchService(ChannelAdapterRegistry adapterRegistry,
                                HistoryStore historyStore,
                                RetryRegistry retryRegistry,
                                CircuitBreakerRegistry circuitBreakerRegistry,
                                TimeLimiterRegistry timeLimiterRegistry,
                                @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor,
                                Tracer tracer,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.adapterRegistry = adapterRegistry;
        this.historyStore = historyStore;
        this.retryRegistry = retryRegistry;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.deliveryExecutor = deliveryExecutor;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Delivers {@code alert} to every enabled destination.
     *
     * @return all recorded outcomes, in destination order and attempt order
     */
    public List<DeliveryOutcome> dispatch(AlertRecord alert, List<AlertDestination> destinations,
                                          DestinationSettings settings) {
        List<DeliveryOutcome> outcomes = new ArrayList<>();
        AlertMessage message = AlertMessage.of(alert);

        for (AlertDestination destination : destinations) {
            if (!destination.isEnabled()) {
                continue;
            }
            try {
                outcomes.addAll(deliver(alert, destination, message, settings));
            } catch (Exception e) {
                // keep going with the remaining destinations
                log.error("Unexpected error delivering alert {} to {}", alert.getAlertId(), destination.getId(), e);
            }
        }
        alert.getDeliveries().addAll(outcomes);
        return outcomes;
    }

    List<DeliveryOutcome> deliver(AlertRecord alert, AlertDestination destination, AlertMessage message,
                                  DestinationSettings settings) {
        List<DeliveryOutcome> outcomes = new ArrayList<>();
        ChannelType channel = destination.getChannelType();

        Optional<ChannelAdapter> adapter = adapterRegistry.find(channel);
        if (adapter.isEmpty() || !adapter.get().isConfigured(settings)) {
            log.warn("Channel {} is not configured, alert {} not delivered to {}",
                    channel, alert.getAlertId(), destination.getId());
            outcomes.add(persist(outcome(alert, destination, 0, "Channel " + channel.getCode() + " is not configured")));
            countDelivery(channel, DeliveryStatus.FAILED);
            return outcomes;
        }

        Retry retry = retryRegistry.retry(DELIVERY_INSTANCE);
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(DELIVERY_INSTANCE + "-" + channel.getCode());
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(DELIVERY_INSTANCE);
        AtomicInteger attempt = new AtomicInteger();

        try {
            retry.executeSupplier(() -> {
                int n = attempt.incrementAndGet();
                ChannelDeliveryException failure =
                        attemptOnce(adapter.get(), circuitBreaker, timeLimiter, alert, destination, message, settings, n);
                outcomes.add(persist(failure == null
                        ? outcome(alert, destination, n, null)
                        : outcome(alert, destination, n, failure.getMessage())));
                countDelivery(channel, failure == null ? DeliveryStatus.SENT : DeliveryStatus.FAILED);
                if (failure != null) {
                    throw failure;
                }
                return n;
            });
            log.info("Alert {} delivered to {} via {} (attempt {})", alert.getAlertId(), destination.getId(), channel, attempt.get());
        } catch (ChannelDeliveryException e) {
            log.error("Alert {} could not be delivered to {} via {} after {} attempt(s): {}",
                    alert.getAlertId(), destination.getId(), channel, attempt.get(), e.getMessage());
        }
        return outcomes;
    }

    private ChannelDeliveryException attemptOnce(ChannelAdapter adapter, CircuitBreaker circuitBreaker,
                                                 TimeLimiter timeLimiter, AlertRecord alert,
                                                 AlertDestination destination, AlertMessage message,
                                                 DestinationSettings settings, int attempt) {
        ChannelType channel = adapter.getChannelType();
        Span span = tracer.spanBuilder("podwatch.alert.delivery")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("alert.id", alert.getAlertId() != null ? alert.getAlertId() : -1L);
            span.setAttribute("alert.level", alert.getLevel().name());
            span.setAttribute("destination.id", destination.getId());
            span.setAttribute("channel", channel.getCode());
            span.setAttribute("attempt", attempt);

            circuitBreaker.executeCallable(() -> timeLimiter.executeFutureSupplier(() ->
                    CompletableFuture.runAsync(() -> adapter.send(destination, message, settings), deliveryExecutor)));
            return null;

        } catch (Exception e) {
            ChannelDeliveryException failure = asDeliveryFailure(channel, e);
            span.recordException(failure);
            span.setStatus(StatusCode.ERROR, failure.getMessage());
            log.warn("Delivery attempt {} of alert {} to {} failed: {}",
                    attempt, alert.getAlertId(), destination.getId(), failure.getMessage());
            return failure;
        } finally {
            span.end();
        }
    }

    static ChannelDeliveryException asDeliveryFailure(ChannelType channel, Throwable e) {
        Throwable cause = e;
        while (cause instanceof ExecutionException || cause instanceof CompletionException) {
            if (cause.getCause() == null) {
                break;
            }
            cause = cause.getCause();
        }
        if (cause instanceof ChannelDeliveryException delivery) {
            return delivery;
        }
        if (cause instanceof TimeoutException) {
            return new ChannelDeliveryException(channel, "Delivery timed out", true, cause);
        }
        if (cause instanceof CallNotPermittedException) {
            return new ChannelDeliveryException(channel, "Circuit open for channel " + channel.getCode(), false, cause);
        }
        return new ChannelDeliveryException(channel, "Delivery failed: " + cause.getMessage(), true, cause);
    }

    private DeliveryOutcome outcome(AlertRecord alert, AlertDestination destination, int attempt, String error) {
        return DeliveryOutcome.builder()
                .alertId(alert.getAlertId())
                .destinationId(destination.getId())
                .channelType(destination.getChannelType())
                .status(error == null ? DeliveryStatus.SENT : DeliveryStatus.FAILED)
                .attempt(attempt)
                .error(error)
                .attemptedAt(Instant.now(clock))
                .build();
    }

    private DeliveryOutcome persist(DeliveryOutcome outcome) {
        try {
            return historyStore.recordDelivery(outcome);
        } catch (HistoryWriteException e) {
            log.error("Delivery outcome for alert {} to {} not persisted", outcome.getAlertId(), outcome.getDestinationId(), e);
            return outcome;
        }
    }

    private void countDelivery(ChannelType channel, DeliveryStatus status) {
        meterRegistry.counter("podwatch.alerts.deliveries",
                "channel", channel.getCode(),
                "status", status.name()
        ).increment();
    }
}
