package com.company.podwatch.service;

import com.company.podwatch.channel.AlertMessage;
import com.company.podwatch.channel.ChannelAdapter;
import com.company.podwatch.channel.ChannelAdapterRegistry;
import com.company.podwatch.channel.TransientDeliveryPredicate;
import com.company.podwatch.domain.AlertDestination;
import com.company.podwatch.domain.AlertRecord;
import com.company.podwatch.domain.DeliveryOutcome;
import com.company.podwatch.domain.enums.AlertLevel;
import com.company.podwatch.domain.enums.ChannelType;
import com.company.podwatch.domain.enums.DeliveryStatus;
import com.company.podwatch.exception.ChannelDeliveryException;
import com.company.podwatch.exception.HistoryWriteException;
import com.company.podwatch.settings.DestinationSettings;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AlertDispatchService")
class AlertDispatchServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private ChannelAdapter emailAdapter;

    @Mock
    private ChannelAdapter smsAdapter;

    @Mock
    private HistoryStore historyStore;

    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private AlertDispatchService dispatchService;

    private final DestinationSettings settings = new DestinationSettings();

    @BeforeEach
    void setUp() {
        when(emailAdapter.getChannelType()).thenReturn(ChannelType.EMAIL);
        when(smsAdapter.getChannelType()).thenReturn(ChannelType.SMS);
        lenient().when(emailAdapter.isConfigured(any())).thenReturn(true);
        lenient().when(smsAdapter.isConfigured(any())).thenReturn(true);
        lenient().when(historyStore.recordDelivery(any())).then(returnsFirstArg());

        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(10))
                .retryOnException(new TransientDeliveryPredicate())
                .build());
        TimeLimiterRegistry timeLimiterRegistry = TimeLimiterRegistry.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(2))
                .build());

        executor = Executors.newFixedThreadPool(2);
        meterRegistry = new SimpleMeterRegistry();
        dispatchService = new AlertDispatchService(
                new ChannelAdapterRegistry(List.of(emailAdapter, smsAdapter)),
                historyStore,
                retryRegistry,
                CircuitBreakerRegistry.ofDefaults(),
                timeLimiterRegistry,
                executor,
                OpenTelemetry.noop().getTracer("test"),
                meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should deliver to each enabled destination even when another one fails")
    void shouldIsolateDestinations() {
        // Given
        AlertRecord alert = alert();
        doThrow(new ChannelDeliveryException(ChannelType.EMAIL, "Authentication failed", false))
                .when(emailAdapter).send(any(), any(), any());

        // When
        List<DeliveryOutcome> outcomes = dispatchService.dispatch(alert,
                List.of(destination("ops-mail", ChannelType.EMAIL, true), destination("ops-sms", ChannelType.SMS, true)),
                settings);

        // Then
        assertThat(outcomes)
                .extracting(DeliveryOutcome::getDestinationId, DeliveryOutcome::getStatus, DeliveryOutcome::getAttempt)
                .containsExactly(
                        tuple("ops-mail", DeliveryStatus.FAILED, 1),
                        tuple("ops-sms", DeliveryStatus.SENT, 1));
        assertThat(outcomes).extracting(DeliveryOutcome::getAttemptedAt).containsOnly(NOW);
        assertThat(alert.getDeliveries()).hasSize(2);
        verify(smsAdapter).send(any(), any(AlertMessage.class), eq(settings));
        verify(historyStore, times(2)).recordDelivery(any());
    }

    @Test
    @DisplayName("Should stop retrying a transient failure at the configured attempt limit")
    void shouldBoundRetries() {
        // Given
        doThrow(new ChannelDeliveryException(ChannelType.SMS, "Gateway returned 503", true))
                .when(smsAdapter).send(any(), any(), any());

        // When
        List<DeliveryOutcome> outcomes = dispatchService.dispatch(alert(),
                List.of(destination("ops-sms", ChannelType.SMS, true)), settings);

        // Then
        assertThat(outcomes)
                .extracting(DeliveryOutcome::getStatus, DeliveryOutcome::getAttempt)
                .containsExactly(tuple(DeliveryStatus.FAILED, 1), tuple(DeliveryStatus.FAILED, 2));
        verify(smsAdapter, times(2)).send(any(), any(), any());
    }

    @Test
    @DisplayName("Should record the failed attempt and the successful retry")
    void shouldRecordEveryAttempt() {
        // Given
        doThrow(new ChannelDeliveryException(ChannelType.SMS, "Connection reset", true))
                .doNothing()
                .when(smsAdapter).send(any(), any(), any());

        // When
        List<DeliveryOutcome> outcomes = dispatchService.dispatch(alert(),
                List.of(destination("ops-sms", ChannelType.SMS, true)), settings);

        // Then
        assertThat(outcomes)
                .extracting(DeliveryOutcome::getStatus, DeliveryOutcome::getAttempt, DeliveryOutcome::getError)
                .containsExactly(
                        tuple(DeliveryStatus.FAILED, 1, "Connection reset"),
                        tuple(DeliveryStatus.SENT, 2, null));
        assertThat(meterRegistry.counter("podwatch.alerts.deliveries", "channel", "sms", "status", "SENT").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should not retry a permanent failure")
    void shouldNotRetryPermanentFailure() {
        // Given
        doThrow(new ChannelDeliveryException(ChannelType.SMS, "Gateway rejected request: 400", false))
                .when(smsAdapter).send(any(), any(), any());

        // When
        List<DeliveryOutcome> outcomes = dispatchService.dispatch(alert(),
                List.of(destination("ops-sms", ChannelType.SMS, true)), settings);

        // Then
        assertThat(outcomes).hasSize(1);
        verify(smsAdapter, times(1)).send(any(), any(), any());
    }

    @Test
    @DisplayName("Should skip disabled destinations entirely")
    void shouldSkipDisabledDestinations() {
        // When
        List<DeliveryOutcome> outcomes = dispatchService.dispatch(alert(),
                List.of(destination("ops-mail", ChannelType.EMAIL, false)), settings);

        // Then
        assertThat(outcomes).isEmpty();
        verify(emailAdapter, never()).send(any(), any(), any());
        verifyNoInteractions(historyStore);
    }

    @Test
    @DisplayName("Should record an unattempted failure for a channel without transport settings")
    void shouldFailUnconfiguredChannel() {
        // Given
        when(emailAdapter.isConfigured(settings)).thenReturn(false);

        // When
        List<DeliveryOutcome> outcomes = dispatchService.dispatch(alert(),
                List.of(destination("ops-mail", ChannelType.EMAIL, true)), settings);

        // Then
        assertThat(outcomes).singleElement().satisfies(outcome -> {
            assertThat(outcome.getStatus()).isEqualTo(DeliveryStatus.FAILED);
            assertThat(outcome.getAttempt()).isZero();
            assertThat(outcome.getError()).contains("not configured");
        });
        verify(emailAdapter, never()).send(any(), any(), any());
    }

    @Test
    @DisplayName("Should keep delivering when an outcome cannot be persisted")
    void shouldSurviveOutcomePersistenceFailure() {
        // Given
        when(historyStore.recordDelivery(any())).thenThrow(new HistoryWriteException("database down"));

        // When
        List<DeliveryOutcome> outcomes = dispatchService.dispatch(alert(),
                List.of(destination("ops-mail", ChannelType.EMAIL, true), destination("ops-sms", ChannelType.SMS, true)),
                settings);

        // Then
        assertThat(outcomes).extracting(DeliveryOutcome::getStatus)
                .containsExactly(DeliveryStatus.SENT, DeliveryStatus.SENT);
    }

    private static AlertRecord alert() {
        return AlertRecord.builder()
                .alertId(42L)
                .subject("Pod Status Change: web")
                .message("Pod web in namespace default changed from Running to Failed")
                .level(AlertLevel.CRITICAL)
                .namespace("default")
                .name("web")
                .dispatched(true)
                .createdAt(Instant.now())
                .build();
    }

    private static AlertDestination destination(String id, ChannelType type, boolean enabled) {
        return AlertDestination.builder()
                .id(id)
                .channelType(type)
                .address(type == ChannelType.EMAIL ? "ops@example.com" : "+390000000")
                .enabled(enabled)
                .build();
    }
}
