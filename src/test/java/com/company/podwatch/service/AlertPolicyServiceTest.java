package com.company.podwatch.service;

import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.enums.AlertDecision;
import com.company.podwatch.domain.enums.AlertLevel;
import com.company.podwatch.domain.enums.ChangeType;
import com.company.podwatch.domain.enums.ResourceKind;
import com.company.podwatch.settings.AlertWindow;
import com.company.podwatch.settings.PodWatchSettings;
import com.company.podwatch.settings.SettingsDefaults;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AlertPolicyService")
class AlertPolicyServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private AlertPolicyService policyService;
    private PodWatchSettings settings;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        policyService = new AlertPolicyService(new AlertSeverityClassifier(), meterRegistry);
        settings = SettingsDefaults.defaults("hash");
    }

    @Nested
    @DisplayName("Window gating")
    class WindowGating {

        @BeforeEach
        void businessHoursOnly() {
            settings.getAlertingSchedule().setWindows(new ArrayList<>(List.of(AlertWindow.builder()
                    .start(LocalTime.of(8, 0))
                    .end(LocalTime.of(18, 0))
                    .levels(List.of(AlertLevel.WARNING))
                    .namespaces(List.of())
                    .build())));
        }

        @Test
        @DisplayName("Should fire a warning at 10:00 inside the 08:00-18:00 window")
        void shouldFireInsideWindow() {
            assertThat(policyService.shouldFire(AlertLevel.WARNING, "default", settings, LocalTime.of(10, 0))).isTrue();
        }

        @Test
        @DisplayName("Should not fire the same warning at 20:00")
        void shouldNotFireOutsideWindow() {
            assertThat(policyService.shouldFire(AlertLevel.WARNING, "default", settings, LocalTime.of(20, 0))).isFalse();
        }

        @Test
        @DisplayName("Should treat both window bounds as inclusive")
        void shouldIncludeBounds() {
            assertThat(policyService.shouldFire(AlertLevel.WARNING, "default", settings, LocalTime.of(8, 0))).isTrue();
            assertThat(policyService.shouldFire(AlertLevel.WARNING, "default", settings, LocalTime.of(18, 0, 30))).isTrue();
            assertThat(policyService.shouldFire(AlertLevel.WARNING, "default", settings, LocalTime.of(7, 59))).isFalse();
        }

        @Test
        @DisplayName("Should not fire a level the window does not list")
        void shouldRespectLevels() {
            assertThat(policyService.shouldFire(AlertLevel.CRITICAL, "default", settings, LocalTime.of(10, 0))).isFalse();
        }

        @Test
        @DisplayName("Should record a status change outside the window without dispatching it")
        void shouldRecordOnlyOutsideWindow() {
            // Given
            ChangeEvent event = statusChange("default", "Running", "Pending");

            // When
            AlertDecision decision = policyService.evaluate(event, settings, LocalTime.of(20, 0));

            // Then
            assertThat(decision).isEqualTo(AlertDecision.RECORD_ONLY);
        }

        @Test
        @DisplayName("Should fire when any one of several windows matches")
        void shouldFireWhenAnyWindowMatches() {
            // Given
            settings.getAlertingSchedule().getWindows().add(AlertWindow.builder()
                    .start(LocalTime.of(19, 0))
                    .end(LocalTime.of(23, 0))
                    .levels(List.of(AlertLevel.WARNING))
                    .build());

            // When / Then
            assertThat(policyService.shouldFire(AlertLevel.WARNING, "default", settings, LocalTime.of(20, 0))).isTrue();
        }
    }

    @Nested
    @DisplayName("Namespace filter")
    class NamespaceFilter {

        @Test
        @DisplayName("Should only fire for the namespaces a window lists")
        void shouldRespectNamespaces() {
            // Given
            settings.getAlertingSchedule().getWindows().get(0).setNamespaces(List.of("production"));

            // When / Then
            assertThat(policyService.shouldFire(AlertLevel.CRITICAL, "production", settings, LocalTime.NOON)).isTrue();
            assertThat(policyService.shouldFire(AlertLevel.CRITICAL, "default", settings, LocalTime.NOON)).isFalse();
        }

        @Test
        @DisplayName("Should let every namespace through when the window lists none")
        void shouldAllowAllWhenEmpty() {
            assertThat(policyService.shouldFire(AlertLevel.INFO, "anything", settings, LocalTime.NOON)).isTrue();
        }
    }

    @Nested
    @DisplayName("Alertable changes")
    class AlertableChanges {

        @Test
        @DisplayName("Should dispatch an enabled change type inside the default all-day window")
        void shouldDispatchStatusChange() {
            assertThat(policyService.evaluate(statusChange("default", "Running", "Failed"), settings, LocalTime.NOON))
                    .isEqualTo(AlertDecision.DISPATCH);
        }

        @Test
        @DisplayName("Should skip change types that are disabled")
        void shouldSkipDisabledTypes() {
            // Given
            settings.getMonitoring().setAlertOnStatusChange(false);
            ChangeEvent removed = event(ChangeType.REMOVED, "default", "Running", null);

            // When / Then
            assertThat(policyService.evaluate(statusChange("default", "Running", "Failed"), settings, LocalTime.NOON))
                    .isEqualTo(AlertDecision.SKIP);
            assertThat(policyService.evaluate(removed, settings, LocalTime.NOON))
                    .isEqualTo(AlertDecision.SKIP);
        }

        @Test
        @DisplayName("Should never alert on the first observation")
        void shouldSkipInitialObservation() {
            // Given
            settings.getMonitoring().setAlertOnNewResource(true);
            ChangeEvent initial = event(ChangeType.NEW, "default", null, "Running");
            initial.setInitialObservation(true);

            // When / Then
            assertThat(policyService.evaluate(initial, settings, LocalTime.NOON)).isEqualTo(AlertDecision.SKIP);
        }
    }

    @Nested
    @DisplayName("Fail-open")
    class FailOpen {

        @Test
        @DisplayName("Should allow the alert when the schedule cannot be evaluated")
        void shouldAllowOnBrokenSchedule() {
            // Given
            settings.getAlertingSchedule().setWindows(null);

            // When
            boolean fire = policyService.shouldFire(AlertLevel.WARNING, "default", settings, LocalTime.NOON);

            // Then
            assertThat(fire).isTrue();
            assertThat(meterRegistry.counter("podwatch.alerts.policy.errors").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should dispatch when the monitoring settings are missing")
        void shouldDispatchOnBrokenSettings() {
            // Given
            settings.setMonitoring(null);

            // When / Then
            assertThat(policyService.evaluate(statusChange("default", "Running", "Failed"), settings, LocalTime.NOON))
                    .isEqualTo(AlertDecision.DISPATCH);
        }

        @Test
        @DisplayName("Should allow the alert when a window has no bounds")
        void shouldAllowOnIncompleteWindow() {
            // Given
            settings.getAlertingSchedule().getWindows().get(0).setStart(null);

            // When / Then
            assertThat(policyService.shouldFire(AlertLevel.INFO, "default", settings, LocalTime.NOON)).isTrue();
        }
    }

    private static ChangeEvent statusChange(String namespace, String from, String to) {
        return event(ChangeType.STATUS_CHANGE, namespace, from, to);
    }

    private static ChangeEvent event(ChangeType type, String namespace, String oldValue, String newValue) {
        return ChangeEvent.builder()
                .kind(ResourceKind.POD)
                .namespace(namespace)
                .name("web")
                .changeType(type)
                .oldValue(oldValue)
                .newValue(newValue)
                .build();
    }
}
