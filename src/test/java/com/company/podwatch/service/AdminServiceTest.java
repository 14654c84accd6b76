package com.company.podwatch.service;

import com.company.podwatch.cache.SnapshotStore;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.enums.CycleState;
import com.company.podwatch.dto.response.CleanupResponse;
import com.company.podwatch.dto.response.CycleRunResponse;
import com.company.podwatch.exception.AdminOperationException;
import com.company.podwatch.exception.InvalidCredentialException;
import com.company.podwatch.exception.InventoryException;
import com.company.podwatch.exception.ResourceNotFoundException;
import com.company.podwatch.inventory.InventoryClient;
import com.company.podwatch.scheduled.CycleResult;
import com.company.podwatch.scheduled.MonitoringCycle;
import com.company.podwatch.security.OperatorContext;
import com.company.podwatch.settings.SettingsDefaults;
import com.company.podwatch.settings.SettingsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdminService")
class AdminServiceTest {

    private static final String CREDENTIAL = "admin-secret";
    private static final ResourceKey WEB_1 = ResourceKey.pod("default", "web-1");

    @Mock
    private SettingsService settingsService;

    @Mock
    private InventoryClient inventoryClient;

    @Mock
    private RetentionService retentionService;

    @Mock
    private MonitoringCycle monitoringCycle;

    @Mock
    private AlertService alertService;

    @Mock
    private HistoryStore historyStore;

    @Mock
    private OperatorContext operatorContext;

    private SimpleMeterRegistry meterRegistry;
    private AdminService adminService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        adminService = new AdminService(settingsService, inventoryClient, retentionService, monitoringCycle,
                alertService, historyStore, new SnapshotStore(), operatorContext, meterRegistry);
    }

    @Test
    @DisplayName("Should reject every mutation with a wrong credential before doing anything")
    void shouldRejectWrongCredential() {
        // Given
        when(settingsService.verifyCredential("wrong")).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> adminService.triggerManualRestart(WEB_1, "wrong"))
                .isInstanceOf(InvalidCredentialException.class);
        assertThatThrownBy(() -> adminService.runCleanup(7, "wrong"))
                .isInstanceOf(InvalidCredentialException.class);
        assertThatThrownBy(() -> adminService.triggerCycle("wrong"))
                .isInstanceOf(InvalidCredentialException.class);

        verifyNoInteractions(inventoryClient, retentionService, monitoringCycle);
        assertThat(meterRegistry.counter("podwatch.admin.operations",
                "operation", "restart", "outcome", "rejected").count()).isEqualTo(1.0);
    }

    @Nested
    @DisplayName("Manual restart")
    class ManualRestart {

        @BeforeEach
        void validCredential() {
            when(settingsService.verifyCredential(CREDENTIAL)).thenReturn(true);
        }

        @Test
        @DisplayName("Should delete the pod")
        void shouldDeletePod() {
            when(inventoryClient.deleteResource(WEB_1)).thenReturn(true);

            adminService.triggerManualRestart(WEB_1, CREDENTIAL);

            verify(inventoryClient).deleteResource(WEB_1);
            assertThat(meterRegistry.counter("podwatch.admin.operations",
                    "operation", "restart", "outcome", "ok").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should report an unknown pod as not found")
        void shouldReportNotFound() {
            when(inventoryClient.deleteResource(WEB_1)).thenReturn(false);

            assertThatThrownBy(() -> adminService.triggerManualRestart(WEB_1, CREDENTIAL))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Should surface cluster failures as a failed operation")
        void shouldWrapInventoryFailure() {
            when(inventoryClient.deleteResource(WEB_1)).thenThrow(new InventoryException("connection refused"));

            assertThatThrownBy(() -> adminService.triggerManualRestart(WEB_1, CREDENTIAL))
                    .isInstanceOf(AdminOperationException.class)
                    .hasMessageContaining("connection refused")
                    .hasCauseInstanceOf(InventoryException.class);
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class Cleanup {

        @BeforeEach
        void validCredential() {
            when(settingsService.verifyCredential(CREDENTIAL)).thenReturn(true);
        }

        @Test
        @DisplayName("Should use the configured retention when none is given")
        void shouldUseConfiguredRetention() {
            // Given
            when(settingsService.current()).thenReturn(SettingsDefaults.defaults("hash"));
            Map<String, Integer> deleted = new LinkedHashMap<>();
            deleted.put("status_history", 4);
            deleted.put("metric_samples", 6);
            when(retentionService.prune(30)).thenReturn(deleted);

            // When
            CleanupResponse response = adminService.runCleanup(null, CREDENTIAL);

            // Then
            assertThat(response.getRetentionDays()).isEqualTo(30);
            assertThat(response.getTotalDeleted()).isEqualTo(10);
        }

        @Test
        @DisplayName("Should use the requested retention")
        void shouldUseRequestedRetention() {
            when(retentionService.prune(7)).thenReturn(Map.of());

            CleanupResponse response = adminService.runCleanup(7, CREDENTIAL);

            assertThat(response.getRetentionDays()).isEqualTo(7);
            assertThat(response.getTotalDeleted()).isZero();
            verify(settingsService, never()).current();
        }
    }

    @Nested
    @DisplayName("Check now")
    class CheckNow {

        @BeforeEach
        void validCredential() {
            when(settingsService.verifyCredential(CREDENTIAL)).thenReturn(true);
        }

        @Test
        @DisplayName("Should report a completed cycle")
        void shouldRunCycle() {
            Instant now = Instant.now();
            when(monitoringCycle.run()).thenReturn(CycleResult.builder()
                    .success(true).resourceCount(12).changeCount(2).startedAt(now).finishedAt(now).build());

            CycleRunResponse response = adminService.triggerCycle(CREDENTIAL);

            assertThat(response.isSuccess()).isTrue();
            assertThat(response.getChangeCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should report a failed cycle without throwing")
        void shouldReportFailedCycle() {
            Instant now = Instant.now();
            when(monitoringCycle.run()).thenReturn(CycleResult.builder()
                    .success(false).failedIn(CycleState.FETCHING).error("timeout").startedAt(now).finishedAt(now).build());

            CycleRunResponse response = adminService.triggerCycle(CREDENTIAL);

            assertThat(response.isSuccess()).isFalse();
        }

        @Test
        @DisplayName("Should refuse while another cycle is running")
        void shouldRefuseWhenBusy() {
            when(monitoringCycle.run()).thenReturn(CycleResult.skipped(Instant.now()));

            assertThatThrownBy(() -> adminService.triggerCycle(CREDENTIAL))
                    .isInstanceOf(AdminOperationException.class)
                    .hasMessageContaining("already running");
        }
    }

    @Test
    @DisplayName("Should total the row counts of every table")
    void shouldReportStorage() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("status_history", 10L);
        counts.put("metric_samples", 90L);
        when(historyStore.tableStatistics()).thenReturn(counts);
        when(settingsService.current()).thenReturn(SettingsDefaults.defaults("hash"));

        assertThat(adminService.storageInfo().getTotalRows()).isEqualTo(100L);
        verify(retentionService, never()).prune(anyInt());
        verify(inventoryClient, never()).deleteResource(any());
    }
}
