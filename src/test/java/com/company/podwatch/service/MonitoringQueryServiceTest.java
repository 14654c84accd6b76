package com.company.podwatch.service;

import com.company.podwatch.cache.SnapshotStore;
import com.company.podwatch.domain.ChangeQuery;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.ResourceSnapshot;
import com.company.podwatch.domain.ResourceUsage;
import com.company.podwatch.domain.enums.ChangeType;
import com.company.podwatch.domain.enums.ResourceKind;
import com.company.podwatch.dto.response.ResourceStatusResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MonitoringQueryService")
class MonitoringQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @Mock
    private HistoryStore historyStore;

    private SnapshotStore snapshotStore;
    private MonitoringQueryService queryService;

    @BeforeEach
    void setUp() {
        snapshotStore = new SnapshotStore();
        queryService = new MonitoringQueryService(snapshotStore, historyStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should flag new pods and recent image updates")
    void shouldDecorateSnapshots() {
        // Given
        snapshotStore.swap(List.of(
                pod("default", "fresh", NOW.minus(Duration.ofDays(2))),
                pod("default", "old", NOW.minus(Duration.ofDays(40))),
                pod("monitoring", "prometheus", NOW.minus(Duration.ofDays(1)))));
        when(historyStore.findKeysWithImageChangesSince(NOW.minus(Duration.ofDays(7))))
                .thenReturn(Set.of(ResourceKey.pod("default", "old")));

        // When
        List<ResourceStatusResponse> resources = queryService.getCurrentSnapshots("default");

        // Then
        assertThat(resources).extracting(ResourceStatusResponse::getName).containsExactly("fresh", "old");
        assertThat(resources.get(0).getIsNew()).isTrue();
        assertThat(resources.get(0).getImageUpdatedRecently()).isFalse();
        assertThat(resources.get(1).getAgeDays()).isEqualTo(40L);
        assertThat(resources.get(1).getIsNew()).isFalse();
        assertThat(resources.get(1).getImageUpdatedRecently()).isTrue();
        assertThat(resources.get(1).getMemoryFormatted()).isEqualTo("128.00 MB");
    }

    @Test
    @DisplayName("Should not query history when nothing is tracked")
    void shouldSkipHistoryWhenEmpty() {
        assertThat(queryService.getCurrentSnapshots(null)).isEmpty();

        verifyNoInteractions(historyStore);
    }

    @Test
    @DisplayName("Should translate the lookback into a query window and drop blank filters")
    void shouldBuildChangeQuery() {
        when(historyStore.queryChanges(any())).thenReturn(List.of());

        queryService.getRecentChanges(3, " ", "web-1", ChangeType.STATUS_CHANGE, 20);

        ArgumentCaptor<ChangeQuery> query = ArgumentCaptor.forClass(ChangeQuery.class);
        verify(historyStore).queryChanges(query.capture());
        assertThat(query.getValue().getSince()).isEqualTo(NOW.minus(Duration.ofDays(3)));
        assertThat(query.getValue().getNamespace()).isNull();
        assertThat(query.getValue().getName()).isEqualTo("web-1");
        assertThat(query.getValue().getLimit()).isEqualTo(20);
    }

    private static ResourceSnapshot pod(String namespace, String name, Instant createdAt) {
        return ResourceSnapshot.builder()
                .kind(ResourceKind.POD)
                .namespace(namespace)
                .name(name)
                .status("Running")
                .primaryImage("app:1")
                .usage(ResourceUsage.builder().cpuMillicores(100L).memoryBytes(128L * 1024 * 1024).build())
                .createdAt(createdAt)
                .observedAt(NOW)
                .build();
    }
}
