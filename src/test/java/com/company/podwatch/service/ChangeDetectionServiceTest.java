package com.company.podwatch.service;

import com.company.podwatch.domain.ChangeEvent;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.ResourceSnapshot;
import com.company.podwatch.domain.ResourceUsage;
import com.company.podwatch.domain.enums.ChangeType;
import com.company.podwatch.domain.enums.ResourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("ChangeDetectionService")
class ChangeDetectionServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final ChangeDetectionService service = new ChangeDetectionService();

    @Nested
    @DisplayName("First observation")
    class FirstObservation {

        @Test
        @DisplayName("Should report every resource as NEW and flag it as initial")
        void shouldReportEverythingAsInitialNew() {
            // Given
            List<ResourceSnapshot> current = List.of(
                    pod("default", "web", "Running", "nginx:1.25"),
                    node("worker-1", "Ready"));

            // When
            List<ChangeEvent> events = service.diff(null, current, NOW);

            // Then
            assertThat(events)
                    .extracting(ChangeEvent::getChangeType, ChangeEvent::getName, ChangeEvent::isInitialObservation)
                    .containsExactly(
                            tuple(ChangeType.NEW, "web", true),
                            tuple(ChangeType.NEW, "worker-1", true));
            assertThat(events).allSatisfy(e -> assertThat(e.getOccurredAt()).isEqualTo(NOW));
        }

        @Test
        @DisplayName("Should report nothing removed when there is no baseline")
        void shouldReportNoRemovalsWithoutBaseline() {
            assertThat(service.removedKeys(null, List.of(pod("default", "web", "Running", "nginx")))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Against a baseline")
    class AgainstBaseline {

        @Test
        @DisplayName("Should produce no events for identical observations")
        void shouldBeEmptyForIdenticalObservations() {
            // Given
            List<ResourceSnapshot> snapshots = List.of(
                    pod("default", "web", "Running", "nginx:1.25"),
                    node("worker-1", "Ready"));

            // When
            List<ChangeEvent> events = service.diff(baseline(snapshots), snapshots, NOW);

            // Then
            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("Should ignore usage and observation time")
        void shouldIgnoreUsageDifferences() {
            // Given
            ResourceSnapshot before = pod("default", "web", "Running", "nginx:1.25");
            ResourceSnapshot after = before.toBuilder()
                    .usage(ResourceUsage.builder().cpuMillicores(900L).memoryBytes(1L << 30).build())
                    .observedAt(NOW)
                    .build();

            // When
            List<ChangeEvent> events = service.diff(baseline(List.of(before)), List.of(after), NOW);

            // Then
            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("Should emit status then image change for the same pod")
        void shouldEmitStatusBeforeImageChange() {
            // Given
            ResourceSnapshot before = pod("default", "api", "Running", "api:1.0");
            ResourceSnapshot after = pod("default", "api", "CrashLoopBackOff", "api:1.1");

            // When
            List<ChangeEvent> events = service.diff(baseline(List.of(before)), List.of(after), NOW);

            // Then
            assertThat(events)
                    .extracting(ChangeEvent::getChangeType, ChangeEvent::getOldValue, ChangeEvent::getNewValue)
                    .containsExactly(
                            tuple(ChangeType.STATUS_CHANGE, "Running", "CrashLoopBackOff"),
                            tuple(ChangeType.IMAGE_CHANGE, "api:1.0", "api:1.1"));
        }

        @Test
        @DisplayName("Should detect new and removed resources without flagging them as initial")
        void shouldDetectNewAndRemoved() {
            // Given
            ResourceSnapshot gone = pod("default", "old-job", "Succeeded", "job:1");
            ResourceSnapshot kept = pod("default", "web", "Running", "nginx");
            ResourceSnapshot added = pod("monitoring", "prometheus", "Pending", "prom:2");

            Map<ResourceKey, ResourceSnapshot> previous = baseline(List.of(gone, kept));
            List<ResourceSnapshot> current = List.of(kept, added);

            // When
            List<ChangeEvent> events = service.diff(previous, current, NOW);

            // Then
            assertThat(events)
                    .extracting(ChangeEvent::getChangeType, ChangeEvent::getName, ChangeEvent::isInitialObservation)
                    .containsExactly(
                            tuple(ChangeType.REMOVED, "old-job", false),
                            tuple(ChangeType.NEW, "prometheus", false));
            assertThat(events.get(0).getOldValue()).isEqualTo("Succeeded");
            assertThat(service.removedKeys(previous, current)).containsExactly(gone.getKey());
        }

        @Test
        @DisplayName("Should only track status for nodes")
        void shouldNotReportImageChangesForNodes() {
            // Given
            ResourceSnapshot before = node("worker-1", "Ready").toBuilder().primaryImage("a").build();
            ResourceSnapshot after = node("worker-1", "NotReady").toBuilder().primaryImage("b").build();

            // When
            List<ChangeEvent> events = service.diff(baseline(List.of(before)), List.of(after), NOW);

            // Then
            assertThat(events)
                    .extracting(ChangeEvent::getKind, ChangeEvent::getChangeType, ChangeEvent::getNewValue)
                    .containsExactly(tuple(ResourceKind.NODE, ChangeType.STATUS_CHANGE, "NotReady"));
        }

        @Test
        @DisplayName("Should order events by resource key regardless of input order")
        void shouldOrderByKey() {
            // Given
            Map<ResourceKey, ResourceSnapshot> previous = baseline(List.of(
                    pod("b", "x", "Running", "i"),
                    pod("a", "y", "Running", "i")));
            List<ResourceSnapshot> current = List.of(
                    pod("b", "x", "Failed", "i"),
                    pod("a", "y", "Failed", "i"));

            // When
            List<ChangeEvent> events = service.diff(previous, current, NOW);

            // Then
            assertThat(events).extracting(ChangeEvent::getNamespace).containsExactly("a", "b");
        }

        @Test
        @DisplayName("Should produce the same events when applied twice to the same input")
        void shouldBeDeterministic() {
            // Given
            Map<ResourceKey, ResourceSnapshot> previous = baseline(List.of(pod("default", "web", "Running", "v1")));
            List<ResourceSnapshot> current = List.of(pod("default", "web", "Pending", "v2"));

            // When / Then
            assertThat(service.diff(previous, current, NOW)).isEqualTo(service.diff(previous, current, NOW));
        }
    }

    static ResourceSnapshot pod(String namespace, String name, String status, String image) {
        return ResourceSnapshot.builder()
                .kind(ResourceKind.POD)
                .namespace(namespace)
                .name(name)
                .status(status)
                .primaryImage(image)
                .hostAssignment("worker-1")
                .observedAt(NOW.minusSeconds(600))
                .build();
    }

    static ResourceSnapshot node(String name, String status) {
        return ResourceSnapshot.builder()
                .kind(ResourceKind.NODE)
                .namespace(ResourceKey.CLUSTER_SCOPE)
                .name(name)
                .status(status)
                .observedAt(NOW.minusSeconds(600))
                .build();
    }

    static Map<ResourceKey, ResourceSnapshot> baseline(Collection<ResourceSnapshot> snapshots) {
        Map<ResourceKey, ResourceSnapshot> map = new TreeMap<>();
        snapshots.forEach(s -> map.put(s.getKey(), s));
        return map;
    }
}
