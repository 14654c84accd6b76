package com.company.podwatch.inventory;

import com.company.podwatch.domain.NodeStats;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.ResourceSnapshot;
import com.company.podwatch.domain.ResourceUsage;
import com.company.podwatch.domain.enums.ResourceKind;
import com.company.podwatch.exception.InventoryException;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.NodeMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.VersionInfo;
import io.fabric8.kubernetes.client.dsl.ExecWatch;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * fabric8 backed inventory. Every call runs on the inventory executor under the {@code inventoryFetch}
 * time limiter. Usage figures come from metrics-server and are left empty when it is unavailable.
 */
@Component
@Slf4j
public class KubernetesInventoryClient implements InventoryClient {

    public static final String FETCH_INSTANCE = "inventoryFetch";

    private final KubernetesClient client;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService inventoryExecutor;
    private final MeterRegistry meterRegistry;
    private final KubernetesResourceMapper mapper = new KubernetesResourceMapper();

    @Value("${podwatch.inventory.collect-disk-usage:false}")
    private boolean collectDiskUsage;

    @Value("${podwatch.inventory.disk-usage-timeout:5s}")
    private Duration diskUsageTimeout;

    public KubernetesInventoryClient(KubernetesClient client,
                                     TimeLimiterRegistry timeLimiterRegistry,
                                     @Qualifier("inventoryExecutor") ExecutorService inventoryExecutor,
                                     MeterRegistry meterRegistry) {
        this.client = client;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.inventoryExecutor = inventoryExecutor;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public List<ResourceSnapshot> listResources(Set<ResourceKind> kinds, List<String> namespaces) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return bounded("list resources", () -> {
                Instant observedAt = Instant.now();
                List<ResourceSnapshot> snapshots = new ArrayList<>();
                if (kinds.contains(ResourceKind.POD)) {
                    for (String namespace : namespaces) {
                        snapshots.addAll(listPods(namespace, observedAt));
                    }
                }
                if (kinds.contains(ResourceKind.NODE)) {
                    snapshots.addAll(listNodes(observedAt));
                }
                return snapshots;
            });
        } finally {
            sample.stop(meterRegistry.timer("podwatch.inventory.fetch.duration"));
        }
    }

    @Override
    public List<NodeStats> collectNodeStats() {
        return bounded("collect node stats", () -> {
            Instant now = Instant.now();
            Map<String, Integer> podsPerNode = new HashMap<>();
            for (Pod pod : client.pods().inAnyNamespace().list().getItems()) {
                if (pod.getSpec() != null && pod.getSpec().getNodeName() != null) {
                    podsPerNode.merge(pod.getSpec().getNodeName(), 1, Integer::sum);
                }
            }
            List<NodeStats> stats = new ArrayList<>();
            for (Node node : client.nodes().list().getItems()) {
                stats.add(mapper.toNodeStats(node, podsPerNode.getOrDefault(node.getMetadata().getName(), 0), now));
            }
            return stats;
        });
    }

    @Override
    public boolean deleteResource(ResourceKey key) {
        if (key.getKind() != ResourceKind.POD) {
            throw new IllegalArgumentException("Only pods can be restarted, got " + key);
        }
        return bounded("delete " + key, () -> {
            List<StatusDetails> deleted = client.pods()
                    .inNamespace(key.getNamespace())
                    .withName(key.getName())
                    .delete();
            boolean found = deleted != null && !deleted.isEmpty();
            log.info("Delete of {} requested, found={}", key, found);
            return found;
        });
    }

    @Override
    public String verifyConnectivity() {
        return bounded("verify connectivity", () -> {
            VersionInfo version = client.getKubernetesVersion();
            log.info("Connected to cluster {} (server {})", client.getMasterUrl(), version.getGitVersion());
            return version.getGitVersion();
        });
    }

    private List<ResourceSnapshot> listPods(String namespace, Instant observedAt) {
        List<Pod> pods = client.pods().inNamespace(namespace).list().getItems();
        List<Service> services = client.services().inNamespace(namespace).list().getItems();
        Map<String, PodMetrics> metrics = podMetrics(namespace);

        List<ResourceSnapshot> snapshots = new ArrayList<>(pods.size());
        for (Pod pod : pods) {
            ResourceUsage usage = mapper.podUsage(metrics.get(pod.getMetadata().getName()));
            if (collectDiskUsage && "Running".equals(pod.getStatus() != null ? pod.getStatus().getPhase() : null)) {
                usage = usage.toBuilder().diskPercent(diskPercent(pod)).build();
            }
            snapshots.add(mapper.toSnapshot(pod, services, usage, observedAt));
        }
        log.debug("Namespace {}: {} pods", namespace, snapshots.size());
        return snapshots;
    }

    private List<ResourceSnapshot> listNodes(Instant observedAt) {
        Map<String, NodeMetrics> metrics = nodeMetrics();
        List<ResourceSnapshot> snapshots = new ArrayList<>();
        for (Node node : client.nodes().list().getItems()) {
            snapshots.add(mapper.toSnapshot(node, mapper.nodeUsage(metrics.get(node.getMetadata().getName())), observedAt));
        }
        return snapshots;
    }

    private Map<String, PodMetrics> podMetrics(String namespace) {
        try {
            Map<String, PodMetrics> byName = new HashMap<>();
            for (PodMetrics m : client.top().pods().inNamespace(namespace).metrics().getItems()) {
                byName.put(m.getMetadata().getName(), m);
            }
            return byName;
        } catch (KubernetesClientException e) {
            log.debug("Pod metrics unavailable for namespace {}: {}", namespace, e.getMessage());
            meterRegistry.counter("podwatch.inventory.metrics.unavailable", "kind", "pod").increment();
            return Collections.emptyMap();
        }
    }

    private Map<String, NodeMetrics> nodeMetrics() {
        try {
            Map<String, NodeMetrics> byName = new HashMap<>();
            for (NodeMetrics m : client.top().nodes().metrics().getItems()) {
                byName.put(m.getMetadata().getName(), m);
            }
            return byName;
        } catch (KubernetesClientException e) {
            log.debug("Node metrics unavailable: {}", e.getMessage());
            meterRegistry.counter("podwatch.inventory.metrics.unavailable", "kind", "node").increment();
            return Collections.emptyMap();
        }
    }

    private Double diskPercent(Pod pod) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ExecWatch watch = client.pods()
                .inNamespace(pod.getMetadata().getNamespace())
                .withName(pod.getMetadata().getName())
                .writingOutput(out)
                .exec("df", "-P", "/")) {
            watch.exitCode().get(diskUsageTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return KubernetesResourceMapper.parseDiskPercent(out.toString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (Exception e) {
            log.debug("Disk usage unavailable for {}/{}: {}",
                    pod.getMetadata().getNamespace(), pod.getMetadata().getName(), e.getMessage());
            return null;
        }
    }

    private <T> T bounded(String operation, Supplier<T> call) {
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(FETCH_INSTANCE);
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, inventoryExecutor));
        } catch (TimeoutException e) {
            meterRegistry.counter("podwatch.inventory.failures", "reason", "timeout").increment();
            throw new InventoryException("Cluster call '" + operation + "' timed out", e);
        } catch (KubernetesClientException e) {
            meterRegistry.counter("podwatch.inventory.failures", "reason", "api").increment();
            throw new InventoryException("Cluster call '" + operation + "' failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (ExecutionException e) {
            meterRegistry.counter("podwatch.inventory.failures", "reason", "error").increment();
            throw new InventoryException("Cluster call '" + operation + "' failed", e.getCause());
        } catch (Exception e) {
            meterRegistry.counter("podwatch.inventory.failures", "reason", "error").increment();
            throw new InventoryException("Cluster call '" + operation + "' failed: " + e.getMessage(), e);
        }
    }
}
