package com.company.podwatch.inventory;

import com.company.podwatch.domain.NodeStats;
import com.company.podwatch.domain.PortInfo;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.ResourceSnapshot;
import com.company.podwatch.domain.ResourceUsage;
import com.company.podwatch.domain.enums.ResourceKind;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerPort;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.LoadBalancerIngress;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeAddress;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.ContainerMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.NodeMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts fabric8 API objects into snapshots. No cluster access.
 */
class KubernetesResourceMapper {

    static final String READY = "Ready";
    static final String NOT_READY = "NotReady";

    // container waiting/terminated reasons that say more than the pod phase
    private static final Set<String> REPORTED_REASONS = Set.of(
            "CrashLoopBackOff", "ImagePullBackOff", "ErrImagePull", "CreateContainerConfigError", "Error", "OOMKilled");

    ResourceSnapshot toSnapshot(Pod pod, List<Service> namespaceServices, ResourceUsage usage, Instant observedAt) {
        List<Container> containers = pod.getSpec() != null && pod.getSpec().getContainers() != null
                ? pod.getSpec().getContainers() : List.of();
        List<Service> selecting = selectingServices(pod, namespaceServices);

        return ResourceSnapshot.builder()
                .kind(ResourceKind.POD)
                .namespace(pod.getMetadata().getNamespace())
                .name(pod.getMetadata().getName())
                .status(podStatus(pod))
                .hostAssignment(pod.getSpec() != null ? pod.getSpec().getNodeName() : null)
                .primaryImage(containers.isEmpty() ? "" : containers.get(0).getImage())
                .ipInternal(pod.getStatus() != null ? pod.getStatus().getPodIP() : null)
                .ipExternal(firstIngressIp(selecting))
                .ports(ports(containers, selecting))
                .usage(usage)
                .createdAt(parseTimestamp(pod.getMetadata().getCreationTimestamp()))
                .observedAt(observedAt)
                .build();
    }

    ResourceSnapshot toSnapshot(Node node, ResourceUsage usage, Instant observedAt) {
        return ResourceSnapshot.builder()
                .kind(ResourceKind.NODE)
                .namespace(ResourceKey.CLUSTER_SCOPE)
                .name(node.getMetadata().getName())
                .status(nodeStatus(node))
                .ipInternal(nodeAddress(node, "InternalIP"))
                .ipExternal(nodeAddress(node, "ExternalIP"))
                .usage(usage)
                .createdAt(parseTimestamp(node.getMetadata().getCreationTimestamp()))
                .observedAt(observedAt)
                .build();
    }

    NodeStats toNodeStats(Node node, int podCount, Instant updatedAt) {
        Map<String, Quantity> allocatable = node.getStatus() != null ? node.getStatus().getAllocatable() : null;
        Map<String, Quantity> capacity = node.getStatus() != null ? node.getStatus().getCapacity() : null;
        return NodeStats.builder()
                .nodeName(node.getMetadata().getName())
                .status(nodeStatus(node))
                .cpuAllocatableMillicores(millicores(allocatable != null ? allocatable.get("cpu") : null))
                .memoryAllocatableBytes(bytes(allocatable != null ? allocatable.get("memory") : null))
                .cpuCapacityMillicores(millicores(capacity != null ? capacity.get("cpu") : null))
                .memoryCapacityBytes(bytes(capacity != null ? capacity.get("memory") : null))
                .podCount(podCount)
                .updatedAt(updatedAt)
                .build();
    }

    /**
     * Pod phase, refined by the first container reason that explains a failure, or Terminating while
     * the pod is being deleted
     */
    String podStatus(Pod pod) {
        if (pod.getMetadata().getDeletionTimestamp() != null) {
            return "Terminating";
        }
        if (pod.getStatus() == null) {
            return "Unknown";
        }
        List<ContainerStatus> statuses = pod.getStatus().getContainerStatuses();
        if (statuses != null) {
            for (ContainerStatus status : statuses) {
                if (status.getState() == null) {
                    continue;
                }
                if (status.getState().getWaiting() != null
                        && REPORTED_REASONS.contains(status.getState().getWaiting().getReason())) {
                    return status.getState().getWaiting().getReason();
                }
                if (status.getState().getTerminated() != null
                        && REPORTED_REASONS.contains(status.getState().getTerminated().getReason())) {
                    return status.getState().getTerminated().getReason();
                }
            }
        }
        String phase = pod.getStatus().getPhase();
        return phase != null ? phase : "Unknown";
    }

    String nodeStatus(Node node) {
        if (node.getStatus() == null || node.getStatus().getConditions() == null) {
            return NOT_READY;
        }
        for (NodeCondition condition : node.getStatus().getConditions()) {
            if (READY.equals(condition.getType())) {
                return "True".equals(condition.getStatus()) ? READY : NOT_READY;
            }
        }
        return NOT_READY;
    }

    /**
     * Services of the pod's namespace whose non-empty selector matches the pod labels
     */
    List<Service> selectingServices(Pod pod, List<Service> services) {
        Map<String, String> labels = pod.getMetadata().getLabels() != null ? pod.getMetadata().getLabels() : Map.of();
        List<Service> matching = new ArrayList<>();
        for (Service service : services) {
            Map<String, String> selector = service.getSpec() != null ? service.getSpec().getSelector() : null;
            if (selector == null || selector.isEmpty()) {
                continue;
            }
            boolean matches = selector.entrySet().stream()
                    .allMatch(e -> e.getValue().equals(labels.get(e.getKey())));
            if (matches) {
                matching.add(service);
            }
        }
        return matching;
    }

    List<PortInfo> ports(List<Container> containers, List<Service> selecting) {
        List<PortInfo> ports = new ArrayList<>();
        for (Container container : containers) {
            if (container.getPorts() == null) {
                continue;
            }
            for (ContainerPort containerPort : container.getPorts()) {
                ports.add(exposure(containerPort, selecting));
            }
        }
        return ports;
    }

    private PortInfo exposure(ContainerPort containerPort, List<Service> selecting) {
        PortInfo.PortInfoBuilder port = PortInfo.builder()
                .port(containerPort.getContainerPort())
                .protocol(containerPort.getProtocol() != null ? containerPort.getProtocol() : "TCP")
                .name(containerPort.getName() != null ? containerPort.getName() : "");

        for (Service service : selecting) {
            if (service.getSpec().getPorts() == null) {
                continue;
            }
            for (ServicePort servicePort : service.getSpec().getPorts()) {
                if (!targets(servicePort, containerPort)) {
                    continue;
                }
                boolean loadBalancer = "LoadBalancer".equals(service.getSpec().getType());
                String externalIp = loadBalancer ? ingressIp(service) : null;
                port.exposed(true)
                        .serviceName(service.getMetadata().getName())
                        .servicePort(servicePort.getPort())
                        .loadBalancer(loadBalancer)
                        .externalIp(externalIp)
                        .accessUrl(externalIp != null ? "http://" + externalIp + ":" + servicePort.getPort() : null);
            }
        }
        return port.build();
    }

    /**
     * A service port targets a container port by number, by name, or (without targetPort) by its own port
     */
    private boolean targets(ServicePort servicePort, ContainerPort containerPort) {
        if (servicePort.getTargetPort() == null) {
            return servicePort.getPort() != null && servicePort.getPort().equals(containerPort.getContainerPort());
        }
        if (servicePort.getTargetPort().getIntVal() != null) {
            return servicePort.getTargetPort().getIntVal().equals(containerPort.getContainerPort());
        }
        String target = servicePort.getTargetPort().getStrVal();
        return target != null && (target.equals(containerPort.getName())
                || target.equals(String.valueOf(containerPort.getContainerPort())));
    }

    private String firstIngressIp(List<Service> services) {
        for (Service service : services) {
            String ip = ingressIp(service);
            if (ip != null) {
                return ip;
            }
        }
        return null;
    }

    private String ingressIp(Service service) {
        if (service.getStatus() == null || service.getStatus().getLoadBalancer() == null) {
            return null;
        }
        List<LoadBalancerIngress> ingress = service.getStatus().getLoadBalancer().getIngress();
        if (ingress == null || ingress.isEmpty()) {
            return null;
        }
        return ingress.get(0).getIp() != null ? ingress.get(0).getIp() : ingress.get(0).getHostname();
    }

    private String nodeAddress(Node node, String type) {
        if (node.getStatus() == null || node.getStatus().getAddresses() == null) {
            return null;
        }
        return node.getStatus().getAddresses().stream()
                .filter(a -> type.equals(a.getType()))
                .map(NodeAddress::getAddress)
                .findFirst()
                .orElse(null);
    }

    ResourceUsage podUsage(PodMetrics metrics) {
        if (metrics == null || metrics.getContainers() == null) {
            return ResourceUsage.EMPTY;
        }
        long cpu = 0;
        long memory = 0;
        for (ContainerMetrics container : metrics.getContainers()) {
            Map<String, Quantity> usage = container.getUsage();
            if (usage == null) {
                continue;
            }
            Long containerCpu = millicores(usage.get("cpu"));
            Long containerMemory = bytes(usage.get("memory"));
            cpu += containerCpu != null ? containerCpu : 0;
            memory += containerMemory != null ? containerMemory : 0;
        }
        return ResourceUsage.builder().cpuMillicores(cpu).memoryBytes(memory).build();
    }

    ResourceUsage nodeUsage(NodeMetrics metrics) {
        if (metrics == null || metrics.getUsage() == null) {
            return ResourceUsage.EMPTY;
        }
        return ResourceUsage.builder()
                .cpuMillicores(millicores(metrics.getUsage().get("cpu")))
                .memoryBytes(bytes(metrics.getUsage().get("memory")))
                .build();
    }

    static Long millicores(Quantity quantity) {
        if (quantity == null) {
            return null;
        }
        return quantity.getNumericalAmount().multiply(BigDecimal.valueOf(1000)).longValue();
    }

    static Long bytes(Quantity quantity) {
        if (quantity == null) {
            return null;
        }
        return quantity.getNumericalAmount().longValue();
    }

    /**
     * Parses "Use%" output of {@code df -P /}, e.g. "42%"
     */
    static Double parseDiskPercent(String dfOutput) {
        if (dfOutput == null) {
            return null;
        }
        String[] lines = dfOutput.trim().split("\\R");
        String last = lines[lines.length - 1];
        for (String column : last.trim().split("\\s+")) {
            if (column.endsWith("%")) {
                try {
                    return Double.parseDouble(column.substring(0, column.length() - 1));
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }

    private static Instant parseTimestamp(String timestamp) {
        return timestamp != null ? Instant.parse(timestamp) : null;
    }
}
