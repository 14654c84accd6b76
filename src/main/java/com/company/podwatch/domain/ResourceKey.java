package com.company.podwatch.domain;

import com.company.podwatch.domain.enums.ResourceKind;
import lombok.Value;

import java.util.Comparator;

/**
 * Identity of an observed resource. Cluster-scoped resources (nodes) use an empty namespace.
 */
@Value
public class ResourceKey implements Comparable<ResourceKey> {

    public static final String CLUSTER_SCOPE = "";

    private static final Comparator<ResourceKey> ORDER = Comparator
            .comparing(ResourceKey::getKind)
            .thenComparing(ResourceKey::getNamespace)
            .thenComparing(ResourceKey::getName);

    ResourceKind kind;
    String namespace;
    String name;

    public ResourceKey(ResourceKind kind, String namespace, String name) {
        if (kind == null || name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource key requires kind and name");
        }
        this.kind = kind;
        this.namespace = kind.isNamespaced() && namespace != null ? namespace : CLUSTER_SCOPE;
        this.name = name;
    }

    public static ResourceKey pod(String namespace, String name) {
        return new ResourceKey(ResourceKind.POD, namespace, name);
    }

    public static ResourceKey node(String name) {
        return new ResourceKey(ResourceKind.NODE, CLUSTER_SCOPE, name);
    }

    @Override
    public int compareTo(ResourceKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return kind.getLabel() + ":" + (namespace.isEmpty() ? "" : namespace + "/") + name;
    }
}
