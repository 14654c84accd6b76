package com.company.podwatch.domain;

import com.company.podwatch.domain.enums.ResourceKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time observation of one pod or node. Immutable; the next poll supersedes it.
 */
@Value
@Builder(toBuilder = true)
public class ResourceSnapshot {

    ResourceKind kind;
    String namespace;
    String name;

    String status;
    String hostAssignment;

    // pods only
    String primaryImage;

    String ipInternal;
    String ipExternal;

    @Singular
    List<PortInfo> ports;

    ResourceUsage usage;

    // creation timestamp reported by the cluster
    Instant createdAt;
    Instant observedAt;

    @JsonIgnore
    public ResourceKey getKey() {
        return new ResourceKey(kind, namespace, name);
    }

    @JsonIgnore
    public boolean isPod() {
        return kind == ResourceKind.POD;
    }

    public ResourceUsage getUsage() {
        return usage != null ? usage : ResourceUsage.EMPTY;
    }
}
