package com.company.podwatch.domain;

import com.company.podwatch.domain.enums.ChangeType;
import com.company.podwatch.domain.enums.ResourceKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Detected difference between two consecutive observations of the same resource
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;

    private ResourceKind kind;
    private String namespace;
    private String name;

    private ChangeType changeType;
    private String oldValue;
    private String newValue;

    // NEW events emitted while establishing the very first baseline
    private boolean initialObservation;

    private Instant occurredAt;

    public ResourceKey key() {
        return new ResourceKey(kind, namespace, name);
    }
}
