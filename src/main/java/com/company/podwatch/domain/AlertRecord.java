package com.company.podwatch.domain;

import com.company.podwatch.domain.enums.AlertLevel;
import com.company.podwatch.domain.enums.ChangeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One row per alert decision, independent of how delivery went
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long alertId;
    private String subject;
    private String message;
    private AlertLevel level;

    // null for system alerts (maintenance, test notifications)
    private String namespace;
    private String name;
    private ChangeType changeType;

    private boolean dispatched;
    private Instant createdAt;

    @Builder.Default
    private List<DeliveryOutcome> deliveries = new ArrayList<>();
}
