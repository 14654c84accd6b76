package com.company.podwatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.company.podwatch.domain.enums.ChannelType;
import com.company.podwatch.domain.enums.DeliveryStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryOutcome implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long outcomeId;
    private Long alertId;
    private String destinationId;
    private ChannelType channelType;
    private DeliveryStatus status;
    private int attempt;
    private String error;
    private Instant attemptedAt;

    @JsonIgnore
    public boolean isSent() {
        return status == DeliveryStatus.SENT;
    }
}
