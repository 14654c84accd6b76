package com.company.podwatch.channel;

import com.company.podwatch.domain.AlertRecord;
import com.company.podwatch.domain.enums.AlertLevel;
import lombok.Builder;
import lombok.Value;

/**
 * Channel-neutral rendering of an alert
 */
@Value
@Builder
public class AlertMessage {
    Long alertId;
    AlertLevel level;
    String subject;
    String body;

    public static AlertMessage of(AlertRecord alert) {
        return AlertMessage.builder()
                .alertId(alert.getAlertId())
                .level(alert.getLevel())
                .subject(alert.getSubject())
                .body(alert.getMessage())
                .build();
    }

    /**
     * Single-text form used by chat, SMS and bot channels
     */
    public String asText() {
        return "[" + level.name() + "] " + subject + "\n\n" + body;
    }
}
