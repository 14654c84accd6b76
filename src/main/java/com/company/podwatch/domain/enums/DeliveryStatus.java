package com.company.podwatch.domain.enums;

public enum DeliveryStatus {
    SENT("Alert has been delivered to the destination"),
    FAILED("Delivery to the destination failed");

    private final String description;

    DeliveryStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static DeliveryStatus fromString(String status) {
        if (status == null) {
            return FAILED;
        }
        try {
            return DeliveryStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return FAILED;
        }
    }
}
