package com.company.podwatch.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertLevel {
    INFO(1, "Informational - no action required"),
    WARNING(2, "Warning - requires attention"),
    CRITICAL(3, "Critical - immediate action required");

    private final int level;
    private final String description;

    AlertLevel(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    public boolean isHigherThan(AlertLevel other) {
        return this.level > other.level;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AlertLevel fromString(String level) {
        if (level == null) {
            return INFO;
        }
        try {
            return AlertLevel.valueOf(level.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return INFO;
        }
    }
}
