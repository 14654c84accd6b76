package com.company.podwatch.domain.enums;

public enum ChangeType {
    STATUS_CHANGE("status_change"),
    IMAGE_CHANGE("image_change"),
    NEW("new"),
    REMOVED("removed");

    private final String code;

    ChangeType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Image changes live in their own history table, everything else in status history.
     */
    public boolean isImageHistory() {
        return this == IMAGE_CHANGE;
    }

    public static ChangeType fromString(String value) {
        if (value == null) {
            return null;
        }
        for (ChangeType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown change type: " + value);
    }
}
