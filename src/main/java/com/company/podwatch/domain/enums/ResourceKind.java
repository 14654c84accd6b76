package com.company.podwatch.domain.enums;

public enum ResourceKind {
    POD("pod"),
    NODE("node");

    private final String label;

    ResourceKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isNamespaced() {
        return this == POD;
    }

    public static ResourceKind fromString(String kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Resource kind is required");
        }
        return ResourceKind.valueOf(kind.trim().toUpperCase());
    }
}
