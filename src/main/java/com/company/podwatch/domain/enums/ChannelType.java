package com.company.podwatch.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChannelType {
    EMAIL("email"),
    CHAT_API("chat-api"),
    SMS("sms"),
    BOT("bot");

    private final String code;

    ChannelType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ChannelType fromString(String value) {
        if (value == null) {
            return null;
        }
        for (ChannelType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown channel type: " + value);
    }
}
