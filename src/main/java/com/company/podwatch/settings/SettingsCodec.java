package com.company.podwatch.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of {@link PodWatchSettings} as stored in the config table.
 * Also used for deep copies handed out to readers.
 */
public final class SettingsCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private SettingsCodec() {
    }

    public static String toJson(PodWatchSettings settings) {
        try {
            return MAPPER.writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Settings could not be serialized", e);
        }
    }

    public static PodWatchSettings fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, PodWatchSettings.class);
    }

    public static PodWatchSettings copy(PodWatchSettings settings) {
        if (settings == null) {
            return null;
        }
        return MAPPER.convertValue(settings, PodWatchSettings.class);
    }
}
