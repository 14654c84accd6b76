package com.company.podwatch.repository;

import com.company.podwatch.exception.SettingsValidationException;
import com.company.podwatch.settings.PodWatchSettings;
import com.company.podwatch.settings.SettingsCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class SettingsRepository {

    public static final String SETTINGS_KEY = "system_config";

    private final JdbcTemplate jdbcTemplate;

    /**
     * @return stored settings, empty when none were ever saved
     * @throws SettingsValidationException when the stored document cannot be parsed
     */
    public Optional<PodWatchSettings> load() {
        List<String> rows = jdbcTemplate.queryForList(
                "SELECT config_value FROM config WHERE config_key = ?", String.class, SETTINGS_KEY);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(SettingsCodec.fromJson(rows.get(0)));
        } catch (JsonProcessingException e) {
            throw new SettingsValidationException(List.of("stored settings are not valid JSON: " + e.getOriginalMessage()));
        }
    }

    public void save(PodWatchSettings settings) {
        String json = SettingsCodec.toJson(settings);
        Timestamp now = Timestamp.from(Instant.now());

        int updated = jdbcTemplate.update(
                "UPDATE config SET config_value = ?, updated_at = ? WHERE config_key = ?",
                json, now, SETTINGS_KEY);
        if (updated > 0) {
            return;
        }
        try {
            jdbcTemplate.update(
                    "INSERT INTO config (config_key, config_value, updated_at) VALUES (?, ?, ?)",
                    SETTINGS_KEY, json, now);
        } catch (DuplicateKeyException e) {
            // concurrent first save
            jdbcTemplate.update(
                    "UPDATE config SET config_value = ?, updated_at = ? WHERE config_key = ?",
                    json, now, SETTINGS_KEY);
        }
        log.debug("Settings persisted (version {})", settings.getVersion());
    }
}
