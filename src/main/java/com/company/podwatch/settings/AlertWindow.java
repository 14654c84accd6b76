package com.company.podwatch.settings;

import com.company.podwatch.domain.enums.AlertLevel;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;
import java.util.List;

/**
 * Same-day time range with the alert levels and namespaces it lets through
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertWindow {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime start;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime end;

    private List<AlertLevel> levels;

    // empty means every namespace
    private List<String> namespaces;

    /**
     * Inclusive on both ends, compared at minute precision
     */
    public boolean covers(LocalTime time) {
        LocalTime minute = time.withSecond(0).withNano(0);
        return !minute.isBefore(start) && !minute.isAfter(end);
    }

    public boolean allowsLevel(AlertLevel level) {
        return levels != null && levels.contains(level);
    }

    public boolean allowsNamespace(String namespace) {
        return namespaces == null || namespaces.isEmpty() || namespaces.contains(namespace);
    }
}
