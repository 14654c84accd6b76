package com.company.podwatch.domain;

import com.company.podwatch.domain.enums.ChangeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Filters for change history lookups. Every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeQuery {
    private String namespace;
    private String name;
    private ChangeType changeType;
    private Instant since;
    private Instant until;
    private Integer limit;
}
