package com.company.podwatch.service;

import com.company.podwatch.domain.AlertRecord;
import lombok.Value;

import java.util.List;

/**
 * Alerts recorded for one batch of change events, plus the alert writes that failed
 */
@Value
public class AlertEvaluation {
    List<AlertRecord> alerts;
    BatchWriteResult writes;

    public boolean hasWriteFailures() {
        return writes.hasFailures();
    }
}
