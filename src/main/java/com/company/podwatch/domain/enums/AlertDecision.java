package com.company.podwatch.domain.enums;

public enum AlertDecision {
    /** Change type not alertable, nothing is recorded. */
    SKIP,
    /** Recorded for audit, no window allows dispatch right now. */
    RECORD_ONLY,
    DISPATCH;

    public boolean isRecorded() {
        return this != SKIP;
    }
}
