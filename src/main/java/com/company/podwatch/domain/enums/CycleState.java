package com.company.podwatch.domain.enums;

/**
 * Poll cycle state. A cycle walks the states in declaration order and always ends in IDLE,
 * whether it succeeded or not.
 */
public enum CycleState {
    IDLE,
    FETCHING,
    DIFFING,
    PERSISTING,
    EVALUATING,
    DISPATCHING;

    public boolean isActive() {
        return this != IDLE;
    }
}
