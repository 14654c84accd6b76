package com.company.podwatch.service;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of writing a batch where every row is attempted independently
 */
@Getter
public class BatchWriteResult {

    private int written;
    private final List<String> failures = new ArrayList<>();

    void recordSuccess() {
        written++;
    }

    void recordFailure(String description) {
        failures.add(description);
    }

    public int getFailed() {
        return failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public List<String> getFailures() {
        return Collections.unmodifiableList(failures);
    }
}
