package com.flagship.member_ledger.lastschrift;

import lombok.Value;

import java.util.List;

/**
 * Result of a batch operation: what was processed and what was rejected.
 *
 * Rejected items do not abort the batch.
 */
@Value
public class BatchReport<T> {
    List<T> processed;
    List<BatchItemError> errors;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
