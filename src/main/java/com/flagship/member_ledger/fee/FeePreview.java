package com.flagship.member_ledger.fee;

import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Hypothetical registration used for a fee dry run.
 */
@Value
public class FeePreview {
    Set<String> presentParts;
    Map<String, Object> fields;
    boolean member;
    boolean orga;
}
