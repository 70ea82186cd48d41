package com.flagship.member_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Finance view of a persona: identity for bank documents plus balance and membership
 * state. The version increases with every ledger mutation.
 */
@Value
public class Persona {

    public static final String AGGREGATE_TYPE = "Persona";

    Long id;
    String givenNames;
    String familyName;
    BigDecimal balance;
    boolean member;
    boolean trialMember;
    boolean archived;
    long version;

    public String getFullName() {
        return givenNames + " " + familyName;
    }
}
