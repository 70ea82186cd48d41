package com.flagship.member_ledger.lastschrift.sepa;

/**
 * SEPA sequence type of a recurring direct debit.
 */
public enum SequenceType {
    /** First collection on a mandate. */
    FRST,
    /** Any later collection. */
    RCUR
}
