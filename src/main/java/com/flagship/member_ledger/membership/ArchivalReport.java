package com.flagship.member_ledger.membership;

import lombok.Value;

@Value
public class ArchivalReport {
    /** Non-members looked at by this run. */
    int processed;
    /** Personas archived by this run. */
    int archived;
    Period period;
}
