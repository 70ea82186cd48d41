package com.flagship.member_ledger.membership;

import lombok.Value;

@Value
public class ArchivalStep {
    Long personaId;
    boolean archived;
    Period period;
}
