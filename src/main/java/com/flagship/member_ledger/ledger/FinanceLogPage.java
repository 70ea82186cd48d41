package com.flagship.member_ledger.ledger;

import lombok.Value;

import java.util.List;

@Value
public class FinanceLogPage {
    long total;
    int offset;
    int limit;
    List<FinanceLogEntry> entries;
}
