package com.flagship.member_ledger.membership;

import com.flagship.member_ledger.ledger.FinanceActor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Drives the balance update and the automatic archival to completion, one
 * transaction per persona.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceUpdateRunner {

    private final SemesterBillingService billingService;

    public BalanceUpdateReport runBalanceUpdate(FinanceActor actor) {
        long start = System.currentTimeMillis();
        int processed = 0;
        while (billingService.processBalanceStep(actor).isPresent()) {
            processed++;
        }
        Period period = billingService.currentPeriod();
        log.info("Balance update run finished: period={}, processed={}, duration={}ms",
                period.getId(), processed, System.currentTimeMillis() - start);
        return new BalanceUpdateReport(processed, period);
    }

    public ArchivalReport runArchival(FinanceActor actor) {
        long start = System.currentTimeMillis();
        int processed = 0;
        int archived = 0;
        Optional<ArchivalStep> step;
        while ((step = billingService.processArchivalStep(actor)).isPresent()) {
            processed++;
            if (step.get().isArchived()) {
                archived++;
            }
        }
        Period period = billingService.currentPeriod();
        log.info("Archival run finished: period={}, processed={}, archived={}, duration={}ms",
                period.getId(), processed, archived, System.currentTimeMillis() - start);
        return new ArchivalReport(processed, archived, period);
    }
}
