package com.flagship.member_ledger.membership;

import com.flagship.member_ledger.ledger.FinanceActor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Resumes a balance update or an archival run that was started but did not finish.
 * Starting one is always a manual decision.
 */
@Component
@ConditionalOnProperty(name = "finance.cron.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class FinanceCronJobs {

    private final SemesterBillingService billingService;
    private final BalanceUpdateRunner balanceUpdateRunner;

    @Scheduled(cron = "${finance.cron.balance-update:0 */15 * * * *}")
    public void resumeBalanceUpdate() {
        try {
            Period period = billingService.currentPeriod();
            if (!period.isBalanceStarted() || period.isBalanceDone()) {
                return;
            }
            log.info("Resuming balance update of period {} after persona {}", period.getId(), period.getBalanceState());
            balanceUpdateRunner.runBalanceUpdate(FinanceActor.system());
        } catch (Exception e) {
            log.error("Balance update cron run failed", e);
        }
    }

    @Scheduled(cron = "${finance.cron.archival:0 5/15 * * * *}")
    public void resumeArchival() {
        try {
            Period period = billingService.currentPeriod();
            if (!period.isArchivalStarted() || period.isArchivalDone()) {
                return;
            }
            log.info("Resuming archival of period {} after persona {}", period.getId(), period.getArchivalState());
            balanceUpdateRunner.runArchival(FinanceActor.system());
        } catch (Exception e) {
            log.error("Archival cron run failed", e);
        }
    }
}
