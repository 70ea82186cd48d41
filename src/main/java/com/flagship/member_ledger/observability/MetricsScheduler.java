package com.flagship.member_ledger.observability;

import com.flagship.member_ledger.ledger.FinanceLogQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the database-backed gauges: outbox backlog, skipped bank lines and the
 * membership figures of the finance overview.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final FinanceMetrics financeMetrics;
    private final FinanceLogQueryService financeLogQueryService;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            financeMetrics.updateMembershipGauges(financeLogQueryService.computeStatistics());
        } catch (DataAccessException e) {
            log.warn("Failed to refresh membership gauges: {}", e.getMessage());
        }
    }
}
