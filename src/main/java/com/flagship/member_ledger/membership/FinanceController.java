package com.flagship.member_ledger.membership;

import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.ledger.FinanceLogCode;
import com.flagship.member_ledger.ledger.FinanceLogFilter;
import com.flagship.member_ledger.ledger.FinanceLogPage;
import com.flagship.member_ledger.ledger.FinanceLogQueryService;
import com.flagship.member_ledger.ledger.FinanceStatistics;
import com.flagship.member_ledger.membership.dto.FinanceLogEntryResponse;
import com.flagship.member_ledger.membership.dto.MoneyTransferBatchRequest;
import com.flagship.member_ledger.membership.dto.MoneyTransferResponse;
import com.flagship.member_ledger.membership.dto.PeriodResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Association-wide finance endpoints: bank statement import, finance log, statistics
 * and semester billing.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class FinanceController {

    private final MembershipService membershipService;
    private final FinanceLogQueryService financeLogQueryService;
    private final SemesterBillingService billingService;
    private final BalanceUpdateRunner balanceUpdateRunner;

    @PostMapping("/money-transfers/batch")
    public List<MoneyTransferResponse> processMoneyTransfers(@Valid @RequestBody MoneyTransferBatchRequest request,
                                                             @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        return membershipService.processMoneyTransfers(request.toTransfers(), FinanceActor.of(submittedBy))
            .stream()
            .map(MoneyTransferResponse::from)
            .toList();
    }

    @GetMapping("/finance-log")
    public Map<String, Object> financeLog(
            @RequestParam(value = "codes", required = false) Set<FinanceLogCode> codes,
            @RequestParam(value = "persona_id", required = false) Long personaId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "offset", defaultValue = "0") int offset,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {

        FinanceLogPage page = financeLogQueryService.find(FinanceLogFilter.builder()
            .codes(codes)
            .personaId(personaId)
            .from(from)
            .to(to)
            .offset(offset)
            .limit(limit)
            .build());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("total", page.getTotal());
        response.put("offset", page.getOffset());
        response.put("limit", page.getLimit());
        response.put("entries", page.getEntries().stream().map(FinanceLogEntryResponse::from).toList());
        return response;
    }

    @GetMapping("/finance/statistics")
    public FinanceStatistics statistics() {
        return financeLogQueryService.computeStatistics();
    }

    @GetMapping("/periods/current")
    public PeriodResponse currentPeriod() {
        return PeriodResponse.from(billingService.currentPeriod());
    }

    /**
     * Runs (or resumes) the balance update of the current period to completion.
     */
    @PostMapping("/periods/current/balance-update")
    public PeriodResponse runBalanceUpdate(@RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        BalanceUpdateReport report = balanceUpdateRunner.runBalanceUpdate(FinanceActor.of(submittedBy));
        return PeriodResponse.from(report.getPeriod(), report.getProcessed());
    }

    /**
     * Runs (or resumes) the automatic archival of the current period to completion.
     */
    @PostMapping("/periods/current/archival")
    public PeriodResponse runArchival(@RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        ArchivalReport report = balanceUpdateRunner.runArchival(FinanceActor.of(submittedBy));
        return PeriodResponse.from(report.getPeriod(), report.getProcessed());
    }

    @PostMapping("/periods/advance")
    public PeriodResponse advancePeriod(@RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        return PeriodResponse.from(billingService.advancePeriod());
    }
}
