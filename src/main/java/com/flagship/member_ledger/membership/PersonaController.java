package com.flagship.member_ledger.membership;

import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.ledger.FinanceLogEntry;
import com.flagship.member_ledger.ledger.FinanceLogQueryService;
import com.flagship.member_ledger.ledger.LedgerService;
import com.flagship.member_ledger.ledger.Persona;
import com.flagship.member_ledger.membership.dto.BalanceCorrectionRequest;
import com.flagship.member_ledger.membership.dto.CreatePersonaRequest;
import com.flagship.member_ledger.membership.dto.LedgerUpdateResponse;
import com.flagship.member_ledger.membership.dto.MembershipChangeRequest;
import com.flagship.member_ledger.membership.dto.MoneyTransferRequest;
import com.flagship.member_ledger.membership.dto.MoneyTransferResponse;
import com.flagship.member_ledger.membership.dto.PersonaResponse;
import com.flagship.member_ledger.observability.FinanceMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Persona balance and membership endpoints.
 *
 * Mutations need the X-Persona-Id header of the acting user. Money transfers also
 * need an Idempotency-Key; repeating a key returns the first result with 200.
 */
@RestController
@RequestMapping("/api/personas")
@RequiredArgsConstructor
@Slf4j
public class PersonaController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PersonaService personaService;
    private final MembershipService membershipService;
    private final LedgerService ledgerService;
    private final FinanceLogQueryService financeLogQueryService;
    private final MoneyTransferIdempotencyService idempotencyService;
    private final FinanceMetrics financeMetrics;

    @PostMapping
    public ResponseEntity<PersonaResponse> createPersona(@Valid @RequestBody CreatePersonaRequest request,
                                                         @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        Persona persona = personaService.createPersona(request.getGivenNames(), request.getFamilyName(),
            request.isMember(), request.isTrialMember(), FinanceActor.of(submittedBy));
        return ResponseEntity.status(HttpStatus.CREATED).body(PersonaResponse.from(persona));
    }

    @GetMapping("/{personaId}")
    public ResponseEntity<PersonaResponse> getPersona(@PathVariable("personaId") Long personaId) {
        return ledgerService.findPersona(personaId)
            .map(persona -> ResponseEntity.ok(PersonaResponse.from(persona)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{personaId}/money-transfers")
    @Transactional
    public ResponseEntity<MoneyTransferResponse> receiveMoneyTransfer(
            @PathVariable("personaId") Long personaId,
            @Valid @RequestBody MoneyTransferRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @RequestHeader(FinanceActor.HEADER) Long submittedBy) {

        Optional<Long> existing = idempotencyService.findFinanceLogId(idempotencyKey);
        if (existing.isPresent()) {
            financeMetrics.recordIdempotencyHit();
            FinanceLogEntry entry = financeLogQueryService.findEntry(existing.get())
                .orElseThrow(() -> new IllegalStateException(
                    "Idempotency key points to missing finance log entry " + existing.get()));
            if (!personaId.equals(entry.getPersonaId())) {
                throw new IllegalArgumentException("Idempotency key was used for a different persona");
            }
            Persona persona = ledgerService.findPersona(personaId)
                .orElseThrow(() -> new IllegalArgumentException("Persona not found: " + personaId));
            log.info("Idempotency key already used, returning earlier transfer: financeLogId={}", entry.getId());
            return ResponseEntity.ok(MoneyTransferResponse.replay(entry, persona));
        }
        financeMetrics.recordIdempotencyMiss();

        MoneyTransferResult result = membershipService.receiveMoneyTransfer(
            new MoneyTransfer(personaId, request.getAmount(), request.getTransactionDate(), request.getNote()),
            FinanceActor.of(submittedBy));
        idempotencyService.store(idempotencyKey, personaId, result.getTransfer().getEntry().getId());

        return ResponseEntity.status(HttpStatus.CREATED).body(MoneyTransferResponse.from(result));
    }

    @PostMapping("/{personaId}/balance-corrections")
    public ResponseEntity<LedgerUpdateResponse> correctBalance(@PathVariable("personaId") Long personaId,
                                                               @Valid @RequestBody BalanceCorrectionRequest request,
                                                               @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        return membershipService.correctBalance(personaId, request.getNewBalance(), request.getNote(),
                FinanceActor.of(submittedBy))
            .map(update -> ResponseEntity.ok(LedgerUpdateResponse.from(update)))
            .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/{personaId}/membership")
    public LedgerUpdateResponse changeMembership(@PathVariable("personaId") Long personaId,
                                                 @Valid @RequestBody MembershipChangeRequest request,
                                                 @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        return LedgerUpdateResponse.from(membershipService.changeMembership(personaId, request.getMember(),
            FinanceActor.of(submittedBy), request.getNote()));
    }

    @PostMapping("/{personaId}/trial-membership")
    public LedgerUpdateResponse startTrialMembership(@PathVariable("personaId") Long personaId,
                                                     @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        return LedgerUpdateResponse.from(
            membershipService.startTrialMembership(personaId, FinanceActor.of(submittedBy)));
    }

    @PostMapping("/{personaId}/archive")
    public LedgerUpdateResponse archivePersona(@PathVariable("personaId") Long personaId,
                                               @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        return LedgerUpdateResponse.from(
            membershipService.archivePersona(personaId, FinanceActor.of(submittedBy), null));
    }

    @GetMapping("/{personaId}/ledger-audit")
    public ResponseEntity<Map<String, Object>> auditLedger(@PathVariable("personaId") Long personaId) {
        if (ledgerService.findPersona(personaId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of(
            "persona_id", personaId,
            "consistent", ledgerService.verifyConsistency(personaId)));
    }
}
