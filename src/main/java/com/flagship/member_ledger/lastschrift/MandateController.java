package com.flagship.member_ledger.lastschrift;

import com.flagship.member_ledger.config.FinanceProperties;
import com.flagship.member_ledger.lastschrift.dto.CreateMandateRequest;
import com.flagship.member_ledger.lastschrift.dto.MandateResponse;
import com.flagship.member_ledger.lastschrift.dto.RevokeMandateRequest;
import com.flagship.member_ledger.lastschrift.dto.TransactionResponse;
import com.flagship.member_ledger.lastschrift.dto.UpdateMandateRequest;
import com.flagship.member_ledger.ledger.FinanceActor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Direct debit mandates of personas.
 */
@RestController
@RequestMapping("/api/lastschrift/mandates")
@RequiredArgsConstructor
public class MandateController {

    private final MandateService mandateService;
    private final LastschriftTransactionService transactionService;
    private final FinanceProperties financeProperties;

    @PostMapping
    public ResponseEntity<MandateResponse> grant(@Valid @RequestBody CreateMandateRequest request,
                                                 @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        Mandate mandate = mandateService.grant(request.getPersonaId(), request.getDonation(), request.getIban(),
            request.getAccountOwner(), request.getAccountAddress(), request.getNotes(), FinanceActor.of(submittedBy));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(mandate));
    }

    /**
     * Mandates of one persona (newest first), or all mandates in id order.
     */
    @GetMapping
    public List<MandateResponse> list(@RequestParam(value = "persona_id", required = false) Long personaId,
                                      @RequestParam(value = "active", defaultValue = "false") boolean activeOnly) {
        List<Mandate> mandates = personaId != null
            ? mandateService.findByPersona(personaId).stream()
                .filter(mandate -> !activeOnly || mandate.isActive())
                .toList()
            : mandateService.findAll(activeOnly);
        return mandates.stream().map(this::toResponse).toList();
    }

    @GetMapping("/{mandateId}")
    public ResponseEntity<MandateResponse> get(@PathVariable("mandateId") Long mandateId) {
        return mandateService.findById(mandateId)
            .map(mandate -> ResponseEntity.ok(toResponse(mandate)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PatchMapping("/{mandateId}")
    public MandateResponse update(@PathVariable("mandateId") Long mandateId,
                                  @Valid @RequestBody UpdateMandateRequest request,
                                  @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        return toResponse(mandateService.update(mandateId, request.getDonation(), request.getAccountOwner(),
            request.getAccountAddress(), request.getNotes(), FinanceActor.of(submittedBy)));
    }

    @PostMapping("/{mandateId}/revoke")
    public MandateResponse revoke(@PathVariable("mandateId") Long mandateId,
                                  @RequestBody(required = false) RevokeMandateRequest request,
                                  @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        String reason = request != null ? request.getReason() : null;
        return toResponse(mandateService.revoke(mandateId, FinanceActor.of(submittedBy), reason));
    }

    @DeleteMapping("/{mandateId}")
    public ResponseEntity<Void> delete(@PathVariable("mandateId") Long mandateId,
                                       @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        mandateService.delete(mandateId, FinanceActor.of(submittedBy));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{mandateId}/skip")
    public ResponseEntity<TransactionResponse> skip(@PathVariable("mandateId") Long mandateId,
                                                    @RequestHeader(FinanceActor.HEADER) Long submittedBy) {
        LastschriftTransaction skipped = transactionService.skipMandate(mandateId, FinanceActor.of(submittedBy));
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(skipped));
    }

    @GetMapping("/{mandateId}/transactions")
    public List<TransactionResponse> transactions(@PathVariable("mandateId") Long mandateId) {
        return transactionService.findByMandate(mandateId).stream().map(TransactionResponse::from).toList();
    }

    private MandateResponse toResponse(Mandate mandate) {
        return MandateResponse.from(mandate, financeProperties.getSepa().getMandatePrefix());
    }
}
