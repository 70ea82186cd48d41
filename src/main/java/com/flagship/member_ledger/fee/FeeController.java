package com.flagship.member_ledger.fee;

import com.flagship.member_ledger.fee.dto.FeeDefinitionRequest;
import com.flagship.member_ledger.fee.dto.FeeDefinitionResponse;
import com.flagship.member_ledger.fee.dto.FeePreviewRequest;
import com.flagship.member_ledger.fee.dto.RegistrationFeeResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for the fee definitions of an event.
 *
 * Condition validation errors come back as 400 with the offending position, changes to
 * a locked event as 409.
 */
@RestController
@RequestMapping("/api/events/{eventId}/fees")
@RequiredArgsConstructor
public class FeeController {

    private final FeeDefinitionService feeDefinitionService;
    private final FeeAggregationService aggregationService;

    @GetMapping
    public List<FeeDefinitionResponse> listFees(@PathVariable("eventId") Long eventId) {
        return feeDefinitionService.listFees(eventId).stream()
            .map(FeeDefinitionResponse::from)
            .toList();
    }

    @GetMapping("/{feeId}")
    public ResponseEntity<FeeDefinitionResponse> getFee(@PathVariable("eventId") Long eventId,
                                                        @PathVariable("feeId") Long feeId) {
        return feeDefinitionService.findFee(eventId, feeId)
            .map(fee -> ResponseEntity.ok(FeeDefinitionResponse.from(fee)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<FeeDefinitionResponse> createFee(@PathVariable("eventId") Long eventId,
                                                           @Valid @RequestBody FeeDefinitionRequest request) {
        FeeDefinition fee = feeDefinitionService.createFee(eventId, request.getTitle(), request.getKind(),
            request.getAmount(), request.getCondition(), request.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(FeeDefinitionResponse.from(fee));
    }

    @PutMapping("/{feeId}")
    public FeeDefinitionResponse updateFee(@PathVariable("eventId") Long eventId,
                                           @PathVariable("feeId") Long feeId,
                                           @Valid @RequestBody FeeDefinitionRequest request) {
        return FeeDefinitionResponse.from(feeDefinitionService.updateFee(eventId, feeId, request.getTitle(),
            request.getKind(), request.getAmount(), request.getCondition(), request.getNotes()));
    }

    @DeleteMapping("/{feeId}")
    public ResponseEntity<Void> deleteFee(@PathVariable("eventId") Long eventId,
                                          @PathVariable("feeId") Long feeId) {
        feeDefinitionService.deleteFee(eventId, feeId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/precompute")
    public RegistrationFeeResponse precompute(@PathVariable("eventId") Long eventId,
                                              @RequestBody FeePreviewRequest request) {
        return RegistrationFeeResponse.from(aggregationService.precomputeFee(eventId, request.toPreview()));
    }

    @GetMapping("/stats")
    public FeeStats stats(@PathVariable("eventId") Long eventId) {
        return aggregationService.getFeeStats(eventId);
    }

    @PostMapping("/recalculate")
    public Map<String, Object> recalculate(@PathVariable("eventId") Long eventId) {
        int changed = aggregationService.recalculateEvent(eventId);
        return Map.of("event_id", eventId, "changed_registrations", changed);
    }
}
