package com.flagship.member_ledger.fee;

import com.flagship.member_ledger.fee.dto.RegistrationFeeResponse;
import com.flagship.member_ledger.fee.dto.RegistrationPaymentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;

@RestController
@RequestMapping("/api/registrations/{registrationId}")
@RequiredArgsConstructor
public class RegistrationFeeController {

    private final FeeAggregationService aggregationService;

    @GetMapping("/fee")
    public RegistrationFeeResponse getFee(@PathVariable("registrationId") Long registrationId) {
        return RegistrationFeeResponse.from(aggregationService.calculateRegistrationFee(registrationId));
    }

    /**
     * Called by the registration subsystem after parts or fields of a registration changed.
     */
    @PostMapping("/fee/recalculate")
    public RegistrationFeeResponse recalculate(@PathVariable("registrationId") Long registrationId) {
        return RegistrationFeeResponse.from(aggregationService.recalculateRegistration(registrationId));
    }

    @PostMapping("/payments")
    public Map<String, BigDecimal> bookPayment(@PathVariable("registrationId") Long registrationId,
                                               @Valid @RequestBody RegistrationPaymentRequest request) {
        BigDecimal paid = aggregationService.bookRegistrationPayment(registrationId, request.getAmount());
        return Map.of("amount_paid", paid);
    }
}
