package com.flagship.member_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Association-wide finance settings.
 *
 * Bound from the {@code finance.*} namespace. The defaults mirror the values the
 * association has used since the SEPA migration.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "finance")
public class FinanceProperties {

    /** Fee charged per period (semester). */
    @NotNull
    @DecimalMin("0.00")
    private BigDecimal membershipFee = new BigDecimal("4.00");

    /** Number of billing periods per year. The annual fee is fee times this. */
    @Min(1)
    private int periodsPerYear = 2;

    /** Former members are archived automatically this long after their membership lapsed. */
    @NotNull
    private Duration archivalGracePeriod = Duration.ofDays(730);

    @Valid
    private Sepa sepa = new Sepa();

    /**
     * Fee owed for one full year of membership.
     */
    public BigDecimal annualMembershipFee() {
        return membershipFee.multiply(BigDecimal.valueOf(periodsPerYear));
    }

    @Getter
    @Setter
    @Validated
    public static class Sepa {
        @NotBlank
        private String creditorName = "CdE e.V.";

        private String addressLine1 = "Musterstrasse 1";

        private String addressLine2 = "12345 Musterstadt";

        @NotBlank
        private String country = "DE";

        @NotBlank
        private String creditorIban = "DE87200500001234567890";

        /** Creditor identifier (Gläubiger-ID). */
        @NotBlank
        private String creditorId = "DE00ZZZ00099999999";

        /** Prefix of every mandate reference. */
        @NotBlank
        private String mandatePrefix = "CDE-I25";

        /** Mandates granted before this date were migrated and carry the cutoff date. */
        private LocalDate initialisationDate = LocalDate.of(2013, 7, 30);

        private LocalDate cutoffDate = LocalDate.of(2013, 10, 14);

        /** Calendar days are counted in this zone. */
        @NotNull
        private ZoneId timeZone = ZoneId.of("Europe/Berlin");

        /** Days between issuing a transaction and collecting it. */
        @Min(1)
        private int paymentOffsetDays = 17;

        /** Fee the bank charges us for a returned debit. */
        @NotNull
        private BigDecimal rollbackFee = new BigDecimal("4.50");

        /** Remittance text; {id}, {given} and {family} are substituted. */
        @NotBlank
        private String remittanceTemplate = "Mitgliedsbeitrag {id}, {family}, {given}";
    }
}
