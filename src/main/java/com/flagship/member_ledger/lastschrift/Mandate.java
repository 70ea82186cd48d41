package com.flagship.member_ledger.lastschrift;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * A SEPA direct debit mandate (Lastschrift) of a persona.
 *
 * Active while {@code revokedAt} is null. Revocation is terminal; a persona has at
 * most one active mandate. Like the other domain objects this one is immutable and
 * every change returns a new instance.
 */
@Value
public class Mandate {

    public static final String AGGREGATE_TYPE = "LastschriftMandate";

    Long id;
    Long personaId;
    BigDecimal donation;
    String iban;
    String accountOwner;
    String accountAddress;
    Instant grantedAt;
    Instant revokedAt;
    String notes;
    Long submittedBy;

    /**
     * Creates a new, active mandate.
     *
     * @throws IllegalArgumentException for a negative donation or an invalid IBAN
     */
    public static Mandate grant(Long personaId, BigDecimal donation, String iban, String accountOwner,
                                String accountAddress, String notes, Long submittedBy) {
        if (personaId == null) {
            throw new IllegalArgumentException("Persona is required");
        }
        return new Mandate(
            null,
            personaId,
            requireDonation(donation),
            IbanValidator.normalize(iban),
            blankToNull(accountOwner),
            blankToNull(accountAddress),
            Instant.now(),
            null,
            notes,
            submittedBy
        );
    }

    public boolean isActive() {
        return revokedAt == null;
    }

    /**
     * @throws IllegalStateException if the mandate is already revoked
     */
    public Mandate revoke(Instant at) {
        if (!isActive()) {
            throw new IllegalStateException("Mandate " + id + " is already revoked");
        }
        return new Mandate(id, personaId, donation, iban, accountOwner, accountAddress, grantedAt, at,
            notes, submittedBy);
    }

    /**
     * Changes the donation and the account holder details. The IBAN is fixed; a new
     * account needs a new mandate.
     */
    public Mandate withDetails(BigDecimal newDonation, String newAccountOwner, String newAccountAddress,
                               String newNotes) {
        if (!isActive()) {
            throw new IllegalStateException("Revoked mandate " + id + " cannot be changed");
        }
        return new Mandate(id, personaId, requireDonation(newDonation), iban, blankToNull(newAccountOwner),
            blankToNull(newAccountAddress), grantedAt, null, newNotes, submittedBy);
    }

    /**
     * Date of signature as reported to the bank. Mandates migrated before the SEPA
     * switch all carry the migration cutoff date.
     */
    public LocalDate mandateDate(LocalDate initialisationDate, LocalDate cutoffDate, ZoneId zone) {
        LocalDate granted = LocalDate.ofInstant(grantedAt, zone);
        return granted.isBefore(initialisationDate) ? cutoffDate : granted;
    }

    private static BigDecimal requireDonation(BigDecimal donation) {
        if (donation == null) {
            return BigDecimal.ZERO.setScale(2);
        }
        if (donation.signum() < 0) {
            throw new IllegalArgumentException("Donation must not be negative: " + donation);
        }
        if (donation.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException("Donation must not have more than two decimal places: " + donation);
        }
        return donation.setScale(2);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
