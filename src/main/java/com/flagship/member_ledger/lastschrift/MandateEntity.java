package com.flagship.member_ledger.lastschrift;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for direct debit mandates.
 *
 * persona_id, iban and granted_at never change after insert. A partial unique
 * index keeps one active mandate per persona.
 */
@Entity
@Table(
    name = "lastschrift_mandates",
    indexes = @Index(name = "idx_lastschrift_mandates_persona_id", columnList = "persona_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MandateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "persona_id", nullable = false, updatable = false)
    private Long personaId;

    @Column(nullable = false, precision = 8, scale = 2)
    private BigDecimal donation;

    @Column(nullable = false, updatable = false, length = 34)
    private String iban;

    @Column(name = "account_owner")
    private String accountOwner;

    @Column(name = "account_address")
    private String accountAddress;

    @Column(name = "granted_at", nullable = false, updatable = false)
    private Instant grantedAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "submitted_by", updatable = false)
    private Long submittedBy;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static MandateEntity fromDomain(Mandate mandate) {
        return new MandateEntity(
            null, // assigned by the database
            mandate.getPersonaId(),
            mandate.getDonation(),
            mandate.getIban(),
            mandate.getAccountOwner(),
            mandate.getAccountAddress(),
            mandate.getGrantedAt(),
            mandate.getRevokedAt(),
            mandate.getNotes(),
            mandate.getSubmittedBy(),
            null
        );
    }

    public Mandate toDomain() {
        return new Mandate(id, personaId, donation, iban, accountOwner, accountAddress, grantedAt, revokedAt,
            notes, submittedBy);
    }

    void updateFromDomain(Mandate mandate) {
        this.donation = mandate.getDonation();
        this.accountOwner = mandate.getAccountOwner();
        this.accountAddress = mandate.getAccountAddress();
        this.revokedAt = mandate.getRevokedAt();
        this.notes = mandate.getNotes();
    }
}
