package com.flagship.member_ledger.fee;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for event fee definitions.
 *
 * No setters: changes go through {@link #updateFromDomain(FeeDefinition)} so the
 * validated domain object stays the only way in.
 */
@Entity
@Table(
    name = "event_fees",
    indexes = @Index(name = "idx_event_fees_event_id", columnList = "event_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FeeDefinitionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private Long eventId;

    @Column(nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private FeeKind kind;

    @Column(nullable = false, precision = 8, scale = 2)
    private BigDecimal amount;

    @Column(name = "condition_expr", columnDefinition = "TEXT")
    private String condition;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static FeeDefinitionEntity fromDomain(FeeDefinition fee) {
        return new FeeDefinitionEntity(
            null, // assigned by the database
            fee.getEventId(),
            fee.getTitle(),
            fee.getKind(),
            fee.getAmount(),
            fee.getCondition(),
            fee.getNotes(),
            null,
            null
        );
    }

    public FeeDefinition toDomain() {
        return new FeeDefinition(id, eventId, title, kind, amount, condition, notes);
    }

    void updateFromDomain(FeeDefinition fee) {
        this.title = fee.getTitle();
        this.kind = fee.getKind();
        this.amount = fee.getAmount();
        this.condition = fee.getCondition();
        this.notes = fee.getNotes();
    }
}
