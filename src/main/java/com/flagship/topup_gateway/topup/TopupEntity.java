package com.flagship.topup_gateway.topup;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for topup rows.
 *
 * No setters: the only mutations are the narrow ones the saga and the
 * lifecycle commands need (details, amount, status, trash/restore).
 * Timestamps are maintained by the lifecycle hooks.
 */
@Entity
@Table(
    name = "topups",
    indexes = {
        @Index(name = "idx_topups_card_number", columnList = "card_number"),
        @Index(name = "idx_topups_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TopupEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "topup_id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "topup_no", nullable = false, updatable = false, unique = true)
    private UUID topupNo;

    @Column(name = "card_number", nullable = false)
    private String cardNumber;

    @Column(name = "topup_amount", nullable = false)
    private long topupAmount;

    @Column(name = "topup_method", nullable = false)
    private String topupMethod;

    @Column(nullable = false, length = 20)
    private TopupStatus status;

    /**
     * Persistence concern only; the domain object does not carry it.
     */
    @Column(name = "idempotency_key", updatable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "topup_time", nullable = false, updatable = false)
    private Instant topupTime;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
        if (this.topupTime == null) {
            this.topupTime = this.createdAt;
        }
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Creates a new row in PENDING status. This is the only way to build a
     * fresh entity.
     */
    static TopupEntity pending(String cardNumber, long topupAmount, String topupMethod, String idempotencyKey) {
        if (topupAmount <= 0) {
            throw new IllegalArgumentException("Topup amount must be positive");
        }
        TopupEntity entity = new TopupEntity();
        entity.topupNo = UUID.randomUUID();
        entity.cardNumber = cardNumber;
        entity.topupAmount = topupAmount;
        entity.topupMethod = topupMethod;
        entity.status = TopupStatus.PENDING;
        entity.idempotencyKey = idempotencyKey;
        return entity;
    }

    void updateDetails(String cardNumber, long topupAmount, String topupMethod) {
        changeAmount(topupAmount);
        this.cardNumber = cardNumber;
        this.topupMethod = topupMethod;
    }

    void changeAmount(long topupAmount) {
        if (topupAmount <= 0) {
            throw new IllegalArgumentException("Topup amount must be positive");
        }
        this.topupAmount = topupAmount;
    }

    void changeStatus(TopupStatus status) {
        this.status = status;
    }

    void trash() {
        if (this.deletedAt != null) {
            throw new IllegalStateException("Topup " + id + " is already trashed");
        }
        this.deletedAt = Instant.now();
    }

    void restore() {
        if (this.deletedAt == null) {
            throw new IllegalStateException("Topup " + id + " is not trashed");
        }
        this.deletedAt = null;
    }

    public Topup toDomain() {
        return new Topup(
            id,
            topupNo,
            cardNumber,
            topupAmount,
            topupMethod,
            status,
            topupTime,
            createdAt,
            updatedAt,
            deletedAt
        );
    }
}
