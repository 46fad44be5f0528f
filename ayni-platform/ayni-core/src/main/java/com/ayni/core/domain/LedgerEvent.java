package com.ayni.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Append-only record of a committed ledger transition. Each event carries the hash of
 * the one before it.
 */
@Entity
@Table(name = "ledger_events", indexes = {
    @Index(name = "idx_event_donation", columnList = "donation_id"),
    @Index(name = "idx_event_subject", columnList = "subject"),
    @Index(name = "idx_event_hash", columnList = "event_hash", unique = true)
})
public class LedgerEvent {

    public static final String GENESIS = "GENESIS";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40)
    private EventType eventType;

    @Column(name = "donation_id")
    private Long donationId;

    @Column(length = 42)
    private String subject;

    @NotNull
    @Column(nullable = false, length = 42)
    private String actor;

    @NotNull
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @NotNull
    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @NotNull
    @Column(name = "previous_hash", nullable = false, length = 64)
    private String previousHash;

    @Column(name = "event_hash", length = 64)
    private String eventHash;

    @Column(name = "anchor_tx_hash", length = 66)
    private String anchorTxHash;

    protected LedgerEvent() {}

    public static LedgerEvent create(
            EventType eventType,
            Long donationId,
            String subject,
            String actor,
            String payload,
            Instant occurredAt,
            String previousHash) {
        var event = new LedgerEvent();
        event.eventType = eventType;
        event.donationId = donationId;
        event.subject = subject;
        event.actor = actor;
        event.payload = payload;
        event.occurredAt = occurredAt;
        event.previousHash = previousHash;
        return event;
    }

    /**
     * Canonical text the event hash is computed over.
     */
    public String hashInput() {
        return String.join("|",
                eventType.name(),
                String.valueOf(donationId),
                String.valueOf(subject),
                actor,
                payload,
                occurredAt.toString(),
                previousHash);
    }

    // Getters
    public Long getId() { return id; }
    public EventType getEventType() { return eventType; }
    public Long getDonationId() { return donationId; }
    public String getSubject() { return subject; }
    public String getActor() { return actor; }
    public String getPayload() { return payload; }
    public Instant getOccurredAt() { return occurredAt; }
    public String getPreviousHash() { return previousHash; }
    public String getEventHash() { return eventHash; }
    public String getAnchorTxHash() { return anchorTxHash; }

    public void setEventHash(String hash) { this.eventHash = hash; }
    public void setAnchorTxHash(String txHash) { this.anchorTxHash = txHash; }

    public enum EventType {
        DONATION_CREATED,
        DONATION_FUNDED,
        DONATION_DISTRIBUTED,
        DONATION_CANCELLED,
        FUNDING_PERIOD_EXTENDED,
        REPUTATION_UPDATED,
        ROLE_GRANTED,
        ROLE_REVOKED,
        LEDGER_PAUSED,
        LEDGER_UNPAUSED,
        EMERGENCY_WITHDRAWAL
    }
}
