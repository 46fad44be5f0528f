package com.ayni.api.event;

import com.ayni.api.state.LedgerStateService;
import com.ayni.core.domain.Identities;
import com.ayni.core.domain.LedgerEvent;
import com.ayni.core.domain.LedgerEvent.EventType;
import com.ayni.core.repository.LedgerEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Append-only ledger event log with hash chaining.
 *
 * Every committed ledger transition appends exactly one event in the same transaction as
 * the transition itself, so a rolled back operation leaves no event behind.
 */
@Service
public class LedgerEventService {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventService.class);

    private final LedgerEventRepository eventRepository;
    private final LedgerStateService ledgerState;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher publisher;

    public LedgerEventService(
            LedgerEventRepository eventRepository,
            LedgerStateService ledgerState,
            ObjectMapper objectMapper,
            ApplicationEventPublisher publisher) {
        this.eventRepository = eventRepository;
        this.ledgerState = ledgerState;
        this.objectMapper = objectMapper;
        this.publisher = publisher;
    }

    /**
     * Appends an event chained to the latest one. Must run inside the transaction of the
     * operation being recorded.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerEvent append(
            EventType eventType,
            Long donationId,
            String subject,
            String actor,
            Map<String, Object> payload) {

        String previousHash = eventRepository.findLatestEventHash()
                .orElse(LedgerEvent.GENESIS);

        LedgerEvent event = LedgerEvent.create(
                eventType,
                donationId,
                subject,
                actor,
                toJson(payload),
                ledgerState.now(),
                previousHash
        );
        event.setEventHash(sha256(event.hashInput()));

        LedgerEvent saved = eventRepository.save(event);
        log.debug("Appended ledger event {} {} for donation {}", saved.getId(), eventType, donationId);

        publisher.publishEvent(new LedgerEventRecorded(
                saved.getId(), eventType, donationId, saved.getEventHash()));
        return saved;
    }

    /**
     * Recomputes an event's hash and checks its link to the event before it.
     */
    @Transactional(readOnly = true)
    public EventVerificationResult verifyEvent(Long eventId) {
        LedgerEvent event = getEvent(eventId);

        boolean hashValid = sha256(event.hashInput()).equals(event.getEventHash());
        boolean chainValid = eventRepository.findTopByIdLessThanOrderByIdDesc(eventId)
                .map(previous -> previous.getEventHash().equals(event.getPreviousHash()))
                .orElse(LedgerEvent.GENESIS.equals(event.getPreviousHash()));

        return new EventVerificationResult(
                eventId,
                hashValid,
                chainValid,
                hashValid && chainValid,
                event.getAnchorTxHash()
        );
    }

    /**
     * Records the transaction that anchored an event on chain. Runs after the ledger
     * operation has committed, in its own transaction.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordAnchor(Long eventId, String txHash) {
        LedgerEvent event = getEvent(eventId);
        event.setAnchorTxHash(txHash);
        eventRepository.save(event);
    }

    @Transactional(readOnly = true)
    public LedgerEvent getEvent(Long eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new EventNotFoundException("Ledger event not found: " + eventId));
    }

    @Transactional(readOnly = true)
    public List<LedgerEventDto> eventsForDonation(Long donationId) {
        return eventRepository.findByDonationIdOrderByIdAsc(donationId).stream()
                .map(LedgerEventDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<LedgerEventDto> eventsForIdentity(String identity) {
        return eventRepository.findByParticipant(Identities.require(identity)).stream()
                .map(LedgerEventDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<LedgerEventDto> eventsOfType(EventType eventType) {
        return eventRepository.findByEventTypeOrderByIdAsc(eventType).stream()
                .map(LedgerEventDto::from)
                .toList();
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Event payload is not serialisable", e);
        }
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    public record LedgerEventDto(
            Long id,
            EventType eventType,
            Long donationId,
            String subject,
            String actor,
            String payload,
            Instant occurredAt,
            String previousHash,
            String eventHash,
            String anchorTxHash
    ) {
        static LedgerEventDto from(LedgerEvent event) {
            return new LedgerEventDto(
                    event.getId(),
                    event.getEventType(),
                    event.getDonationId(),
                    event.getSubject(),
                    event.getActor(),
                    event.getPayload(),
                    event.getOccurredAt(),
                    event.getPreviousHash(),
                    event.getEventHash(),
                    event.getAnchorTxHash()
            );
        }
    }

    public record EventVerificationResult(
            Long eventId,
            boolean hashValid,
            boolean chainValid,
            boolean valid,
            String anchorTxHash
    ) {}

    public static class EventNotFoundException extends RuntimeException {
        public EventNotFoundException(String message) { super(message); }
    }
}
