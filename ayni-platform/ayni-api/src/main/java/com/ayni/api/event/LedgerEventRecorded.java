package com.ayni.api.event;

import com.ayni.core.domain.LedgerEvent.EventType;

/**
 * Published in-process when a ledger event is appended. Listeners that act on it after
 * commit see only events of committed operations.
 */
public record LedgerEventRecorded(
        Long eventId,
        EventType eventType,
        Long donationId,
        String eventHash
) {}
