package com.ayni.api.event;

import com.ayni.blockchain.service.BlockchainEventAnchorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Anchors committed ledger events on chain. Anchoring never affects the ledger operation:
 * it runs after commit and failures are only logged.
 */
@Component
public class LedgerEventAnchorListener {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventAnchorListener.class);

    private final BlockchainEventAnchorService anchorService;
    private final LedgerEventService eventService;

    public LedgerEventAnchorListener(BlockchainEventAnchorService anchorService, LedgerEventService eventService) {
        this.anchorService = anchorService;
        this.eventService = eventService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onEventRecorded(LedgerEventRecorded recorded) {
        if (!anchorService.isEnabled()) {
            return;
        }
        try {
            anchorService.anchorEvent(recorded.eventHash(), recorded.donationId(), recorded.eventId())
                    .ifPresentOrElse(result -> {
                        if (result.success()) {
                            eventService.recordAnchor(recorded.eventId(), result.txHash());
                            log.info("Anchored ledger event {} in tx {}", recorded.eventId(), result.txHash());
                        } else {
                            log.error("Anchor transaction {} for ledger event {} reverted",
                                    result.txHash(), recorded.eventId());
                        }
                    }, () -> log.error("Ledger event {} was not anchored", recorded.eventId()));
        } catch (RuntimeException e) {
            log.error("Failed to record anchor for ledger event {}", recorded.eventId(), e);
        }
    }
}
