package com.ayni.api.health;

import com.ayni.api.access.AccessControlService;
import com.ayni.blockchain.service.BlockchainEventAnchorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final AccessControlService accessControl;
    private final BlockchainEventAnchorService anchorService;
    private final Clock clock;

    public HealthController(AccessControlService accessControl, BlockchainEventAnchorService anchorService, Clock clock) {
        this.accessControl = accessControl;
        this.anchorService = anchorService;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "paused", accessControl.getStatus().paused(),
            "timestamp", clock.instant().toString()
        ));
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        return ResponseEntity.ok(Map.of(
            "name", "Ayni Donation Ledger API",
            "version", "1.0.0-SNAPSHOT",
            "description", "Escrowed donations with reputation aggregation",
            "anchoring", anchorService.isEnabled(),
            "timestamp", clock.instant().toString()
        ));
    }
}
