package com.flagship.creator_ledger.health;

import com.flagship.creator_ledger.ledger.PlatformLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness and readiness checks.
 * Reports the ledger as DOWN when its store cannot be read.
 */
@RestController
@Slf4j
public class HealthController {

    private final PlatformLedger ledger;

    public HealthController(PlatformLedger ledger) {
        this.ledger = ledger;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean ledgerHealthy = checkLedger();
        response.put("ledger", ledgerHealthy ? "UP" : "DOWN");

        if (!ledgerHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkLedger() {
        try {
            ledger.contentCount();
            return true;
        } catch (RuntimeException e) {
            log.warn("Ledger health check failed: {}", e.getMessage());
            return false;
        }
    }
}
