package com.flagship.creator_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exposes the initialization parameters of the ledger.
 */
@RestController
@RequiredArgsConstructor
public class PlatformController {

    private final PlatformLedger ledger;

    @GetMapping("/api/platform")
    public ResponseEntity<Map<String, Object>> getSettings() {
        LedgerSettings settings = ledger.settings();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("payment_token", settings.getPaymentToken());
        response.put("platform_fee_bps", settings.getPlatformFee().getBasisPoints());
        response.put("treasury", settings.getTreasury().getValue());
        response.put("subscription_period", settings.getSubscriptionPeriod().toString());
        return ResponseEntity.ok(response);
    }
}
