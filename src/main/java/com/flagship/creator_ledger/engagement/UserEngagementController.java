package com.flagship.creator_ledger.engagement;

import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.PlatformLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class UserEngagementController {

    private final PlatformLedger ledger;

    @GetMapping("/api/users/{address}/engagement-score")
    public ResponseEntity<Map<String, Object>> getEngagementScore(@PathVariable("address") String address) {
        Address user = Address.of(address);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("user", user.getValue());
        response.put("engagement_score", ledger.userEngagementScore(user));
        return ResponseEntity.ok(response);
    }
}
