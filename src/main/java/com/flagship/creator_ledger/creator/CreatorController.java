package com.flagship.creator_ledger.creator;

import com.flagship.creator_ledger.creator.dto.CreatorProfileResponse;
import com.flagship.creator_ledger.creator.dto.CreatorStatsResponse;
import com.flagship.creator_ledger.creator.dto.RegisterCreatorRequest;
import com.flagship.creator_ledger.creator.dto.SubscriptionResponse;
import com.flagship.creator_ledger.creator.dto.UpdateSubscriptionFeeRequest;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.PlatformLedger;
import com.flagship.creator_ledger.subscription.Subscription;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.flagship.creator_ledger.observability.CorrelationContext.CALLER_ADDRESS_HEADER;

/**
 * REST controller for creator registration, fees and subscriptions.
 *
 * The caller is taken from the {@code X-Caller-Address} header, which the
 * fronting runtime has already authenticated.
 */
@RestController
@RequestMapping("/api/creators")
@RequiredArgsConstructor
@Slf4j
public class CreatorController {

    private final PlatformLedger ledger;

    @PostMapping
    public ResponseEntity<CreatorProfileResponse> register(
            @RequestHeader(CALLER_ADDRESS_HEADER) String caller,
            @Valid @RequestBody RegisterCreatorRequest request) {

        log.info("Received creator registration request");
        CreatorProfile profile = ledger.register(Address.of(caller), request.getProfileData());

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(CreatorProfileResponse.from(profile));
    }

    @PutMapping("/me/subscription-fee")
    public ResponseEntity<CreatorStatsResponse> updateSubscriptionFee(
            @RequestHeader(CALLER_ADDRESS_HEADER) String caller,
            @Valid @RequestBody UpdateSubscriptionFeeRequest request) {

        log.info("Received subscription fee update: fee={}", request.getSubscriptionFee());
        CreatorStats stats = ledger.setSubscriptionFee(Address.of(caller), request.getSubscriptionFee());

        return ResponseEntity.ok(CreatorStatsResponse.from(stats));
    }

    @GetMapping("/{address}")
    public ResponseEntity<CreatorProfileResponse> getProfile(@PathVariable("address") String address) {
        return ResponseEntity.ok(CreatorProfileResponse.from(ledger.creatorProfile(Address.of(address))));
    }

    /**
     * Unregistered addresses get an all-zero record rather than 404.
     */
    @GetMapping("/{address}/stats")
    public ResponseEntity<CreatorStatsResponse> getStats(@PathVariable("address") String address) {
        return ResponseEntity.ok(CreatorStatsResponse.from(ledger.creatorStats(Address.of(address))));
    }

    @PostMapping("/{address}/subscriptions")
    public ResponseEntity<SubscriptionResponse> subscribe(
            @RequestHeader(CALLER_ADDRESS_HEADER) String caller,
            @PathVariable("address") String address) {

        log.info("Received subscription request: creator={}", address);
        Subscription subscription = ledger.subscribe(Address.of(caller), Address.of(address));

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(SubscriptionResponse.from(subscription, true));
    }

    @GetMapping("/{address}/subscriptions/{user}")
    public ResponseEntity<SubscriptionResponse> getSubscription(
            @PathVariable("address") String address,
            @PathVariable("user") String user) {

        Address creator = Address.of(address);
        Address subscriber = Address.of(user);
        Subscription subscription = ledger.subscription(subscriber, creator);
        boolean subscribed = ledger.isSubscribed(subscriber, creator);

        return ResponseEntity.ok(SubscriptionResponse.from(subscription, subscribed));
    }
}
