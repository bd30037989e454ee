package com.flagship.creator_ledger.creator;

import com.flagship.creator_ledger.ledger.Address;
import lombok.Value;

import java.time.Instant;

/**
 * Registered creator identity.
 * Created exactly once per address and never modified or deleted afterwards.
 */
@Value
public class CreatorProfile {
    Address creator;
    String profileData;
    Instant registeredAt;
}
