package com.flagship.creator_ledger.creator;

import com.flagship.creator_ledger.event.CreatorRegisteredEvent;
import com.flagship.creator_ledger.event.SubscriptionFeeUpdatedEvent;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ErrorCode;
import com.flagship.creator_ledger.ledger.LedgerCall;
import com.flagship.creator_ledger.ledger.LedgerException;
import com.flagship.creator_ledger.ledger.LedgerStore;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Creator registry.
 *
 * Enforces:
 * - one registration per address, forever
 * - only registered creators carry stats, post, accept subscriptions or set a fee
 */
@Service
public class CreatorService {

    /**
     * Registers the caller as a creator with zeroed stats.
     *
     * @param call current ledger call
     * @param profileData non-blank handle or profile reference
     * @return the new profile
     * @throws LedgerException INVALID_PROFILE_DATA or ALREADY_REGISTERED
     */
    public CreatorProfile register(LedgerCall call, String profileData) {
        if (profileData == null || profileData.isBlank()) {
            throw new LedgerException(ErrorCode.INVALID_PROFILE_DATA, "Profile data must not be empty");
        }
        LedgerStore store = call.getStore();
        Address caller = call.getCaller();

        if (store.findProfile(caller).isPresent()) {
            throw new LedgerException(ErrorCode.ALREADY_REGISTERED,
                "Address " + caller + " is already registered as a creator");
        }

        CreatorProfile profile = new CreatorProfile(caller, profileData, call.getNow());
        store.saveProfile(profile);
        store.saveStats(CreatorStats.empty(caller));

        call.emit(CreatorRegisteredEvent.of(caller, profileData, call.getNow()));
        return profile;
    }

    /**
     * Overwrites the caller's subscription fee. Zero disables subscriptions.
     *
     * @throws LedgerException NOT_A_CREATOR, or INVALID_AMOUNT for a negative fee
     */
    public CreatorStats setSubscriptionFee(LedgerCall call, BigInteger fee) {
        if (fee == null || fee.signum() < 0) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "Subscription fee must not be negative");
        }
        CreatorStats updated = requireCreatorStats(call.getStore(), call.getCaller()).withSubscriptionFee(fee);
        call.getStore().saveStats(updated);

        call.emit(SubscriptionFeeUpdatedEvent.of(call.getCaller(), fee, call.getNow()));
        return updated;
    }

    /**
     * Stats of a registered creator.
     *
     * @throws LedgerException NOT_A_CREATOR if the address never registered
     */
    public CreatorStats requireCreatorStats(LedgerStore store, Address creator) {
        if (store.findProfile(creator).isEmpty()) {
            throw new LedgerException(ErrorCode.NOT_A_CREATOR, "Address " + creator + " is not a registered creator");
        }
        return store.findStats(creator)
            .orElseThrow(() -> new IllegalStateException("Creator " + creator + " is registered but has no stats"));
    }

    /**
     * Stats for any address; unregistered addresses read as all zeros.
     */
    public CreatorStats statsOf(LedgerStore store, Address creator) {
        return store.findStats(creator).orElseGet(() -> CreatorStats.empty(creator));
    }
}
