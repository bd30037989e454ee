package com.flagship.creator_ledger.tipping;

import com.flagship.creator_ledger.content.Content;
import com.flagship.creator_ledger.content.ContentService;
import com.flagship.creator_ledger.creator.CreatorService;
import com.flagship.creator_ledger.creator.CreatorStats;
import com.flagship.creator_ledger.event.ContentTippedEvent;
import com.flagship.creator_ledger.ledger.ContentId;
import com.flagship.creator_ledger.ledger.ErrorCode;
import com.flagship.creator_ledger.ledger.LedgerCall;
import com.flagship.creator_ledger.ledger.LedgerException;
import com.flagship.creator_ledger.ledger.LedgerStore;
import com.flagship.creator_ledger.payment.PaymentService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Tips on content.
 *
 * The gross amount is added to both the content's total_tips and the owner's
 * total_tips_received, and only after the payment went through.
 */
@Service
@RequiredArgsConstructor
public class TipService {

    private final ContentService contentService;
    private final CreatorService creatorService;
    private final PaymentService paymentService;

    /**
     * @throws LedgerException NOT_FOUND, TIPPING_NOT_ENABLED, INVALID_AMOUNT or PAYMENT_FAILED
     */
    public Content tip(LedgerCall call, ContentId contentId, BigInteger amount) {
        LedgerStore store = call.getStore();
        Content content = contentService.requireContent(store, contentId);

        if (!content.isTipEnabled()) {
            throw new LedgerException(ErrorCode.TIPPING_NOT_ENABLED, "Tipping is disabled for content " + contentId);
        }
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "Tip amount must be greater than zero");
        }

        CreatorStats ownerStats = creatorService.statsOf(store, content.getCreator());

        paymentService.collect(call.getCaller(), content.getCreator(), amount, "tip");

        Content tipped = content.recordTip(amount);
        store.saveContent(tipped);
        store.saveStats(ownerStats.recordTip(amount));

        call.emit(ContentTippedEvent.of(contentId, call.getCaller(), amount, call.getNow()));
        return tipped;
    }
}
