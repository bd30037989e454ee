package com.flagship.creator_ledger.content;

import com.flagship.creator_ledger.creator.CreatorService;
import com.flagship.creator_ledger.creator.CreatorStats;
import com.flagship.creator_ledger.event.ContentPostedEvent;
import com.flagship.creator_ledger.ledger.ContentId;
import com.flagship.creator_ledger.ledger.ErrorCode;
import com.flagship.creator_ledger.ledger.LedgerCall;
import com.flagship.creator_ledger.ledger.LedgerException;
import com.flagship.creator_ledger.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Content registry.
 *
 * Ids come from one global counter, so they are dense and follow call order.
 * The counter advance and the creator's total_content increment are staged in
 * the same call and commit together.
 */
@Service
@RequiredArgsConstructor
public class ContentService {

    private final CreatorService creatorService;

    /**
     * Publishes a content record owned by the caller.
     *
     * @throws LedgerException NOT_A_CREATOR if the caller is not registered
     */
    public Content post(LedgerCall call, String contentHash, boolean premium, boolean tipEnabled) {
        if (contentHash == null) {
            throw new IllegalArgumentException("Content hash is required");
        }
        LedgerStore store = call.getStore();
        CreatorStats stats = creatorService.requireCreatorStats(store, call.getCaller());

        ContentId id = store.nextContentId();
        Content content = Content.post(id, call.getCaller(), contentHash, call.getNow(), premium, tipEnabled);

        store.saveContent(content);
        store.saveNextContentId(id.next());
        store.saveStats(stats.recordContentPosted());

        call.emit(ContentPostedEvent.fromContent(content));
        return content;
    }

    /**
     * @throws LedgerException NOT_FOUND for an id that was never assigned
     */
    public Content requireContent(LedgerStore store, ContentId id) {
        return store.findContent(id)
            .orElseThrow(() -> new LedgerException(ErrorCode.NOT_FOUND, "Content " + id + " does not exist"));
    }
}
