package com.flagship.creator_ledger.content;

import com.flagship.creator_ledger.content.dto.ContentResponse;
import com.flagship.creator_ledger.content.dto.EngageRequest;
import com.flagship.creator_ledger.content.dto.PostContentRequest;
import com.flagship.creator_ledger.content.dto.TipRequest;
import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import com.flagship.creator_ledger.ledger.PlatformLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static com.flagship.creator_ledger.observability.CorrelationContext.CALLER_ADDRESS_HEADER;
import static com.flagship.creator_ledger.observability.CorrelationContext.CONTENT_ID_MDC_KEY;

/**
 * REST controller for content records, tips and engagement.
 */
@RestController
@RequestMapping("/api/contents")
@RequiredArgsConstructor
@Slf4j
public class ContentController {

    private final PlatformLedger ledger;

    @PostMapping
    public ResponseEntity<ContentResponse> postContent(
            @RequestHeader(CALLER_ADDRESS_HEADER) String caller,
            @Valid @RequestBody PostContentRequest request) {

        log.info("Received content post: premium={}, tipEnabled={}", request.isPremium(), request.isTipEnabled());
        Content content = ledger.postContent(Address.of(caller), request.getContentHash(),
            request.isPremium(), request.isTipEnabled());

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ContentResponse.from(content));
    }

    @GetMapping("/count")
    public ResponseEntity<Map<String, Long>> getContentCount() {
        return ResponseEntity.ok(Map.of("content_count", ledger.contentCount()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ContentResponse> getContent(@PathVariable("id") long id) {
        return ResponseEntity.ok(ContentResponse.from(ledger.content(ContentId.of(id))));
    }

    @PostMapping("/{id}/tips")
    public ResponseEntity<ContentResponse> tip(
            @RequestHeader(CALLER_ADDRESS_HEADER) String caller,
            @PathVariable("id") long id,
            @Valid @RequestBody TipRequest request) {

        MDC.put(CONTENT_ID_MDC_KEY, String.valueOf(id));
        try {
            log.info("Received tip: amount={}", request.getAmount());
            Content content = ledger.tip(Address.of(caller), ContentId.of(id), request.getAmount());
            return ResponseEntity.ok(ContentResponse.from(content));
        } finally {
            MDC.remove(CONTENT_ID_MDC_KEY);
        }
    }

    @PostMapping("/{id}/engagements")
    public ResponseEntity<ContentResponse> engage(
            @RequestHeader(CALLER_ADDRESS_HEADER) String caller,
            @PathVariable("id") long id,
            @Valid @RequestBody EngageRequest request) {

        MDC.put(CONTENT_ID_MDC_KEY, String.valueOf(id));
        try {
            log.info("Received engagement: type={}", request.getEngagementType());
            Content content = ledger.engage(Address.of(caller), ContentId.of(id), request.getEngagementType());
            return ResponseEntity.status(HttpStatus.CREATED).body(ContentResponse.from(content));
        } finally {
            MDC.remove(CONTENT_ID_MDC_KEY);
        }
    }
}
