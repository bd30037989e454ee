package com.flagship.creator_ledger.content;

import com.flagship.creator_ledger.ledger.Address;
import com.flagship.creator_ledger.ledger.ContentId;
import com.flagship.creator_ledger.ledger.ErrorCode;
import com.flagship.creator_ledger.ledger.LedgerException;
import com.flagship.creator_ledger.ledger.PlatformLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ContentController.class)
class ContentControllerTest {

    private static final String CALLER_HEADER = "X-Caller-Address";
    private static final Address CREATOR = Address.of("creator-1");
    private static final Address FAN = Address.of("fan-1");
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlatformLedger ledger;

    private Content content(long id, boolean premium, boolean tipEnabled) {
        return Content.post(ContentId.of(id), CREATOR, "hash1", NOW, premium, tipEnabled);
    }

    @Test
    @DisplayName("POST /api/contents returns the new record")
    void testPostContent() throws Exception {
        when(ledger.postContent(CREATOR, "hash1", true, true)).thenReturn(content(0, true, true));

        mockMvc.perform(post("/api/contents")
                .header(CALLER_HEADER, "creator-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content_hash\":\"hash1\",\"is_premium\":true,\"tip_enabled\":true}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.content_id").value(0))
            .andExpect(jsonPath("$.is_premium").value(true))
            .andExpect(jsonPath("$.tip_enabled").value(true))
            .andExpect(jsonPath("$.total_tips").value(0));
    }

    @Test
    @DisplayName("Posting as a non-creator maps to 403")
    void testPostContent_NotACreator() throws Exception {
        when(ledger.postContent(FAN, "hash1", false, false))
            .thenThrow(new LedgerException(ErrorCode.NOT_A_CREATOR, "not a creator"));

        mockMvc.perform(post("/api/contents")
                .header(CALLER_HEADER, "fan-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content_hash\":\"hash1\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("NOT_A_CREATOR"));
    }

    @Test
    @DisplayName("GET content by id, count, and unknown ids")
    void testGetContent() throws Exception {
        when(ledger.content(ContentId.of(0))).thenReturn(content(0, false, true));
        when(ledger.content(ContentId.of(9))).thenThrow(new LedgerException(ErrorCode.NOT_FOUND, "missing"));
        when(ledger.contentCount()).thenReturn(1L);

        mockMvc.perform(get("/api/contents/0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.creator").value("creator-1"));
        mockMvc.perform(get("/api/contents/9"))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/contents/count"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content_count").value(1));
        mockMvc.perform(get("/api/contents/-1"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Tip endpoint maps success and rejections")
    void testTip() throws Exception {
        when(ledger.tip(FAN, ContentId.of(0), BigInteger.valueOf(50)))
            .thenReturn(content(0, false, true).recordTip(BigInteger.valueOf(50)));
        when(ledger.tip(FAN, ContentId.of(1), BigInteger.TEN))
            .thenThrow(new LedgerException(ErrorCode.TIPPING_NOT_ENABLED, "disabled"));
        when(ledger.tip(FAN, ContentId.of(0), BigInteger.ZERO))
            .thenThrow(new LedgerException(ErrorCode.INVALID_AMOUNT, "zero"));

        mockMvc.perform(post("/api/contents/0/tips")
                .header(CALLER_HEADER, "fan-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":50}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_tips").value(50));
        mockMvc.perform(post("/api/contents/1/tips")
                .header(CALLER_HEADER, "fan-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":10}"))
            .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/api/contents/0/tips")
                .header(CALLER_HEADER, "fan-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_AMOUNT"));
    }

    @Test
    @DisplayName("Engagement endpoint maps success and rejections")
    void testEngage() throws Exception {
        when(ledger.engage(FAN, ContentId.of(0), "LIKE"))
            .thenReturn(content(0, true, false).recordEngagement());
        when(ledger.engage(FAN, ContentId.of(1), "LIKE"))
            .thenThrow(new LedgerException(ErrorCode.NOT_SUBSCRIBED, "premium"));
        when(ledger.engage(FAN, ContentId.of(2), "LIKE"))
            .thenThrow(new LedgerException(ErrorCode.ALREADY_ENGAGED, "again"));

        mockMvc.perform(post("/api/contents/0/engagements")
                .header(CALLER_HEADER, "fan-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"engagement_type\":\"LIKE\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.total_engagements").value(1));
        mockMvc.perform(post("/api/contents/1/engagements")
                .header(CALLER_HEADER, "fan-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"engagement_type\":\"LIKE\"}"))
            .andExpect(status().isForbidden());
        mockMvc.perform(post("/api/contents/2/engagements")
                .header(CALLER_HEADER, "fan-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"engagement_type\":\"LIKE\"}"))
            .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Blank engagement type never reaches the ledger")
    void testEngage_BlankType() throws Exception {
        mockMvc.perform(post("/api/contents/0/engagements")
                .header(CALLER_HEADER, "fan-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"engagement_type\":\"\"}"))
            .andExpect(status().isBadRequest());

        verify(ledger, never()).engage(any(), any(), anyString());
    }
}
