package com.autoposter.controller;

import com.autoposter.model.CycleTrigger;
import com.autoposter.model.FailureReason;
import com.autoposter.model.FailureStage;
import com.autoposter.model.PostRecord;
import com.autoposter.model.PostStatus;
import com.autoposter.service.PostHistoryFilter;
import com.autoposter.service.PostHistoryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HistoryController.class)
class HistoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PostHistoryService postHistoryService;

    @Test
    void listAppliesFiltersAndLimit() throws Exception {
        PostHistoryFilter expected = new PostHistoryFilter(PostStatus.FAILED, 5L, null, null);
        when(postHistoryService.recent(eq(expected), eq(10))).thenReturn(List.of(PostRecord.builder()
                .id(3L)
                .topicId(5L)
                .topicName("Privacy tools")
                .status(PostStatus.FAILED)
                .failureReason(FailureReason.RATE_LIMIT_ERROR)
                .failureStage(FailureStage.POST_SUBMISSION)
                .trigger(CycleTrigger.TIMED)
                .attemptCount(3)
                .createdAt(OffsetDateTime.of(2026, 2, 1, 10, 0, 0, 0, ZoneOffset.UTC))
                .build()));

        mockMvc.perform(get("/api/history")
                        .param("status", "FAILED")
                        .param("topicId", "5")
                        .param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(3))
                .andExpect(jsonPath("$[0].failureReason").value("RATE_LIMIT_ERROR"))
                .andExpect(jsonPath("$[0].failureStage").value("POST_SUBMISSION"))
                .andExpect(jsonPath("$[0].attemptCount").value(3));
    }

    @Test
    void listPassesCreatedAtRange() throws Exception {
        OffsetDateTime from = OffsetDateTime.of(2026, 2, 1, 0, 0, 0, 0, ZoneOffset.UTC);
        OffsetDateTime to = OffsetDateTime.of(2026, 3, 1, 0, 0, 0, 0, ZoneOffset.UTC);
        when(postHistoryService.recent(eq(new PostHistoryFilter(null, null, from, to)), eq(50)))
                .thenReturn(List.of(PostRecord.builder()
                        .id(8L)
                        .status(PostStatus.SUCCEEDED)
                        .trigger(CycleTrigger.MANUAL)
                        .attemptCount(1)
                        .createdAt(OffsetDateTime.of(2026, 2, 14, 8, 30, 0, 0, ZoneOffset.UTC))
                        .build()));

        mockMvc.perform(get("/api/history")
                        .param("createdFrom", "2026-02-01T00:00:00Z")
                        .param("createdTo", "2026-03-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(8))
                .andExpect(jsonPath("$[0].status").value("SUCCEEDED"));
    }

    @Test
    void listRejectsInvertedCreatedAtRange() throws Exception {
        mockMvc.perform(get("/api/history")
                        .param("createdFrom", "2026-03-01T00:00:00Z")
                        .param("createdTo", "2026-02-01T00:00:00Z"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_request"));

        verify(postHistoryService, never()).recent(any(), anyInt());
    }

    @Test
    void listRejectsOversizedLimit() throws Exception {
        mockMvc.perform(get("/api/history").param("limit", "501"))
                .andExpect(status().isBadRequest());

        verify(postHistoryService, never()).recent(any(), anyInt());
    }

    @Test
    void exportReturnsCsvAttachment() throws Exception {
        when(postHistoryService.exportAll()).thenReturn("Id,Date,Status\r\n");

        mockMvc.perform(get("/api/history/export"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("post-history.csv")))
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, containsString("text/csv")))
                .andExpect(content().string(containsString("Id,Date,Status")));
    }

    @Test
    void clearWithoutConfirmationIsRejected() throws Exception {
        mockMvc.perform(delete("/api/history"))
                .andExpect(status().isPreconditionRequired())
                .andExpect(jsonPath("$.code").value("confirmation_required"));

        verify(postHistoryService, never()).clear();
    }

    @Test
    void clearWithConfirmationReportsDeletedCount() throws Exception {
        when(postHistoryService.clear()).thenReturn(12L);

        mockMvc.perform(delete("/api/history").param("confirm", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(12));
    }
}
