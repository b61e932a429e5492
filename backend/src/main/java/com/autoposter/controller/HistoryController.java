package com.autoposter.controller;

import com.autoposter.controller.dto.HistoryResponses;
import com.autoposter.model.PostStatus;
import com.autoposter.service.PostHistoryFilter;
import com.autoposter.service.PostHistoryService;
import com.autoposter.web.HistoryClearNotConfirmedException;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;

@Validated
@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
public class HistoryController {

    private static final String EXPORT_FILE_NAME = "post-history.csv";

    private final PostHistoryService postHistoryService;

    @GetMapping
    public ResponseEntity<List<HistoryResponses.PostRecordView>> list(
            @RequestParam(required = false) PostStatus status,
            @RequestParam(required = false) Long topicId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime createdFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime createdTo,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit
    ) {
        PostHistoryFilter filter = new PostHistoryFilter(status, topicId, createdFrom, createdTo);
        List<HistoryResponses.PostRecordView> records = postHistoryService.recent(filter, limit).stream()
                .map(HistoryResponses.PostRecordView::from)
                .toList();
        return ResponseEntity.ok(records);
    }

    @GetMapping("/export")
    public ResponseEntity<String> export() {
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + EXPORT_FILE_NAME + "\"")
                .body(postHistoryService.exportAll());
    }

    @DeleteMapping
    public ResponseEntity<HistoryResponses.ClearResult> clear(
            @RequestParam(defaultValue = "false") boolean confirm
    ) {
        if (!confirm) {
            throw new HistoryClearNotConfirmedException();
        }
        return ResponseEntity.ok(new HistoryResponses.ClearResult(postHistoryService.clear()));
    }
}
