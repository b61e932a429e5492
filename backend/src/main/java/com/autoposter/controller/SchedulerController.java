package com.autoposter.controller;

import com.autoposter.controller.dto.HistoryResponses;
import com.autoposter.controller.dto.SchedulerRequests;
import com.autoposter.controller.dto.SchedulerResponses;
import com.autoposter.model.CycleTrigger;
import com.autoposter.model.PostRecord;
import com.autoposter.service.PostingSchedulerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
@RequestMapping("/api/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final PostingSchedulerService postingSchedulerService;

    @GetMapping("/status")
    public ResponseEntity<SchedulerResponses.Status> status() {
        return ResponseEntity.ok(SchedulerResponses.Status.from(postingSchedulerService.status()));
    }

    @PutMapping("/enabled")
    public ResponseEntity<SchedulerResponses.Status> setEnabled(
            @Valid @RequestBody SchedulerRequests.SetEnabledRequest request
    ) {
        return ResponseEntity.ok(SchedulerResponses.Status.from(postingSchedulerService.setEnabled(request.enabled())));
    }

    @PutMapping("/interval")
    public ResponseEntity<SchedulerResponses.Status> setInterval(
            @Valid @RequestBody SchedulerRequests.SetIntervalRequest request
    ) {
        Duration interval = Duration.ofMinutes(request.intervalMinutes());
        return ResponseEntity.ok(SchedulerResponses.Status.from(postingSchedulerService.setInterval(interval)));
    }

    /**
     * Runs one cycle now and returns its record. Rejected with 409 while another cycle is running.
     */
    @PostMapping("/cycles")
    public ResponseEntity<HistoryResponses.PostRecordView> triggerCycle() {
        PostRecord record = postingSchedulerService.runCycle(CycleTrigger.MANUAL);
        return ResponseEntity.status(HttpStatus.CREATED).body(HistoryResponses.PostRecordView.from(record));
    }
}
