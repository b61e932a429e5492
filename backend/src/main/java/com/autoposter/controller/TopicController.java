package com.autoposter.controller;

import com.autoposter.controller.dto.TopicRequests;
import com.autoposter.controller.dto.TopicResponses;
import com.autoposter.service.ContentGenerator;
import com.autoposter.service.TopicCatalog;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/topics")
@RequiredArgsConstructor
public class TopicController {

    private final TopicCatalog topicCatalog;
    private final ContentGenerator contentGenerator;

    @GetMapping
    public ResponseEntity<List<TopicResponses.TopicView>> listTopics() {
        return ResponseEntity.ok(topicCatalog.allTopics().stream()
                .map(TopicResponses.TopicView::from)
                .toList());
    }

    @PatchMapping("/{topicId}")
    public ResponseEntity<TopicResponses.TopicView> updateTopic(
            @PathVariable Long topicId,
            @Valid @RequestBody TopicRequests.UpdateTopicRequest request
    ) {
        return ResponseEntity.ok(TopicResponses.TopicView.from(
                topicCatalog.updateTopic(topicId, request.enabled(), request.priority())));
    }

    /**
     * Generates a draft for the topic without publishing or recording it.
     */
    @GetMapping("/{topicId}/preview")
    public ResponseEntity<TopicResponses.DraftPreview> previewTopic(@PathVariable Long topicId) {
        return ResponseEntity.ok(TopicResponses.DraftPreview.from(contentGenerator.generate(topicCatalog.getTopic(topicId))));
    }
}
