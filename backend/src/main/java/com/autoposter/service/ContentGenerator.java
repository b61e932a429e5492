package com.autoposter.service;

import com.autoposter.config.PipelineProperties;
import com.autoposter.model.ContentDraft;
import com.autoposter.model.Topic;
import com.autoposter.provider.TextGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Produces a {@link ContentDraft} for a topic. Tries the provider strategy first and falls back
 * to the template strategy on any provider failure, so a draft is always returned.
 */
@Service
public class ContentGenerator {

    private static final Logger log = LoggerFactory.getLogger(ContentGenerator.class);

    private final ContentStrategy primaryStrategy;
    private final ContentStrategy fallbackStrategy;
    private final PipelineProperties pipelineProperties;
    private final AtomicLong variationSequence = new AtomicLong();

    public ContentGenerator(
            ProviderContentStrategy primaryStrategy,
            TemplateContentStrategy fallbackStrategy,
            PipelineProperties pipelineProperties) {
        this.primaryStrategy = primaryStrategy;
        this.fallbackStrategy = fallbackStrategy;
        this.pipelineProperties = pipelineProperties;
    }

    public ContentDraft generate(Topic topic) {
        long seed = nextSeed(topic);
        PipelineProperties.Content content = pipelineProperties.getContent();

        ContentStrategy used = primaryStrategy;
        String body;
        try {
            body = primaryStrategy.writeBody(topic, seed);
        } catch (TextGenerationException ex) {
            logFallback(topic, ex.getKind().name(), ex.getMessage());
            used = fallbackStrategy;
            body = fallbackStrategy.writeBody(topic, seed);
        } catch (RuntimeException ex) {
            logFallback(topic, "UNEXPECTED", ex.getMessage());
            used = fallbackStrategy;
            body = fallbackStrategy.writeBody(topic, seed);
        }

        String fitted = TextBudget.fit(body, content.getMaxBodyLength(), content.getTruncationMarker());
        List<String> hashtags = HashtagGenerator.generate(
                topic.getName(), topic.getCategory(), content.getHashtagCount(), seed);

        return new ContentDraft(topic.getId(), topic.getName(), topic.getCategory(), fitted, hashtags, used.method());
    }

    private void logFallback(Topic topic, String kind, String detail) {
        if ("NOT_CONFIGURED".equals(kind)) {
            log.debug("Text provider not configured; using template content for topic '{}'", topic.getName());
            return;
        }
        log.warn("Primary content generation failed for topic '{}' ({}): {}; using template content",
                topic.getName(), kind, detail);
    }

    private long nextSeed(Topic topic) {
        long sequence = variationSequence.incrementAndGet();
        return sequence * 0x9E3779B97F4A7C15L ^ topic.getName().hashCode();
    }
}
