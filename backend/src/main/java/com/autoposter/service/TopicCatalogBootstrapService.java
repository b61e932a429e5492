package com.autoposter.service;

import com.autoposter.model.Topic;
import com.autoposter.model.TopicCategory;
import com.autoposter.repository.TopicRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Seeds the topic table from the built-in catalog on startup. Existing rows are left untouched
 * so operator changes to enabled/priority survive restarts.
 */
@Component
@RequiredArgsConstructor
public class TopicCatalogBootstrapService implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TopicCatalogBootstrapService.class);

    private final TopicRepository topicRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        int created = 0;
        for (Map.Entry<TopicCategory, List<String>> entry : TopicCatalog.seedTopics().entrySet()) {
            for (String name : entry.getValue()) {
                if (topicRepository.existsByNameIgnoreCase(name)) {
                    continue;
                }
                Topic topic = new Topic();
                topic.setName(name);
                topic.setCategory(entry.getKey());
                topicRepository.save(topic);
                created++;
            }
        }

        if (created == 0) {
            log.debug("Topic bootstrap skipped: catalog already seeded.");
        } else {
            log.info("Bootstrapped {} topics into the catalog", created);
        }
    }
}
