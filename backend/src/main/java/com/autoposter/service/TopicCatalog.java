package com.autoposter.service;

import com.autoposter.model.Topic;
import com.autoposter.model.TopicCategory;
import com.autoposter.repository.TopicRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to the topic table plus the enable/priority updates exposed to operators.
 * Topics are only ever created by {@link TopicCatalogBootstrapService}.
 */
@Service
@RequiredArgsConstructor
public class TopicCatalog {

    private static final Logger log = LoggerFactory.getLogger(TopicCatalog.class);

    private static final Map<TopicCategory, List<String>> SEED_TOPICS = buildSeedTopics();

    private final TopicRepository topicRepository;

    /**
     * Topic names shipped with the application, grouped by category in declaration order.
     */
    public static Map<TopicCategory, List<String>> seedTopics() {
        return SEED_TOPICS;
    }

    @Transactional(readOnly = true)
    public List<Topic> allTopics() {
        return topicRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public List<Topic> enabledTopics() {
        return topicRepository.findByEnabledTrueOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public Topic getTopic(Long topicId) {
        return topicRepository.findById(topicId)
                .orElseThrow(() -> new TopicNotFoundException(topicId));
    }

    /**
     * Applies the non-null fields. Name and category are fixed once seeded.
     */
    @Transactional
    public Topic updateTopic(Long topicId, Boolean enabled, Integer priority) {
        Topic topic = topicRepository.findById(topicId)
                .orElseThrow(() -> new TopicNotFoundException(topicId));
        if (enabled != null) {
            topic.setEnabled(enabled);
        }
        if (priority != null) {
            topic.setPriority(priority);
        }
        topic.setUpdatedAt(OffsetDateTime.now());
        Topic saved = topicRepository.save(topic);
        log.info("Topic updated: id={}, name={}, enabled={}, priority={}",
                saved.getId(), saved.getName(), saved.isEnabled(), saved.getPriority());
        return saved;
    }

    private static Map<TopicCategory, List<String>> buildSeedTopics() {
        Map<TopicCategory, List<String>> topics = new EnumMap<>(TopicCategory.class);
        topics.put(TopicCategory.BITCOIN, prefixed("Bitcoin",
                "basics", "price analysis", "adoption", "mining", "security",
                "wallets", "history", "economics", "vs traditional finance", "regulation"));
        topics.put(TopicCategory.LIGHTNING_NETWORK, prefixed("Lightning Network",
                "basics", "nodes", "channels", "wallets", "payments",
                "apps", "security", "adoption", "vs on-chain", "development"));
        topics.put(TopicCategory.NOSTR, prefixed("Nostr",
                "basics", "relays", "clients", "identity", "vs centralized social media",
                "development", "adoption", "security", "integration", "communities"));
        topics.put(TopicCategory.PRIVACY, List.of(
                "Online privacy basics", "Privacy tools", "Privacy best practices", "Privacy regulations",
                "Privacy vs convenience", "Privacy for Bitcoin users", "Privacy for Lightning users",
                "Privacy for Nostr users", "Privacy threats", "Privacy future"));
        topics.put(TopicCategory.NODE_SETUP, List.of(
                "Bitcoin node setup", "Lightning node setup", "Nostr relay setup", "Node hardware requirements",
                "Node software configuration", "Node maintenance", "Node security", "Node backups",
                "Node monitoring", "Node troubleshooting"));
        return Collections.unmodifiableMap(topics);
    }

    private static List<String> prefixed(String prefix, String... suffixes) {
        List<String> names = new ArrayList<>(suffixes.length);
        for (String suffix : suffixes) {
            names.add(prefix + " " + suffix);
        }
        return List.copyOf(names);
    }
}
