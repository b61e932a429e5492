package com.autoposter.service;

import com.autoposter.model.Topic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the next topic to post about.
 *
 * <p>Only the highest-priority enabled topics are candidates. Candidates absent from the recent
 * list are served round-robin by id, continuing after the most recently selected id. When every
 * candidate is recent, the one selected longest ago wins.
 */
public final class TopicSelector {

    private TopicSelector() {
    }

    /**
     * @param enabledTopics enabled topics in any order
     * @param recentTopicIds recently selected ids, oldest first
     */
    public static Optional<Topic> select(List<Topic> enabledTopics, List<Long> recentTopicIds) {
        if (enabledTopics == null || enabledTopics.isEmpty()) {
            return Optional.empty();
        }
        List<Long> recent = recentTopicIds == null ? List.of() : recentTopicIds;

        int topPriority = enabledTopics.stream().mapToInt(Topic::getPriority).max().orElse(0);
        List<Topic> candidates = enabledTopics.stream()
                .filter(topic -> topic.getPriority() == topPriority)
                .sorted(Comparator.comparing(Topic::getId))
                .toList();

        List<Topic> fresh = new ArrayList<>();
        for (Topic candidate : candidates) {
            if (!recent.contains(candidate.getId())) {
                fresh.add(candidate);
            }
        }

        if (!fresh.isEmpty()) {
            Long lastSelected = recent.isEmpty() ? null : recent.get(recent.size() - 1);
            if (lastSelected != null) {
                for (Topic topic : fresh) {
                    if (topic.getId() > lastSelected) {
                        return Optional.of(topic);
                    }
                }
            }
            return Optional.of(fresh.get(0));
        }

        return candidates.stream()
                .min(Comparator.comparingInt((Topic topic) -> recent.indexOf(topic.getId())));
    }

    /**
     * Appends the selected id and keeps at most {@code memory} entries, oldest first.
     */
    public static List<Long> remember(List<Long> recentTopicIds, Long selectedId, int memory) {
        List<Long> updated = new ArrayList<>(recentTopicIds == null ? List.of() : recentTopicIds);
        updated.remove(selectedId);
        updated.add(selectedId);
        int keep = Math.max(1, memory);
        while (updated.size() > keep) {
            updated.remove(0);
        }
        return List.copyOf(updated);
    }
}
