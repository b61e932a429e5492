package com.autoposter.service;

import com.autoposter.model.TopicCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Builds the hashtag set for a post: a tag derived from the topic name first, then the
 * category pool in seeded order, then tags borrowed from the other categories when the
 * pool runs short.
 */
public final class HashtagGenerator {

    private HashtagGenerator() {
    }

    /**
     * @return {@code count} distinct tags, or every available tag if fewer exist
     */
    public static List<String> generate(String topicName, TopicCategory category, int count, long seed) {
        if (count <= 0) {
            return List.of();
        }
        Random random = new Random(seed);
        Map<String, String> selected = new LinkedHashMap<>();

        String topicTag = toTag(topicName);
        if (topicTag != null) {
            add(selected, topicTag);
        }

        List<String> pool = new ArrayList<>(category.hashtagPool());
        Collections.shuffle(pool, random);
        for (String tag : pool) {
            if (selected.size() >= count) {
                break;
            }
            add(selected, tag);
        }

        if (selected.size() < count) {
            List<String> borrowed = new ArrayList<>();
            for (TopicCategory other : TopicCategory.values()) {
                if (other != category) {
                    borrowed.addAll(other.hashtagPool());
                }
            }
            Collections.shuffle(borrowed, random);
            for (String tag : borrowed) {
                if (selected.size() >= count) {
                    break;
                }
                add(selected, tag);
            }
        }

        return List.copyOf(selected.values());
    }

    /**
     * "Lightning Network nodes" becomes "#LightningNetworkNodes". Returns null when nothing usable remains.
     */
    static String toTag(String topicName) {
        if (topicName == null) {
            return null;
        }
        StringBuilder tag = new StringBuilder("#");
        for (String word : topicName.split("[^\\p{Alnum}]+")) {
            if (word.isEmpty()) {
                continue;
            }
            tag.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return tag.length() > 1 ? tag.toString() : null;
    }

    private static void add(Map<String, String> selected, String tag) {
        selected.putIfAbsent(tag.toLowerCase(Locale.ROOT), tag);
    }
}
