package com.autoposter.service;

import com.autoposter.model.TopicCategory;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HashtagGeneratorTest {

    @Test
    void producesExactlyRequestedDistinctTagsStartingWithTopicTag() {
        for (TopicCategory category : TopicCategory.values()) {
            List<String> tags = HashtagGenerator.generate(category.displayName() + " nodes", category, 15, 42L);

            assertEquals(15, tags.size(), category.name());
            assertEquals(15, lowerCased(tags).size(), category.name());
            assertTrue(tags.stream().allMatch(tag -> tag.startsWith("#")), category.name());
        }

        List<String> lightning = HashtagGenerator.generate("Lightning Network nodes", TopicCategory.LIGHTNING_NETWORK, 15, 1L);
        assertEquals("#LightningNetworkNodes", lightning.get(0));
        assertTrue(lightning.subList(1, 15).stream()
                .allMatch(TopicCategory.LIGHTNING_NETWORK.hashtagPool()::contains));
    }

    @Test
    void borrowsFromOtherCategoriesWhenPoolIsTooSmall() {
        List<String> tags = HashtagGenerator.generate("Privacy tools", TopicCategory.PRIVACY, 40, 7L);

        assertEquals(40, tags.size());
        assertEquals(40, lowerCased(tags).size());
        assertTrue(tags.stream().anyMatch(tag -> !TopicCategory.PRIVACY.hashtagPool().contains(tag)
                && !tag.equals("#PrivacyTools")));
    }

    @Test
    void sameSeedIsStableAndDifferentSeedsVary() {
        List<String> first = HashtagGenerator.generate("Nostr relays", TopicCategory.NOSTR, 15, 100L);
        List<String> again = HashtagGenerator.generate("Nostr relays", TopicCategory.NOSTR, 15, 100L);
        List<String> other = HashtagGenerator.generate("Nostr relays", TopicCategory.NOSTR, 15, 101L);

        assertEquals(first, again);
        assertNotEquals(first, other);
    }

    @Test
    void topicTagIsCamelCasedWithoutPunctuation() {
        assertEquals("#BitcoinVsTraditionalFinance", HashtagGenerator.toTag("Bitcoin vs traditional finance"));
        assertEquals("#LightningNetworkVsOnChain", HashtagGenerator.toTag("Lightning Network vs on-chain"));
        assertNull(HashtagGenerator.toTag(" - "));
    }

    private static Set<String> lowerCased(List<String> tags) {
        Set<String> lowered = new HashSet<>();
        tags.forEach(tag -> lowered.add(tag.toLowerCase(Locale.ROOT)));
        return lowered;
    }
}
