package com.autoposter.service;

import com.autoposter.model.GenerationMethod;
import com.autoposter.model.Topic;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Local fallback: fills a seeded template with the topic and category names. Never fails.
 */
@Component
public class TemplateContentStrategy implements ContentStrategy {

    static final List<String> TEMPLATES = List.of(
            "Exploring the world of {topic} today. What's your experience with it?",
            "Did you know? {topic} is changing how we think about digital sovereignty. Learn more!",
            "The future of {topic} looks promising. Here's why it matters for everyone in the {category} space.",
            "{topic} offers incredible possibilities for freedom and privacy. Are you taking advantage of it?",
            "Just set up a new {topic} configuration. Game-changer for my {category} experience!",
            "Thinking about {topic} and its implications for the future of {category}. Thoughts?",
            "Today's focus: {topic}. Essential knowledge for anyone interested in {category}.",
            "{topic} might be the most underrated aspect of {category}. Change my mind!",
            "The evolution of {topic} shows how far we've come in the {category} ecosystem.",
            "Security tip: Always consider {topic} when working with {category} technologies."
    );

    @Override
    public GenerationMethod method() {
        return GenerationMethod.FALLBACK;
    }

    @Override
    public String writeBody(Topic topic, long variationSeed) {
        String template = TEMPLATES.get(Math.floorMod(variationSeed, TEMPLATES.size()));
        return template
                .replace("{topic}", topic.getName())
                .replace("{category}", topic.getCategory().displayName());
    }
}
