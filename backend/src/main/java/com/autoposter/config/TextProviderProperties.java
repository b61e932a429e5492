package com.autoposter.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * OpenAI-compatible chat completion settings for the primary content strategy.
 * A blank api key leaves only the template fallback active.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "autoposter.text-provider")
public class TextProviderProperties {

    private boolean enabled = true;
    private String apiUrl = "https://api.openai.com/v1/chat/completions";
    private String apiKey = "";
    private String model = "gpt-4o-mini";
    private int maxTokens = 150;
    private double temperature = 0.7;
    private String systemPrompt = "You are an expert in Bitcoin, Lightning Network, Nostr, and online privacy, "
            + "creating educational content for social media.";
}
