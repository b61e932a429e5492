package com.autoposter.provider;

import com.autoposter.config.TextProviderProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for OpenAI-compatible endpoints.
 */
@Component
public class OpenAiTextGenerationClient implements TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiTextGenerationClient.class);

    private final RestTemplate restTemplate;
    private final TextProviderProperties properties;

    public OpenAiTextGenerationClient(
            @Qualifier("textProviderRestTemplate") RestTemplate restTemplate,
            TextProviderProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public boolean isConfigured() {
        return properties.isEnabled() && StringUtils.hasText(properties.getApiKey());
    }

    @Override
    public String complete(String prompt) {
        if (!isConfigured()) {
            throw new TextGenerationException(TextGenerationException.Kind.NOT_CONFIGURED,
                    "Text provider api key is not configured");
        }

        Map<String, Object> body = Map.of(
                "model", properties.getModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", properties.getSystemPrompt()),
                        Map.of("role", "user", "content", prompt)
                ),
                "temperature", properties.getTemperature(),
                "max_tokens", properties.getMaxTokens()
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiKey());

        JsonNode response;
        try {
            log.debug("Requesting completion from {} (model={})", properties.getApiUrl(), properties.getModel());
            response = restTemplate.postForObject(properties.getApiUrl(), new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientResponseException ex) {
            throw new TextGenerationException(classify(ex.getStatusCode()),
                    "Text provider returned HTTP " + ex.getStatusCode().value(), ex);
        } catch (ResourceAccessException ex) {
            TextGenerationException.Kind kind = ex.getCause() instanceof SocketTimeoutException
                    ? TextGenerationException.Kind.TIMEOUT
                    : TextGenerationException.Kind.UNAVAILABLE;
            throw new TextGenerationException(kind, "Text provider unreachable: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new TextGenerationException(TextGenerationException.Kind.MALFORMED_RESPONSE,
                    "Text provider response could not be read: " + ex.getMessage(), ex);
        }

        return extractContent(response);
    }

    static String extractContent(JsonNode response) {
        if (response == null || !response.path("choices").isArray() || response.path("choices").isEmpty()) {
            throw new TextGenerationException(TextGenerationException.Kind.MALFORMED_RESPONSE,
                    "Text provider response has no choices");
        }
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new TextGenerationException(TextGenerationException.Kind.MALFORMED_RESPONSE,
                    "Text provider response has no message content");
        }
        return content.asText().trim();
    }

    private static TextGenerationException.Kind classify(HttpStatusCode status) {
        int code = status.value();
        if (code == 401 || code == 403) {
            return TextGenerationException.Kind.AUTH;
        }
        if (code == 429) {
            return TextGenerationException.Kind.QUOTA;
        }
        if (code == 408 || code == 504) {
            return TextGenerationException.Kind.TIMEOUT;
        }
        return TextGenerationException.Kind.UNAVAILABLE;
    }
}
