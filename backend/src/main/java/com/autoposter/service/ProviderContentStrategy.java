package com.autoposter.service;

import com.autoposter.config.PipelineProperties;
import com.autoposter.model.GenerationMethod;
import com.autoposter.model.Topic;
import com.autoposter.provider.TextGenerationClient;
import com.autoposter.provider.TextGenerationException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Primary strategy: asks the external text provider, bounded by the configured provider timeout.
 * Every failure surfaces as a {@link TextGenerationException}.
 */
@Component
public class ProviderContentStrategy implements ContentStrategy {

    static final String DEFAULT_PROMPT = "Write a concise, informative tweet about {topic} in the context of {category}. "
            + "The tweet should be educational, engaging, and under {maxLength} characters to leave room for hashtags. "
            + "Include a thought-provoking question or call to action. Do not include hashtags in your response.";

    private static final List<String> AUTH_FAILURE_SIGNALS = List.of(
            "unauthorized",
            "forbidden",
            "invalid api key",
            "invalid_api_key"
    );

    private final AtomicLong threadCounter = new AtomicLong();

    private final TextGenerationClient textGenerationClient;
    private final PipelineProperties pipelineProperties;

    public ProviderContentStrategy(TextGenerationClient textGenerationClient, PipelineProperties pipelineProperties) {
        this.textGenerationClient = textGenerationClient;
        this.pipelineProperties = pipelineProperties;
    }

    @Override
    public GenerationMethod method() {
        return GenerationMethod.PRIMARY;
    }

    @Override
    public String writeBody(Topic topic, long variationSeed) {
        if (!textGenerationClient.isConfigured()) {
            throw new TextGenerationException(TextGenerationException.Kind.NOT_CONFIGURED,
                    "Text provider is not configured");
        }

        String prompt = buildPrompt(topic);
        Duration timeout = pipelineProperties.getContent().getProviderTimeout();
        FutureTask<String> providerTask = new FutureTask<>(() -> textGenerationClient.complete(prompt));
        Thread worker = new Thread(providerTask, "content-provider-" + threadCounter.incrementAndGet());
        worker.setDaemon(true);
        worker.start();

        String text;
        try {
            text = providerTask.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            providerTask.cancel(true);
            throw new TextGenerationException(TextGenerationException.Kind.TIMEOUT,
                    "Text provider did not answer within " + timeout, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof TextGenerationException generationException) {
                throw generationException;
            }
            throw new TextGenerationException(resolveKind(cause), "Text provider failed: " + cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            providerTask.cancel(true);
            Thread.currentThread().interrupt();
            throw new TextGenerationException(TextGenerationException.Kind.UNAVAILABLE,
                    "Interrupted while waiting for text provider", ex);
        }

        String body = text == null ? "" : stripHashtags(text);
        if (!StringUtils.hasText(body)) {
            throw new TextGenerationException(TextGenerationException.Kind.MALFORMED_RESPONSE,
                    "Text provider returned an empty body");
        }
        return body;
    }

    String buildPrompt(Topic topic) {
        String template = pipelineProperties.getContent().getCustomPrompts().get(topic.getName());
        if (!StringUtils.hasText(template)) {
            template = DEFAULT_PROMPT;
        }
        return template
                .replace("{topic}", topic.getName())
                .replace("{category}", topic.getCategory().displayName())
                .replace("{maxLength}", String.valueOf(pipelineProperties.getContent().getMaxBodyLength()));
    }

    /**
     * Models sometimes append hashtags despite the prompt; the generator adds its own.
     */
    static String stripHashtags(String text) {
        String stripped = text.replaceAll("(?<!\\S)#\\w+", "").replaceAll("[ \\t]{2,}", " ").strip();
        if (stripped.length() >= 2 && stripped.startsWith("\"") && stripped.endsWith("\"")) {
            stripped = stripped.substring(1, stripped.length() - 1).strip();
        }
        return stripped;
    }

    private static TextGenerationException.Kind resolveKind(Throwable cause) {
        String message = cause.getMessage() == null ? "" : cause.getMessage().toLowerCase(Locale.ROOT);
        for (String signal : AUTH_FAILURE_SIGNALS) {
            if (message.contains(signal)) {
                return TextGenerationException.Kind.AUTH;
            }
        }
        return TextGenerationException.Kind.UNAVAILABLE;
    }
}
