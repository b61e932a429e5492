package com.autoposter.config;

import com.autoposter.model.AspectProfile;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pipeline defaults: cycle timing, content shape, image format and publish retry policy.
 * Schedule values seed the persisted schedule state on first start only.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "autoposter")
public class PipelineProperties {

    private Scheduler scheduler = new Scheduler();
    private Content content = new Content();
    private Image image = new Image();
    private Publish publish = new Publish();

    @Getter
    @Setter
    public static class Scheduler {
        /**
         * Initial value of the enabled flag when no schedule state has been persisted yet.
         */
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(24);
        private Duration minInterval = Duration.ofMinutes(1);
        private Duration maxInterval = Duration.ofDays(7);
        private long pollIntervalMs = 5_000;
        private long initialDelayMs = 10_000;
        /**
         * How many recently selected topics are avoided when breaking priority ties.
         */
        private int rotationMemory = 1;
        /**
         * Wall-clock ceiling for one produce-and-publish cycle.
         */
        private Duration cycleTimeout = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Content {
        private int hashtagCount = 15;
        private int maxBodyLength = 250;
        private String truncationMarker = "...";
        private Duration providerTimeout = Duration.ofSeconds(20);
        /**
         * Prompt overrides keyed by topic name.
         */
        private Map<String, String> customPrompts = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Image {
        private AspectProfile profile = AspectProfile.WIDE;
        private long seed = 0L;
        private String brandingText = "autoposter";
        private boolean archiveEnabled = true;
        private String archiveDir = "data/images";
    }

    @Getter
    @Setter
    public static class Publish {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofSeconds(60);
        private Duration requestTimeout = Duration.ofSeconds(30);
    }
}
