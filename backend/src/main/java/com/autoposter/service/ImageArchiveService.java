package com.autoposter.service;

import com.autoposter.config.PipelineProperties;
import com.autoposter.model.ContentDraft;
import com.autoposter.model.ImageArtifact;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps a local copy of each generated image. The returned path becomes the post record's image reference.
 */
@Service
@RequiredArgsConstructor
public class ImageArchiveService {

    private static final Logger log = LoggerFactory.getLogger(ImageArchiveService.class);

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final PipelineProperties pipelineProperties;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    /**
     * @return path of the stored file, or null when archiving is disabled or the write failed
     */
    public String archive(ContentDraft draft, ImageArtifact image) {
        PipelineProperties.Image settings = pipelineProperties.getImage();
        if (!settings.isArchiveEnabled()) {
            return null;
        }

        String fileName = FILE_TIMESTAMP.format(clock.instant())
                + "-" + sequence.incrementAndGet()
                + "-" + slug(draft.topicName())
                + ".png";
        try {
            Path directory = Paths.get(settings.getArchiveDir());
            Files.createDirectories(directory);
            Path target = directory.resolve(fileName);
            Files.write(target, image.data());
            log.debug("Archived {} byte image to {}", image.sizeBytes(), target);
            return target.toString();
        } catch (IOException | RuntimeException ex) {
            log.warn("Could not archive image for topic '{}' under {}: {}",
                    draft.topicName(), settings.getArchiveDir(), ex.getMessage());
            return null;
        }
    }

    static String slug(String value) {
        String slug = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        return slug.isEmpty() ? "post" : slug;
    }
}
