package com.autoposter.service;

import com.autoposter.config.PipelineProperties;
import com.autoposter.model.AspectProfile;
import com.autoposter.model.ContentDraft;
import com.autoposter.model.GenerationMethod;
import com.autoposter.model.ImageArtifact;
import com.autoposter.model.TopicCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageArchiveServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-14T15:09:26Z");

    @TempDir
    Path tempDir;

    private final ContentDraft draft = new ContentDraft(1L, "Bitcoin vs traditional finance", TopicCategory.BITCOIN,
            "Body", List.of("#Bitcoin"), GenerationMethod.FALLBACK);
    private final ImageArtifact image =
            new ImageArtifact(new byte[]{1, 2, 3}, "image/png", AspectProfile.SQUARE, 1080, 1080, false);

    @Test
    void writesImageUnderArchiveDirectory() throws Exception {
        PipelineProperties properties = new PipelineProperties();
        properties.getImage().setArchiveDir(tempDir.resolve("images").toString());
        ImageArchiveService archiveService = new ImageArchiveService(properties, new MutableClock(NOW));

        String ref = archiveService.archive(draft, image);

        assertNotNull(ref);
        Path stored = Path.of(ref);
        assertEquals("20260314-150926-1-bitcoin-vs-traditional-finance.png", stored.getFileName().toString());
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(stored));
    }

    @Test
    void returnsNullWhenArchivingDisabled() {
        PipelineProperties properties = new PipelineProperties();
        properties.getImage().setArchiveEnabled(false);
        properties.getImage().setArchiveDir(tempDir.toString());

        assertNull(new ImageArchiveService(properties, new MutableClock(NOW)).archive(draft, image));
    }

    @Test
    void returnsNullWhenDirectoryCannotBeCreated() throws Exception {
        Path blocker = Files.createFile(tempDir.resolve("not-a-directory"));
        PipelineProperties properties = new PipelineProperties();
        properties.getImage().setArchiveDir(blocker.resolve("images").toString());

        assertNull(new ImageArchiveService(properties, new MutableClock(NOW)).archive(draft, image));
    }

    @Test
    void slugFallsBackForSymbolOnlyNames() {
        assertEquals("post", ImageArchiveService.slug("!!!"));
        assertTrue(ImageArchiveService.slug("Nostr relay setup").startsWith("nostr-relay"));
    }
}
