package com.autoposter.service;

import com.autoposter.config.PipelineProperties;
import com.autoposter.model.AspectProfile;
import com.autoposter.model.ContentDraft;
import com.autoposter.model.ImageArtifact;
import com.autoposter.model.TopicCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.AlphaComposite;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.GradientPaint;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Renders the post image: category gradient, seeded shapes, wrapped body text, category label
 * and a branding watermark. Output is PNG and deterministic for a given draft, profile and
 * configured seed. Rendering errors degrade to a solid-background image instead of failing.
 */
@Service
public class ImageGenerator {

    static final String MIME_TYPE = "image/png";

    // 1x1 PNG, used when not even the fallback canvas can be rendered
    static final byte[] PLACEHOLDER_PNG = Base64.getDecoder().decode(
            "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAQAAAC1HAwCAAAAC0lEQVR42mNkYAAAAAYAAjCB0C8AAAAASUVORK5CYII=");

    private static final Logger log = LoggerFactory.getLogger(ImageGenerator.class);

    private static final int MAX_TEXT_LINES = 7;
    private static final int SHAPE_COUNT = 12;

    private final PipelineProperties pipelineProperties;

    public ImageGenerator(PipelineProperties pipelineProperties) {
        this.pipelineProperties = pipelineProperties;
    }

    public ImageArtifact generate(ContentDraft draft, AspectProfile profile) {
        int width = profile.width();
        int height = profile.height();
        Theme theme = Theme.of(draft.category());

        try {
            BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            Graphics2D g = image.createGraphics();
            try {
                configureGraphics(g);
                renderScene(g, draft, theme, width, height, new Random(seedFor(draft, profile)));
            } finally {
                g.dispose();
            }
            return new ImageArtifact(encodePng(image), MIME_TYPE, profile, width, height, false);
        } catch (Exception | LinkageError | InternalError ex) {
            log.warn("Image rendering failed for topic '{}'; using fallback image: {}", draft.topicName(), ex.toString());
            return renderFallback(draft, profile, theme);
        }
    }

    /**
     * Draws the full scene onto a canvas of the given size.
     */
    protected void renderScene(Graphics2D g, ContentDraft draft, Theme theme, int width, int height, Random random) {
        renderGradient(g, theme, width, height);
        renderShapes(g, theme, width, height, random);
        renderBodyText(g, draft.body(), theme, width, height);
        renderCategoryLabel(g, draft.category(), theme, width, height);
        renderWatermark(g, pipelineProperties.getImage().getBrandingText(), theme, width, height);
    }

    ImageArtifact renderFallback(ContentDraft draft, AspectProfile profile, Theme theme) {
        int width = profile.width();
        int height = profile.height();
        try {
            BufferedImage image = renderFallbackCanvas(draft, theme, width, height);
            return new ImageArtifact(encodePng(image), MIME_TYPE, profile, width, height, true);
        } catch (Exception | LinkageError | InternalError ex) {
            log.error("Fallback image could not be rendered for topic '{}'; using placeholder pixel: {}",
                    draft.topicName(), ex.toString());
            return new ImageArtifact(PLACEHOLDER_PNG.clone(), MIME_TYPE, profile, 1, 1, true);
        }
    }

    /**
     * Solid theme background with the topic name centred. Label failures leave the background only.
     */
    protected BufferedImage renderFallbackCanvas(ContentDraft draft, Theme theme, int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(theme.dark());
            g.fillRect(0, 0, width, height);
            try {
                configureGraphics(g);
                g.setColor(theme.light());
                g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, Math.max(24, width / 20)));
                FontMetrics metrics = g.getFontMetrics();
                String label = draft.topicName();
                int x = Math.max(0, (width - metrics.stringWidth(label)) / 2);
                g.drawString(label, x, height / 2);
            } catch (Exception | LinkageError | InternalError ex) {
                log.warn("Fallback label could not be drawn; using solid background only: {}", ex.toString());
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    private long seedFor(ContentDraft draft, AspectProfile profile) {
        long seed = pipelineProperties.getImage().getSeed();
        seed = seed * 31 + draft.composedText().hashCode();
        return seed * 31 + profile.ordinal();
    }

    private static void configureGraphics(Graphics2D g) {
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
    }

    private static void renderGradient(Graphics2D g, Theme theme, int w, int h) {
        g.setPaint(new GradientPaint(0, 0, theme.primary(), w, h, theme.dark()));
        g.fillRect(0, 0, w, h);
    }

    private static void renderShapes(Graphics2D g, Theme theme, int w, int h, Random random) {
        Color[] palette = {theme.primary(), theme.secondary(), theme.accent()};
        for (int i = 0; i < SHAPE_COUNT; i++) {
            Color base = palette[random.nextInt(palette.length)];
            g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, 0.08f + random.nextFloat() * 0.17f));
            g.setColor(base);
            int size = (int) (Math.min(w, h) * (0.08 + random.nextDouble() * 0.3));
            int x = random.nextInt(Math.max(1, w - size / 2)) - size / 4;
            int y = random.nextInt(Math.max(1, h - size / 2)) - size / 4;
            switch (random.nextInt(3)) {
                case 0 -> g.fillOval(x, y, size, size);
                case 1 -> g.fillRect(x, y, size, size);
                default -> {
                    g.setStroke(new BasicStroke(Math.max(2f, size / 24f)));
                    g.drawOval(x, y, size, size);
                }
            }
        }
        g.setComposite(AlphaComposite.SrcOver);
    }

    private static void renderBodyText(Graphics2D g, String body, Theme theme, int w, int h) {
        int margin = w / 12;
        int maxWidth = w - margin * 2;
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, Math.max(20, w / 28)));
        FontMetrics metrics = g.getFontMetrics();
        List<String> lines = wrap(body, metrics, maxWidth);

        int lineHeight = metrics.getHeight();
        int blockHeight = lineHeight * lines.size();
        int y = (h - blockHeight) / 2 + metrics.getAscent();

        int panelPadding = lineHeight / 2;
        g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, 0.45f));
        g.setColor(Color.BLACK);
        g.fillRoundRect(margin - panelPadding, (h - blockHeight) / 2 - panelPadding,
                maxWidth + panelPadding * 2, blockHeight + panelPadding * 2, lineHeight, lineHeight);
        g.setComposite(AlphaComposite.SrcOver);

        g.setColor(theme.light());
        for (String line : lines) {
            int x = margin + (maxWidth - metrics.stringWidth(line)) / 2;
            g.drawString(line, x, y);
            y += lineHeight;
        }
    }

    private static void renderCategoryLabel(Graphics2D g, TopicCategory category, Theme theme, int w, int h) {
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, Math.max(16, w / 40)));
        FontMetrics metrics = g.getFontMetrics();
        String label = category.displayName().toUpperCase(Locale.ROOT);
        int padding = metrics.getHeight() / 3;
        int x = w / 24;
        int y = h / 14;
        g.setColor(theme.accent());
        g.fillRoundRect(x - padding, y - metrics.getAscent() - padding,
                metrics.stringWidth(label) + padding * 2, metrics.getHeight() + padding, padding * 2, padding * 2);
        g.setColor(theme.dark());
        g.drawString(label, x, y);
    }

    private static void renderWatermark(Graphics2D g, String text, Theme theme, int w, int h) {
        if (text == null || text.isBlank()) {
            return;
        }
        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, Math.max(12, w / 60)));
        FontMetrics metrics = g.getFontMetrics();
        g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, 0.7f));
        g.setColor(theme.light());
        g.drawString(text, w - metrics.stringWidth(text) - w / 40, h - h / 30);
        g.setComposite(AlphaComposite.SrcOver);
    }

    static List<String> wrap(String text, FontMetrics metrics, int maxWidth) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            String candidate = current.length() == 0 ? word : current + " " + word;
            if (metrics.stringWidth(candidate) <= maxWidth || current.length() == 0) {
                current.setLength(0);
                current.append(candidate);
            } else {
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            }
            if (lines.size() == MAX_TEXT_LINES) {
                break;
            }
        }
        if (current.length() > 0 && lines.size() < MAX_TEXT_LINES) {
            lines.add(current.toString());
        }
        return lines;
    }

    private static byte[] encodePng(BufferedImage image) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out)) {
                throw new IllegalStateException("No PNG writer available");
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("PNG encoding failed", ex);
        }
        return out.toByteArray();
    }

    /**
     * Colours derived from a category's theme list: primary, secondary, dark, accent.
     */
    protected record Theme(Color primary, Color secondary, Color dark, Color accent) {

        static Theme of(TopicCategory category) {
            List<String> colors = category.themeColors();
            Color primary = Color.decode(colors.get(0));
            Color secondary = Color.decode(colors.get(1));
            Color dark = Color.decode(colors.get(2));
            Color accent = Color.decode(colors.get(3));
            if (luminance(dark) > luminance(secondary)) {
                Color swap = dark;
                dark = secondary;
                secondary = swap;
            }
            return new Theme(primary, secondary, dark, accent);
        }

        Color light() {
            return luminance(secondary) > 0.5 ? secondary : Color.WHITE;
        }

        private static double luminance(Color color) {
            return (0.2126 * color.getRed() + 0.7152 * color.getGreen() + 0.0722 * color.getBlue()) / 255.0;
        }
    }
}
