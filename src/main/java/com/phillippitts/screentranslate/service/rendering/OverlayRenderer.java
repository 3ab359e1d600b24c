package com.phillippitts.screentranslate.service.rendering;

import com.phillippitts.screentranslate.domain.BilingualSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Composites translated text onto a captured image.
 *
 * <p>{@link #render} is a pure function: it never mutates the input image and does no I/O.
 * Any failure is logged and reported as {@code null}.
 */
public class OverlayRenderer {

    private static final Logger LOG = LogManager.getLogger(OverlayRenderer.class);

    static final double ROW_THRESHOLD = 0.03;
    static final int MIN_LABEL_WIDTH = 80;
    static final int PANEL_MARGIN = 20;
    static final Color PANEL_BACKGROUND = new Color(242, 242, 242);
    static final Color PANEL_SEPARATOR = new Color(179, 179, 179);
    static final Color PANEL_TEXT = new Color(26, 26, 26);

    /**
     * Renders translations onto a copy of {@code image}.
     *
     * @param image captured image (not modified)
     * @param segments translated segments, boxes normalized to {@code image}
     * @param style placement and colours
     * @return the composited bitmap, a plain copy when there are no segments, or {@code null} on failure
     */
    public BufferedImage render(BufferedImage image, List<BilingualSegment> segments, OverlayStyle style) {
        if (image == null || style == null) {
            LOG.warn("Cannot render overlay: image or style missing");
            return null;
        }
        try {
            if (segments == null || segments.isEmpty()) {
                return copy(image, image.getWidth(), image.getHeight());
            }
            return switch (style.mode()) {
                case BELOW -> renderInline(image, segments, style, false);
                case REPLACE -> renderInline(image, segments, style, true);
                case PANEL -> renderPanel(image, segments, style);
            };
        } catch (RuntimeException e) {
            LOG.error("Overlay rendering failed for {}x{} image with {} segment(s)",
                    image.getWidth(), image.getHeight(), segments.size(), e);
            return null;
        }
    }

    private BufferedImage renderInline(BufferedImage image, List<BilingualSegment> segments,
                                       OverlayStyle style, boolean replace) {
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage out = copy(image, width, height);
        Graphics2D g = out.createGraphics();
        try {
            applyHints(g);
            Font font = new Font(style.fontName(), Font.PLAIN, style.fontSize());
            for (BilingualSegment segment : segments) {
                Rectangle box = segment.boundingBox().toPixels(width, height);
                if (replace) {
                    drawReplacement(g, box, segment.translatedText(), style);
                } else {
                    drawBelow(g, box, segment.translatedText(), font, style, width, height);
                }
            }
        } finally {
            g.dispose();
        }
        return out;
    }

    private void drawBelow(Graphics2D g, Rectangle box, String text, Font font, OverlayStyle style,
                           int imageWidth, int imageHeight) {
        g.setFont(font);
        FontMetrics fm = g.getFontMetrics();
        int pad = style.padding();
        int maxTextWidth = Math.min(imageWidth - 2 * pad, Math.max(box.width, MIN_LABEL_WIDTH));
        List<String> lines = wrap(text, fm, Math.max(1, maxTextWidth));
        int textWidth = lines.stream().mapToInt(fm::stringWidth).max().orElse(0);
        int labelWidth = textWidth + 2 * pad;
        int labelHeight = lines.size() * fm.getHeight() + 2 * pad;

        int x = Math.max(0, Math.min(box.x, imageWidth - labelWidth));
        int y = box.y + box.height;
        if (y + labelHeight > imageHeight) {
            y = Math.max(0, imageHeight - labelHeight);
        }

        g.setColor(style.backgroundColor());
        g.fillRect(x, y, labelWidth, labelHeight);
        drawLines(g, lines, fm, x + pad, y + pad, style.textColor());
    }

    private void drawReplacement(Graphics2D g, Rectangle box, String text, OverlayStyle style) {
        Color mask = opaque(style.backgroundColor());
        g.setComposite(AlphaComposite.Src);
        g.setColor(mask);
        g.fillRect(box.x, box.y, box.width, box.height);
        g.setComposite(AlphaComposite.SrcOver);

        int pad = Math.min(style.padding(), Math.max(0, Math.min(box.width, box.height) / 4));
        int innerWidth = Math.max(1, box.width - 2 * pad);
        int innerHeight = Math.max(1, box.height - 2 * pad);

        // Shrink until the wrapped text fits the box, stopping at the minimum size.
        int size = style.fontSize();
        List<String> lines;
        FontMetrics fm;
        while (true) {
            g.setFont(new Font(style.fontName(), Font.PLAIN, size));
            fm = g.getFontMetrics();
            lines = wrap(text, fm, innerWidth);
            if (lines.size() * fm.getHeight() <= innerHeight || size <= OverlayStyle.MIN_FONT_SIZE) {
                break;
            }
            size--;
        }
        Shape clip = g.getClip();
        g.clipRect(box.x, box.y, box.width, box.height);
        drawLines(g, lines, fm, box.x + pad, box.y + pad, style.textColor());
        g.setClip(clip);
    }

    private BufferedImage renderPanel(BufferedImage image, List<BilingualSegment> segments, OverlayStyle style) {
        int width = image.getWidth();
        int height = image.getHeight();
        List<String> rows = groupIntoRows(segments);
        boolean wide = width >= height;

        int fontSize = (int) Math.max(16, height * 0.025);
        Font font = new Font(style.fontName(), Font.PLAIN, fontSize);

        if (wide) {
            int textWidth = Math.max(1, width - 2 * PANEL_MARGIN);
            FontMetrics fm = metricsFor(font);
            List<List<String>> wrapped = rows.stream().map(r -> wrap(r, fm, textWidth)).toList();
            int rowGap = fm.getHeight() / 2;
            int panelHeight = 2 * PANEL_MARGIN + wrapped.stream()
                    .mapToInt(lines -> lines.size() * fm.getHeight() + rowGap).sum();

            BufferedImage out = new BufferedImage(width, height + panelHeight, BufferedImage.TYPE_INT_ARGB);
            Graphics2D g = out.createGraphics();
            try {
                applyHints(g);
                g.setColor(PANEL_BACKGROUND);
                g.fillRect(0, 0, width, height + panelHeight);
                g.drawImage(image, 0, 0, null);
                g.setColor(PANEL_SEPARATOR);
                g.fillRect(0, height, width, 2);
                g.setFont(font);
                int y = height + PANEL_MARGIN;
                for (List<String> lines : wrapped) {
                    drawLines(g, lines, fm, PANEL_MARGIN, y, PANEL_TEXT);
                    y += lines.size() * fm.getHeight() + rowGap;
                }
            } finally {
                g.dispose();
            }
            return out;
        }

        int panelWidth = (int) Math.min(width * 0.5, 400);
        int textWidth = Math.max(1, panelWidth - 2 * PANEL_MARGIN);
        BufferedImage out = new BufferedImage(width + panelWidth, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = out.createGraphics();
        try {
            applyHints(g);
            g.setColor(PANEL_BACKGROUND);
            g.fillRect(0, 0, width + panelWidth, height);
            g.drawImage(image, 0, 0, null);
            g.setColor(PANEL_SEPARATOR);
            g.fillRect(width, 0, 2, height);
            g.setFont(font);
            FontMetrics fm = g.getFontMetrics();
            int y = PANEL_MARGIN;
            for (String row : rows) {
                List<String> lines = wrap(row, fm, textWidth);
                int blockHeight = lines.size() * fm.getHeight();
                if (y + blockHeight > height - PANEL_MARGIN) {
                    break;
                }
                drawLines(g, lines, fm, width + PANEL_MARGIN, y, PANEL_TEXT);
                y += blockHeight + fm.getHeight() * 4 / 5;
            }
        } finally {
            g.dispose();
        }
        return out;
    }

    /**
     * Groups segments whose top edges lie within {@link #ROW_THRESHOLD} of each other, then joins
     * each row's translations left to right.
     */
    static List<String> groupIntoRows(List<BilingualSegment> segments) {
        List<BilingualSegment> sorted = segments.stream()
                .sorted(Comparator.comparingDouble(s -> s.boundingBox().y1()))
                .toList();
        List<List<BilingualSegment>> rows = new ArrayList<>();
        double rowTop = Double.NaN;
        for (BilingualSegment segment : sorted) {
            double top = segment.boundingBox().y1();
            if (!rows.isEmpty() && Math.abs(rowTop - top) < ROW_THRESHOLD) {
                rows.get(rows.size() - 1).add(segment);
            } else {
                List<BilingualSegment> row = new ArrayList<>();
                row.add(segment);
                rows.add(row);
                rowTop = top;
            }
        }
        return rows.stream()
                .map(row -> row.stream()
                        .sorted(Comparator.comparingDouble(s -> s.boundingBox().x1()))
                        .map(BilingualSegment::translatedText)
                        .collect(Collectors.joining(" ")))
                .toList();
    }

    /**
     * Greedy wrap: breaks on spaces where there are any, otherwise per character (CJK text).
     */
    static List<String> wrap(String text, FontMetrics fm, int maxWidth) {
        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\n", -1)) {
            StringBuilder line = new StringBuilder();
            int i = 0;
            while (i < paragraph.length()) {
                int next = nextBreak(paragraph, i);
                String token = paragraph.substring(i, next);
                if (line.length() > 0 && fm.stringWidth(line + token) > maxWidth) {
                    lines.add(line.toString().stripTrailing());
                    line.setLength(0);
                    token = token.stripLeading();
                }
                line.append(token);
                i = next;
            }
            lines.add(line.toString().stripTrailing());
        }
        return lines;
    }

    private static int nextBreak(String s, int from) {
        char c = s.charAt(from);
        if (Character.isWhitespace(c)) {
            int end = from;
            while (end < s.length() && Character.isWhitespace(s.charAt(end))) {
                end++;
            }
            while (end < s.length() && !Character.isWhitespace(s.charAt(end)) && !isIdeographic(s.charAt(end))) {
                end++;
            }
            return end;
        }
        if (isIdeographic(c)) {
            return from + 1;
        }
        int end = from;
        while (end < s.length() && !Character.isWhitespace(s.charAt(end)) && !isIdeographic(s.charAt(end))) {
            end++;
        }
        return end;
    }

    private static boolean isIdeographic(char c) {
        Character.UnicodeScript script = Character.UnicodeScript.of(c);
        return script == Character.UnicodeScript.HAN
                || script == Character.UnicodeScript.HIRAGANA
                || script == Character.UnicodeScript.KATAKANA
                || script == Character.UnicodeScript.HANGUL;
    }

    private static void drawLines(Graphics2D g, List<String> lines, FontMetrics fm, int x, int top, Color color) {
        g.setColor(color);
        int baseline = top + fm.getAscent();
        for (String line : lines) {
            g.drawString(line, x, baseline);
            baseline += fm.getHeight();
        }
    }

    private static BufferedImage copy(BufferedImage image, int width, int height) {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static FontMetrics metricsFor(Font font) {
        BufferedImage scratch = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = scratch.createGraphics();
        try {
            applyHints(g);
            return g.getFontMetrics(font);
        } finally {
            g.dispose();
        }
    }

    private static void applyHints(Graphics2D g) {
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
    }

    private static Color opaque(Color c) {
        return new Color(c.getRed(), c.getGreen(), c.getBlue());
    }
}
