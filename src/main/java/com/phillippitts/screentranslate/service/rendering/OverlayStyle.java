package com.phillippitts.screentranslate.service.rendering;

import java.awt.Color;
import java.util.Objects;

/**
 * Visual parameters for {@link OverlayRenderer}.
 *
 * @param mode placement mode
 * @param textColor colour of translated text
 * @param backgroundColor fill behind translated text; in {@link OverlayMode#REPLACE} it also masks the original
 * @param fontSize point size, clamped to {@code [8, 48]}
 * @param fontName logical or physical font family
 * @param padding space around the text inside its background, in pixels
 */
public record OverlayStyle(OverlayMode mode, Color textColor, Color backgroundColor,
                           int fontSize, String fontName, int padding) {

    public static final int MIN_FONT_SIZE = 8;
    public static final int MAX_FONT_SIZE = 48;

    public OverlayStyle {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(textColor, "textColor");
        Objects.requireNonNull(backgroundColor, "backgroundColor");
        fontSize = Math.max(MIN_FONT_SIZE, Math.min(MAX_FONT_SIZE, fontSize));
        fontName = (fontName == null || fontName.isBlank()) ? "SansSerif" : fontName;
        padding = Math.max(0, padding);
    }

    public static OverlayStyle defaults() {
        return new OverlayStyle(OverlayMode.BELOW, Color.WHITE, new Color(0, 0, 0, 0xBF), 14, "SansSerif", 4);
    }

    public OverlayStyle withMode(OverlayMode newMode) {
        return new OverlayStyle(newMode, textColor, backgroundColor, fontSize, fontName, padding);
    }
}
