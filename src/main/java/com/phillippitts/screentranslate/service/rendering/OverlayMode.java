package com.phillippitts.screentranslate.service.rendering;

import java.util.Locale;

/**
 * Where translated text is placed relative to the original.
 */
public enum OverlayMode {
    /** Label directly beneath each original box, left-aligned to it. */
    BELOW,
    /** Original box masked and the translation drawn in its place. */
    REPLACE,
    /** Original image untouched, translations listed in a panel beside or below it. */
    PANEL;

    public static OverlayMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return BELOW;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown overlay mode: " + value, e);
        }
    }
}
