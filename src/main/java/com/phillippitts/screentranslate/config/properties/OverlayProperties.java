package com.phillippitts.screentranslate.config.properties;

import com.phillippitts.screentranslate.service.rendering.OverlayMode;
import com.phillippitts.screentranslate.service.rendering.OverlayStyle;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.awt.Color;

/**
 * Overlay appearance. Colours are hex {@code AARRGGBB} or {@code RRGGBB}.
 *
 * <pre>
 * overlay.mode=below
 * overlay.font-size=14
 * overlay.text-color=FFFFFFFF
 * overlay.background-color=BF000000
 * </pre>
 */
@Component
@Validated
@ConfigurationProperties(prefix = "overlay")
public class OverlayProperties {

    private static final String HEX_COLOR = "^#?([0-9a-fA-F]{6}|[0-9a-fA-F]{8})$";

    private OverlayMode mode = OverlayMode.BELOW;

    @Min(value = OverlayStyle.MIN_FONT_SIZE, message = "Overlay font size must be at least 8")
    @Max(value = OverlayStyle.MAX_FONT_SIZE, message = "Overlay font size must be at most 48")
    private int fontSize = 14;

    private String fontName = "SansSerif";

    @Pattern(regexp = HEX_COLOR, message = "Overlay text colour must be hex RRGGBB or AARRGGBB")
    private String textColor = "FFFFFFFF";

    @Pattern(regexp = HEX_COLOR, message = "Overlay background colour must be hex RRGGBB or AARRGGBB")
    private String backgroundColor = "BF000000";

    @Min(value = 0, message = "Overlay padding must not be negative")
    private int padding = 4;

    public OverlayStyle toStyle() {
        return new OverlayStyle(mode, parseColor(textColor), parseColor(backgroundColor),
                fontSize, fontName, padding);
    }

    static Color parseColor(String hex) {
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        long value = Long.parseLong(digits, 16);
        if (digits.length() == 6) {
            return new Color((int) value);
        }
        return new Color((int) value, true);
    }

    public OverlayMode getMode() {
        return mode;
    }

    public void setMode(OverlayMode mode) {
        this.mode = mode;
    }

    public int getFontSize() {
        return fontSize;
    }

    public void setFontSize(int fontSize) {
        this.fontSize = fontSize;
    }

    public String getFontName() {
        return fontName;
    }

    public void setFontName(String fontName) {
        this.fontName = fontName;
    }

    public String getTextColor() {
        return textColor;
    }

    public void setTextColor(String textColor) {
        this.textColor = textColor;
    }

    public String getBackgroundColor() {
        return backgroundColor;
    }

    public void setBackgroundColor(String backgroundColor) {
        this.backgroundColor = backgroundColor;
    }

    public int getPadding() {
        return padding;
    }

    public void setPadding(int padding) {
        this.padding = padding;
    }
}
