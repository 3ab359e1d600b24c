package com.phillippitts.screentranslate.service.vision;

import com.phillippitts.screentranslate.domain.ScreenAnalysisResult;
import com.phillippitts.screentranslate.domain.TextSegment;
import com.phillippitts.screentranslate.exception.AnalysisException;
import com.phillippitts.screentranslate.util.ImageEncoding;
import com.phillippitts.screentranslate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Extracts positioned text from a captured image through a {@link VisionProvider}.
 *
 * <p>The image is uploaded as base64 JPEG. The reply is parsed into segments with normalized
 * boxes, and segments under the configured minimum confidence are discarded. An image with no
 * text yields an empty result, not an error.
 */
public class TextExtractionEngine {

    private static final Logger LOG = LogManager.getLogger(TextExtractionEngine.class);

    private final VisionProvider provider;
    private final float jpegQuality;
    private final double minimumConfidence;

    public TextExtractionEngine(VisionProvider provider, float jpegQuality, double minimumConfidence) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        if (jpegQuality <= 0f || jpegQuality > 1f) {
            throw new IllegalArgumentException("jpegQuality must be within (0, 1], got " + jpegQuality);
        }
        this.jpegQuality = jpegQuality;
        this.minimumConfidence = minimumConfidence;
    }

    public String providerId() {
        return provider.id();
    }

    public boolean isConfigured() {
        return provider.isConfigured();
    }

    /**
     * Analyses an image.
     *
     * @param image captured image
     * @return recognised segments with the image size
     * @throws AnalysisException if encoding, the provider call, or parsing fails
     */
    public ScreenAnalysisResult analyze(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        if (!provider.isConfigured()) {
            throw new AnalysisException(AnalysisException.Kind.INVALID_CONFIGURATION, provider.id(),
                    "Vision provider is not configured");
        }

        String base64;
        try {
            base64 = ImageEncoding.toBase64Jpeg(image, jpegQuality);
        } catch (IOException | RuntimeException e) {
            throw new AnalysisException(AnalysisException.Kind.IMAGE_ENCODING, provider.id(),
                    "Failed to encode image", e);
        }

        long start = System.nanoTime();
        String reply;
        try {
            reply = provider.extractText(base64, VisionPrompts.SYSTEM_PROMPT, VisionPrompts.USER_PROMPT);
        } catch (AnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AnalysisException(AnalysisException.Kind.NETWORK, provider.id(),
                    "Vision request failed: " + e.getMessage(), e);
        }

        List<TextSegment> segments = VisionResponseParser.parse(reply, provider.id());
        ScreenAnalysisResult result = new ScreenAnalysisResult(segments, image.getWidth(), image.getHeight())
                .filterByConfidence(minimumConfidence);
        LOG.info("Vision {} found {} segment(s) in {} ms ({}x{})", provider.id(), result.segments().size(),
                TimeUtils.elapsedMillis(start), image.getWidth(), image.getHeight());
        return result;
    }
}
