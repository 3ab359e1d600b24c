package com.phillippitts.screentranslate.domain;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Output of text extraction: the recognised segments, in model order, plus the pixel size
 * of the analysed image. An empty segment list is a valid result.
 *
 * @param segments recognised segments (immutable copy)
 * @param imageWidth source image width in pixels
 * @param imageHeight source image height in pixels
 */
public record ScreenAnalysisResult(List<TextSegment> segments, int imageWidth, int imageHeight) {

    private static final Comparator<TextSegment> READING_ORDER =
            Comparator.<TextSegment>comparingDouble(s -> s.boundingBox().y1())
                    .thenComparingDouble(s -> s.boundingBox().x1());

    public ScreenAnalysisResult {
        segments = List.copyOf(segments);
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + imageWidth + "x" + imageHeight);
        }
    }

    public static ScreenAnalysisResult empty(int imageWidth, int imageHeight) {
        return new ScreenAnalysisResult(List.of(), imageWidth, imageHeight);
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /**
     * @return all segment texts in top-to-bottom, left-to-right order, one per line
     */
    public String fullText() {
        return segments.stream()
                .sorted(READING_ORDER)
                .map(TextSegment::text)
                .collect(Collectors.joining("\n"));
    }

    /**
     * @param minimumConfidence inclusive lower bound
     * @return a copy keeping only segments at or above the given confidence
     */
    public ScreenAnalysisResult filterByConfidence(double minimumConfidence) {
        List<TextSegment> kept = segments.stream()
                .filter(s -> s.confidence() >= minimumConfidence)
                .toList();
        return new ScreenAnalysisResult(kept, imageWidth, imageHeight);
    }
}
