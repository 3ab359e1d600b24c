package com.phillippitts.screentranslate.domain;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Complete output of a successful flow. Never built for a failed or cancelled flow.
 *
 * @param flowId flow identifier
 * @param originalImage captured image
 * @param renderedImage bilingual overlay
 * @param segments translated segments, in extraction order
 * @param processingTime wall-clock time from start to completion
 */
public record FlowResult(UUID flowId, BufferedImage originalImage, BufferedImage renderedImage,
                         List<BilingualSegment> segments, Duration processingTime) {

    public FlowResult {
        Objects.requireNonNull(flowId, "flowId");
        Objects.requireNonNull(originalImage, "originalImage");
        Objects.requireNonNull(renderedImage, "renderedImage");
        Objects.requireNonNull(processingTime, "processingTime");
        segments = List.copyOf(segments);
    }
}
