package com.phillippitts.screentranslate.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * A run of text recognised in a captured image, located by a normalized bounding box.
 *
 * @param id unique identifier, stable for the lifetime of the flow
 * @param text recognised text (never blank)
 * @param boundingBox location in normalized image coordinates
 * @param confidence recognition confidence in {@code [0, 1]}
 */
public record TextSegment(UUID id, String text, BoundingBox boundingBox, double confidence) {

    public TextSegment {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(boundingBox, "boundingBox");
        if (text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
    }

    public static TextSegment of(String text, BoundingBox boundingBox, double confidence) {
        return new TextSegment(UUID.randomUUID(), text, boundingBox, confidence);
    }
}
