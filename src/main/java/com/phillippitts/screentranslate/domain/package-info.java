/**
 * Immutable value types shared by extraction, translation, flow control and rendering.
 *
 * <p>Coordinates are normalized to the captured image; see {@link com.phillippitts.screentranslate.domain.BoundingBox}.
 */
package com.phillippitts.screentranslate.domain;
