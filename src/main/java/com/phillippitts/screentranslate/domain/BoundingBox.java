package com.phillippitts.screentranslate.domain;

import java.awt.Rectangle;

/**
 * Axis-aligned rectangle in normalized image coordinates.
 *
 * <p>All four coordinates are fractions of the image width/height and lie in {@code [0, 1]},
 * with {@code x1 <= x2} and {@code y1 <= y2}. Raw model output is brought into range through
 * {@link #clamped(double, double, double, double)}; the canonical constructor rejects anything
 * that is already out of range.
 *
 * @param x1 left edge
 * @param y1 top edge
 * @param x2 right edge
 * @param y2 bottom edge
 */
public record BoundingBox(double x1, double y1, double x2, double y2) {

    public BoundingBox {
        requireUnit("x1", x1);
        requireUnit("y1", y1);
        requireUnit("x2", x2);
        requireUnit("y2", y2);
        if (x1 > x2 || y1 > y2) {
            throw new IllegalArgumentException(
                    "Bounding box corners out of order: [" + x1 + ", " + y1 + ", " + x2 + ", " + y2 + "]");
        }
    }

    /**
     * Builds a box from raw corner coordinates, clamping each to {@code [0, 1]} and
     * swapping corners given in reverse order. Non-finite values clamp to 0.
     */
    public static BoundingBox clamped(double x1, double y1, double x2, double y2) {
        double cx1 = clampUnit(x1);
        double cy1 = clampUnit(y1);
        double cx2 = clampUnit(x2);
        double cy2 = clampUnit(y2);
        return new BoundingBox(Math.min(cx1, cx2), Math.min(cy1, cy2),
                Math.max(cx1, cx2), Math.max(cy1, cy2));
    }

    /**
     * Builds a clamped box from an origin plus size, the shape some vision models prefer.
     */
    public static BoundingBox fromOriginAndSize(double x, double y, double width, double height) {
        return clamped(x, y, x + width, y + height);
    }

    public double width() {
        return x2 - x1;
    }

    public double height() {
        return y2 - y1;
    }

    public double area() {
        return width() * height();
    }

    /**
     * @return {@code true} if the box covers no area (a line or a point)
     */
    public boolean isDegenerate() {
        return width() <= 0.0 || height() <= 0.0;
    }

    /**
     * Converts to pixel space for an image of the given size. The result is at least 1x1.
     *
     * @param imageWidth image width in pixels
     * @param imageHeight image height in pixels
     * @return pixel rectangle inside the image bounds
     */
    public Rectangle toPixels(int imageWidth, int imageHeight) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + imageWidth + "x" + imageHeight);
        }
        int left = (int) Math.floor(x1 * imageWidth);
        int top = (int) Math.floor(y1 * imageHeight);
        int right = (int) Math.ceil(x2 * imageWidth);
        int bottom = (int) Math.ceil(y2 * imageHeight);
        left = Math.min(left, imageWidth - 1);
        top = Math.min(top, imageHeight - 1);
        return new Rectangle(left, top, Math.max(1, right - left), Math.max(1, bottom - top));
    }

    private static double clampUnit(double v) {
        if (Double.isNaN(v) || v < 0.0) {
            return 0.0;
        }
        return Math.min(v, 1.0);
    }

    private static void requireUnit(String name, double v) {
        if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + v);
        }
    }
}
