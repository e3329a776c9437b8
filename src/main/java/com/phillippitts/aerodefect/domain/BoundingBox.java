package com.phillippitts.aerodefect.domain;

/**
 * Axis-aligned rectangle in original-image pixel space.
 *
 * <p>No validation happens here; geometry coming from detectors is checked with
 * {@link #isWellFormed()} where it matters (the ensemble aggregator drops malformed boxes).
 *
 * @param x      left edge
 * @param y      top edge
 * @param width  width in pixels
 * @param height height in pixels
 */
public record BoundingBox(double x, double y, double width, double height) {

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double area() {
        return width * height;
    }

    /**
     * @return true when all coordinates are finite and the box has positive area
     */
    public boolean isWellFormed() {
        return Double.isFinite(x) && Double.isFinite(y)
                && Double.isFinite(width) && Double.isFinite(height)
                && width > 0 && height > 0;
    }

    /**
     * @return true when the box lies entirely inside a {@code imageWidth x imageHeight} image
     */
    public boolean isWithin(int imageWidth, int imageHeight) {
        return x >= 0 && y >= 0 && right() <= imageWidth && bottom() <= imageHeight;
    }

    /**
     * Intersection over union: 0 for disjoint (or touching) boxes, 1 for identical boxes.
     */
    public double iou(BoundingBox other) {
        double interLeft = Math.max(x, other.x);
        double interTop = Math.max(y, other.y);
        double interRight = Math.min(right(), other.right());
        double interBottom = Math.min(bottom(), other.bottom());
        if (interRight <= interLeft || interBottom <= interTop) {
            return 0.0;
        }
        double intersection = (interRight - interLeft) * (interBottom - interTop);
        double union = area() + other.area() - intersection;
        return union > 0 ? intersection / union : 0.0;
    }

    /**
     * Coordinate-wise mean of this box and {@code other}.
     */
    public BoundingBox average(BoundingBox other) {
        return new BoundingBox(
                (x + other.x) / 2.0,
                (y + other.y) / 2.0,
                (width + other.width) / 2.0,
                (height + other.height) / 2.0);
    }

    /**
     * Intersects this box with the image rectangle {@code [0,imageWidth] x [0,imageHeight]}.
     * The result may have zero area when the box lies outside the image.
     */
    public BoundingBox clampTo(int imageWidth, int imageHeight) {
        double left = clamp(x, imageWidth);
        double top = clamp(y, imageHeight);
        double r = clamp(right(), imageWidth);
        double b = clamp(bottom(), imageHeight);
        return new BoundingBox(left, top, Math.max(0, r - left), Math.max(0, b - top));
    }

    private static double clamp(double v, int max) {
        return Math.max(0, Math.min(v, max));
    }
}
