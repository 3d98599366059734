package com.drugbox.recognition.core.model;

/**
 * Axis-aligned rectangle in source-image pixel coordinates.
 *
 * @param x      left edge
 * @param y      top edge
 * @param width  width in pixels, strictly positive
 * @param height height in pixels, strictly positive
 */
public record BoundingBox(int x, int y, int width, int height) {

    public BoundingBox {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("width and height must be > 0");
        }
    }

    public long area() {
        return (long) width * height;
    }

    public double aspectRatio() {
        return (double) width / height;
    }

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    /**
     * Intersection-over-union with another box, in [0, 1].
     */
    public double iou(BoundingBox other) {
        int ix = Math.max(x, other.x);
        int iy = Math.max(y, other.y);
        int ir = Math.min(right(), other.right());
        int ib = Math.min(bottom(), other.bottom());
        if (ir <= ix || ib <= iy) {
            return 0.0;
        }
        double intersection = (double) (ir - ix) * (ib - iy);
        return intersection / (area() + other.area() - intersection);
    }

    /**
     * Grows the box by {@code padding} on every side, clipped to the image bounds.
     */
    public BoundingBox expand(int padding, int imageWidth, int imageHeight) {
        int nx = Math.max(0, x - padding);
        int ny = Math.max(0, y - padding);
        int nr = Math.min(imageWidth, right() + padding);
        int nb = Math.min(imageHeight, bottom() + padding);
        return new BoundingBox(nx, ny, nr - nx, nb - ny);
    }
}
