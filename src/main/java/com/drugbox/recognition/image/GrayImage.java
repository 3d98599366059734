package com.drugbox.recognition.image;

import java.awt.image.BufferedImage;

/**
 * Luminance plane of an image, values in [0, 255], row-major.
 */
public final class GrayImage {

    private final int width;
    private final int height;
    private final float[] luma;

    private GrayImage(int width, int height, float[] luma) {
        this.width = width;
        this.height = height;
        this.luma = luma;
    }

    public static GrayImage of(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] rgb = image.getRGB(0, 0, w, h, null, 0, w);
        float[] luma = new float[w * h];
        for (int i = 0; i < rgb.length; i++) {
            int p = rgb[i];
            int r = (p >> 16) & 0xFF;
            int g = (p >> 8) & 0xFF;
            int b = p & 0xFF;
            luma[i] = 0.299f * r + 0.587f * g + 0.114f * b;
        }
        return new GrayImage(w, h, luma);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public float at(int x, int y) {
        return luma[y * width + x];
    }

    public double mean() {
        double sum = 0;
        for (float v : luma) {
            sum += v;
        }
        return luma.length == 0 ? 0.0 : sum / luma.length;
    }

    public double stddev() {
        double mean = mean();
        double sq = 0;
        for (float v : luma) {
            sq += (v - mean) * (v - mean);
        }
        return luma.length == 0 ? 0.0 : Math.sqrt(sq / luma.length);
    }

    /**
     * Sobel gradients. Border pixels get zero magnitude.
     */
    public EdgeMap edges() {
        float[] magnitude = new float[width * height];
        float[] direction = new float[width * height];
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                float gx = -at(x - 1, y - 1) - 2 * at(x - 1, y) - at(x - 1, y + 1)
                        + at(x + 1, y - 1) + 2 * at(x + 1, y) + at(x + 1, y + 1);
                float gy = -at(x - 1, y - 1) - 2 * at(x, y - 1) - at(x + 1, y - 1)
                        + at(x - 1, y + 1) + 2 * at(x, y + 1) + at(x + 1, y + 1);
                int i = y * width + x;
                magnitude[i] = (float) Math.sqrt(gx * gx + gy * gy);
                direction[i] = (float) Math.atan2(gy, gx);
            }
        }
        return new EdgeMap(width, height, magnitude, direction);
    }

    /**
     * Gradient magnitude and direction per pixel.
     */
    public static final class EdgeMap {
        private final int width;
        private final int height;
        private final float[] magnitude;
        private final float[] direction;

        EdgeMap(int width, int height, float[] magnitude, float[] direction) {
            this.width = width;
            this.height = height;
            this.magnitude = magnitude;
            this.direction = direction;
        }

        public int width() {
            return width;
        }

        public int height() {
            return height;
        }

        public float magnitude(int x, int y) {
            return magnitude[y * width + x];
        }

        /**
         * Gradient angle in radians, in [-pi, pi].
         */
        public float direction(int x, int y) {
            return direction[y * width + x];
        }

        /**
         * Share of pixels inside the rectangle whose magnitude exceeds {@code threshold}.
         */
        public double density(int x0, int y0, int x1, int y1, double threshold) {
            int strong = 0;
            int total = 0;
            for (int y = Math.max(0, y0); y < Math.min(height, y1); y++) {
                for (int x = Math.max(0, x0); x < Math.min(width, x1); x++) {
                    total++;
                    if (magnitude[y * width + x] > threshold) {
                        strong++;
                    }
                }
            }
            return total == 0 ? 0.0 : (double) strong / total;
        }
    }
}
