package com.drugbox.recognition.detection;

import com.drugbox.recognition.core.model.BoundingBox;
import com.drugbox.recognition.image.GrayImage;

import java.awt.image.BufferedImage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Built-in proposer for boxes lying on a plain background.
 *
 * <p>The image is divided into square cells. A cell is foreground when its mean luminance
 * differs from the background, estimated as the median of the border pixels, by more than
 * the threshold. Four-connected foreground cells form one proposal; its confidence grows
 * with how densely the component fills its bounding box.</p>
 */
public class ContrastRegionProposer implements RegionProposer {

    private final int cellSize;
    private final double contrastThreshold;

    public ContrastRegionProposer() {
        this(16, 30.0);
    }

    public ContrastRegionProposer(int cellSize, double contrastThreshold) {
        if (cellSize < 2) {
            throw new IllegalArgumentException("cellSize must be >= 2");
        }
        this.cellSize = cellSize;
        this.contrastThreshold = contrastThreshold;
    }

    @Override
    public List<Proposal> propose(BufferedImage image) {
        GrayImage gray = GrayImage.of(image);
        int cols = (gray.width() + cellSize - 1) / cellSize;
        int rows = (gray.height() + cellSize - 1) / cellSize;
        double background = borderMedian(gray);

        boolean[][] foreground = new boolean[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                foreground[r][c] = Math.abs(cellMean(gray, c, r) - background) > contrastThreshold;
            }
        }

        List<Proposal> proposals = new ArrayList<>();
        boolean[][] seen = new boolean[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (foreground[r][c] && !seen[r][c]) {
                    proposals.add(component(foreground, seen, r, c, gray.width(), gray.height()));
                }
            }
        }
        return proposals;
    }

    private Proposal component(boolean[][] fg, boolean[][] seen, int startRow, int startCol,
                               int imageWidth, int imageHeight) {
        int minR = startRow, maxR = startRow, minC = startCol, maxC = startCol, cells = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.add(new int[]{startRow, startCol});
        seen[startRow][startCol] = true;
        while (!queue.isEmpty()) {
            int[] cell = queue.poll();
            int r = cell[0], c = cell[1];
            cells++;
            minR = Math.min(minR, r);
            maxR = Math.max(maxR, r);
            minC = Math.min(minC, c);
            maxC = Math.max(maxC, c);
            int[][] neighbours = {{r - 1, c}, {r + 1, c}, {r, c - 1}, {r, c + 1}};
            for (int[] n : neighbours) {
                if (n[0] >= 0 && n[0] < fg.length && n[1] >= 0 && n[1] < fg[0].length
                        && fg[n[0]][n[1]] && !seen[n[0]][n[1]]) {
                    seen[n[0]][n[1]] = true;
                    queue.add(n);
                }
            }
        }
        int x = minC * cellSize;
        int y = minR * cellSize;
        int w = Math.min(imageWidth, (maxC + 1) * cellSize) - x;
        int h = Math.min(imageHeight, (maxR + 1) * cellSize) - y;
        double fill = (double) cells / ((maxR - minR + 1) * (maxC - minC + 1));
        return new Proposal(new BoundingBox(x, y, w, h), 0.5 + 0.5 * fill);
    }

    private double cellMean(GrayImage gray, int col, int row) {
        int x0 = col * cellSize;
        int y0 = row * cellSize;
        int x1 = Math.min(gray.width(), x0 + cellSize);
        int y1 = Math.min(gray.height(), y0 + cellSize);
        double sum = 0;
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                sum += gray.at(x, y);
            }
        }
        return sum / ((x1 - x0) * (y1 - y0));
    }

    private static double borderMedian(GrayImage gray) {
        int w = gray.width();
        int h = gray.height();
        float[] samples = new float[2 * w + 2 * h];
        int n = 0;
        for (int x = 0; x < w; x++) {
            samples[n++] = gray.at(x, 0);
            samples[n++] = gray.at(x, h - 1);
        }
        for (int y = 0; y < h; y++) {
            samples[n++] = gray.at(0, y);
            samples[n++] = gray.at(w - 1, y);
        }
        Arrays.sort(samples, 0, n);
        return samples[n / 2];
    }
}
