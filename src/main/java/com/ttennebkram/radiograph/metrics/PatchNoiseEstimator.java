package com.ttennebkram.radiograph.metrics;

import com.ttennebkram.radiograph.config.EnhancementConfig;
import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.util.MatScope;
import org.opencv.core.Mat;
import org.opencv.core.Rect;

import java.util.ArrayList;
import java.util.List;

/**
 * Noise estimate from eight background patches: the four corners, the
 * midpoints of the left and right edges and the midpoints of the top and
 * bottom edges. The result is the mean of the per-patch standard deviations.
 *
 * The standard layout needs both sides to be at least twice the patch size.
 * Smaller images use patches of a quarter of the short side, and images where
 * even that falls below the configured minimum report zero noise. Both cases
 * are flagged as undersized.
 */
public class PatchNoiseEstimator implements NoiseEstimator {

    private final int patchSize;
    private final int minPatchSize;

    public PatchNoiseEstimator(EnhancementConfig config) {
        this(config.getNoisePatchSize(), config.getNoiseMinPatchSize());
    }

    public PatchNoiseEstimator(int patchSize, int minPatchSize) {
        if (patchSize <= 0 || minPatchSize <= 0) {
            throw new IllegalArgumentException("Patch sizes must be positive");
        }
        this.patchSize = patchSize;
        this.minPatchSize = minPatchSize;
    }

    @Override
    public NoiseEstimate estimate(Image image) {
        int shortSide = Math.min(image.getWidth(), image.getHeight());

        int side = patchSize;
        boolean undersized = false;
        if (shortSide < 2 * patchSize) {
            undersized = true;
            side = shortSide / 4;
            if (side < minPatchSize) {
                return new NoiseEstimate(0.0, 0, true);
            }
        }

        List<Rect> patches = layout(image.getWidth(), image.getHeight(), side);
        try (MatScope scope = new MatScope()) {
            Mat mat = scope.track(image.toMat());
            double total = 0;
            for (Rect patch : patches) {
                Mat roi = scope.track(mat.submat(patch));
                total += ImageStatistics.stdDev(roi, scope);
            }
            return new NoiseEstimate(total / patches.size(), side, undersized);
        }
    }

    /**
     * Patch rectangles for an image of the given size.
     */
    static List<Rect> layout(int width, int height, int side) {
        int midRow = height / 2 - side / 2;
        int midCol = width / 2 - side / 2;
        int lastRow = height - side;
        int lastCol = width - side;

        List<Rect> patches = new ArrayList<>(8);
        // Corners
        patches.add(new Rect(0, 0, side, side));
        patches.add(new Rect(lastCol, 0, side, side));
        patches.add(new Rect(0, lastRow, side, side));
        patches.add(new Rect(lastCol, lastRow, side, side));
        // Left and right edge midpoints
        patches.add(new Rect(0, midRow, side, side));
        patches.add(new Rect(lastCol, midRow, side, side));
        // Top and bottom edge midpoints
        patches.add(new Rect(midCol, 0, side, side));
        patches.add(new Rect(midCol, lastRow, side, side));
        return patches;
    }

    public int getPatchSize() {
        return patchSize;
    }
}
