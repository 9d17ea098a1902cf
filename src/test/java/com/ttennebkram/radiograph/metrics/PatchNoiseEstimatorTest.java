package com.ttennebkram.radiograph.metrics;

import com.ttennebkram.radiograph.SyntheticImages;
import com.ttennebkram.radiograph.config.EnhancementConfig;
import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.util.MatScope;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Rect;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchNoiseEstimatorTest {

    private final PatchNoiseEstimator estimator = new PatchNoiseEstimator(EnhancementConfig.defaults());

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    void flatImageHasNoNoise() {
        NoiseEstimate estimate = estimator.estimate(SyntheticImages.flat(128, 128, 90));

        assertEquals(0.0, estimate.level, 1e-9);
        assertEquals(40, estimate.patchSize);
        assertFalse(estimate.undersized);
    }

    @Test
    void noiseLevelGrowsWithAddedNoise() {
        double previous = -1;
        for (double sigma : new double[]{0, 2, 5, 10}) {
            Image image = SyntheticImages.noisyGradient(128, 128, 100, 0.2, sigma, 7L);
            double level = estimator.estimate(image).level;
            assertTrue(level > previous, "sigma " + sigma + " gave " + level + ", previous " + previous);
            previous = level;
        }
    }

    @Test
    void estimateTracksTheNoiseSigma() {
        Image image = SyntheticImages.noisyGradient(256, 256, 120, 0.0, 8.0, 11L);
        assertEquals(8.0, estimator.estimate(image).level, 1.0);
    }

    @Test
    void smallImagesUseQuarterSizePatches() {
        NoiseEstimate estimate = estimator.estimate(SyntheticImages.noisyGradient(64, 48, 100, 0, 3, 3L));

        assertTrue(estimate.undersized);
        assertEquals(12, estimate.patchSize);
        assertTrue(estimate.level > 0);
    }

    @Test
    void tinyImagesReportZeroNoise() {
        NoiseEstimate estimate = estimator.estimate(SyntheticImages.noisyGradient(12, 12, 100, 0, 5, 3L));

        assertTrue(estimate.undersized);
        assertEquals(0.0, estimate.level, 1e-9);
    }

    @Test
    void layoutPlacesEightPatchesInsideTheImage() {
        List<Rect> patches = PatchNoiseEstimator.layout(200, 100, 40);

        assertEquals(8, patches.size());
        assertEquals(new Rect(0, 0, 40, 40), patches.get(0));
        assertEquals(new Rect(160, 60, 40, 40), patches.get(3));
        assertEquals(new Rect(0, 30, 40, 40), patches.get(4));
        assertEquals(new Rect(80, 0, 40, 40), patches.get(6));
        for (Rect patch : patches) {
            assertTrue(patch.x >= 0 && patch.y >= 0);
            assertTrue(patch.x + patch.width <= 200 && patch.y + patch.height <= 100);
        }
    }

    @Test
    void estimateReleasesNativeBuffers() {
        long before = MatScope.getActiveCount();
        estimator.estimate(SyntheticImages.noisyGradient(128, 128, 100, 0.2, 4, 5L));
        assertEquals(before, MatScope.getActiveCount());
    }
}
