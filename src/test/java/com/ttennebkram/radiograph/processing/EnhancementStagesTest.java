package com.ttennebkram.radiograph.processing;

import com.ttennebkram.radiograph.SyntheticImages;
import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.mapping.StageConfig;
import com.ttennebkram.radiograph.metrics.ImageStatistics;
import com.ttennebkram.radiograph.util.MatScope;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnhancementStagesTest {

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
    }

    static StageConfig config(double clip, double denoiseStrength, double sharpenStrength, int sharpenKernel) {
        return new StageConfig(false, clip, 1, 1, 5, 10.0, 10.0,
                denoiseStrength <= 0, denoiseStrength, 7, 21,
                sharpenStrength, sharpenKernel, 1.2);
    }

    @Test
    void namesComeFromTheStageAnnotation() {
        assertEquals("CLAHE", new ClaheStage().getName());
        assertEquals("BilateralFilter", new BilateralFilterStage().getName());
        assertEquals("Denoise", new DenoiseStage().getName());
        assertEquals("Sharpen", new SharpenStage().getName());
        assertFalse(new ClaheStage().getDescription().isEmpty());
    }

    @Test
    void claheStretchesALowContrastImage() {
        Image input = SyntheticImages.darkLowContrastNoisy();
        Image output = new ClaheStage().apply(input, config(2.9, 0, 1.0, 5));

        assertTrue(output.sameShape(input));
        assertTrue(SyntheticImages.stdDev(output) > SyntheticImages.stdDev(input));
    }

    @Test
    void bilateralFilterSmoothsFlatNoise() {
        Image input = SyntheticImages.noisyGradient(64, 64, 120, 0, 4, 1L);
        Image output = new BilateralFilterStage().apply(input, config(2, 0, 1.0, 5));

        assertTrue(SyntheticImages.stdDev(output) < SyntheticImages.stdDev(input));
    }

    @Test
    void denoiseReducesNoise() {
        Image input = SyntheticImages.noisyGradient(64, 64, 120, 0, 8, 2L);
        Image output = new DenoiseStage().apply(input, config(2, 10, 1.0, 5));

        assertTrue(SyntheticImages.stdDev(output) < SyntheticImages.stdDev(input) / 2);
    }

    @Test
    void skippedStagesReturnTheirInput() {
        Image input = SyntheticImages.sharpSquares(32);
        StageConfig config = config(2, 0, 1.0, 5);

        assertTrue(new DenoiseStage().isSkipped(config));
        assertTrue(new SharpenStage().isSkipped(config));
        assertSame(input, new DenoiseStage().apply(input, config));
        assertSame(input, new SharpenStage().apply(input, config));
    }

    @Test
    void balancedContrastSkipsClahe() {
        Image input = SyntheticImages.checkerboardPhantom(64, 90, 170, 8, 4, 2.0, 5L);
        StageConfig balanced = new StageConfig(true, 1.0, 1, 1, 5, 10.0, 10.0,
                true, 0.0, 7, 21, 1.0, 5, 1.2);

        assertTrue(new ClaheStage().isSkipped(balanced));
        assertFalse(new ClaheStage().isSkipped(config(1.0, 0, 1.0, 5)));
        assertSame(input, new ClaheStage().apply(input, balanced));
    }

    @Test
    void sharpenStrengthAboveOneSharpensAndBelowOneSoftens() {
        Image input = SyntheticImages.gaussianBlur(SyntheticImages.sharpSquares(64), 5, 0);
        double base = ImageStatistics.sharpness(input, 1);

        Image sharpened = new SharpenStage().apply(input, config(2, 0, 2.0, 5));
        Image softened = new SharpenStage().apply(input, config(2, 0, 0.7, 5));

        assertTrue(ImageStatistics.sharpness(sharpened, 1) > base);
        assertTrue(ImageStatistics.sharpness(softened, 1) < base);
    }

    @Test
    void stagesDoNotModifyTheirInput() {
        Image input = SyntheticImages.darkLowContrastNoisy();
        byte[] before = input.toBytes();

        new ClaheStage().apply(input, config(3, 5, 1.7, 5));
        new SharpenStage().apply(input, config(3, 5, 1.7, 5));

        assertArrayEquals(before, input.toBytes());
    }

    @Test
    void evenSharpenKernelFailsInTheSharpenStage() {
        StageFailureException e = assertThrows(StageFailureException.class,
                () -> new SharpenStage().apply(SyntheticImages.sharpSquares(32), config(2, 0, 1.7, 4)));
        assertEquals("Sharpen", e.getStageName());
        assertTrue(e.getMessage().startsWith("Sharpen"));
    }

    @Test
    void nonPositiveClipLimitFailsInTheClaheStage() {
        StageFailureException e = assertThrows(StageFailureException.class,
                () -> new ClaheStage().apply(SyntheticImages.sharpSquares(32), config(0, 0, 1.0, 5)));
        assertEquals("CLAHE", e.getStageName());
    }

    @Test
    void missingInputIsAStageFailure() {
        StageFailureException e = assertThrows(StageFailureException.class,
                () -> new BilateralFilterStage().apply(null, config(2, 0, 1.0, 5)));
        assertEquals("BilateralFilter", e.getStageName());
    }

    @Test
    void stagesReleaseNativeBuffers() {
        long before = MatScope.getActiveCount();
        Image input = SyntheticImages.darkLowContrastNoisy();
        StageConfig config = config(2.5, 6, 1.7, 5);

        new ClaheStage().apply(input, config);
        new BilateralFilterStage().apply(input, config);
        new DenoiseStage().apply(input, config);
        new SharpenStage().apply(input, config);
        assertThrows(StageFailureException.class, () -> new SharpenStage().apply(input, config(2, 0, 1.7, 4)));

        assertEquals(before, MatScope.getActiveCount());
    }
}
