package com.ttennebkram.radiograph;

import com.ttennebkram.radiograph.config.EnhancementConfig;
import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.mapping.ParameterMapper;
import com.ttennebkram.radiograph.mapping.StageConfig;
import com.ttennebkram.radiograph.metrics.NoiseEstimate;
import com.ttennebkram.radiograph.metrics.NoiseEstimator;
import com.ttennebkram.radiograph.metrics.PatchNoiseEstimator;
import com.ttennebkram.radiograph.metrics.QualityAnalyzer;
import com.ttennebkram.radiograph.metrics.QualityProfile;
import com.ttennebkram.radiograph.processing.ClaheStage;
import com.ttennebkram.radiograph.processing.EnhancementPipeline;
import com.ttennebkram.radiograph.processing.EnhancementStage;
import com.ttennebkram.radiograph.processing.SharpenStage;
import com.ttennebkram.radiograph.processing.StageFailureException;
import com.ttennebkram.radiograph.util.MatScope;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AdaptiveEnhancerTest {

    private final EnhancementConfig config = EnhancementConfig.defaults();

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    void darkLowContrastNoisyImageIsImproved() {
        assertImproved(SyntheticImages.darkLowContrastNoisy());
    }

    @Test
    void heavilyNoisyDarkImageIsImproved() {
        assertImproved(SyntheticImages.darkLowContrast(5.0, 42L));
    }

    @Test
    void mildlyNoisyDarkImageIsImproved() {
        assertImproved(SyntheticImages.darkLowContrast(2.0, 42L));
    }

    private void assertImproved(Image original) {
        AdaptiveEnhancer enhancer = new AdaptiveEnhancer(config);

        EnhancementResult result = enhancer.adaptiveEnhance(original);

        assertTrue(result.isSuccess(), () -> String.valueOf(result.getFailure()));
        assertEquals(List.of("CLAHE", "BilateralFilter", "Denoise", "Sharpen"), result.getAppliedStages());

        QualityProfile before = result.getProfile();
        QualityProfile after = enhancer.getAnalyzer().analyze(result.getImage());
        assertTrue(after.getBrightness() > before.getBrightness(),
                "brightness " + before.getBrightness() + " -> " + after.getBrightness());
        assertTrue(after.getContrast() > before.getContrast(),
                "contrast " + before.getContrast() + " -> " + after.getContrast());
        assertTrue(after.getSharpness() > before.getSharpness(),
                "sharpness " + before.getSharpness() + " -> " + after.getSharpness());
        assertTrue(after.getNoiseLevel() <= before.getNoiseLevel(),
                "noise " + before.getNoiseLevel() + " -> " + after.getNoiseLevel());
    }

    @Test
    void outputKeepsTheInputShape() {
        Image original = SyntheticImages.noisyGradient(96, 72, 80, 0.5, 3, 9L);
        Image enhanced = new AdaptiveEnhancer(config).enhanceOrThrow(original);

        assertTrue(enhanced.sameShape(original));
    }

    @Test
    void uniformImagesAreHandled() {
        AdaptiveEnhancer enhancer = new AdaptiveEnhancer(config);
        for (int value : new int[]{0, 255}) {
            EnhancementResult result = enhancer.adaptiveEnhance(SyntheticImages.flat(64, 64, value));

            assertTrue(result.isSuccess());
            StageConfig stages = result.getStageConfig();
            assertTrue(stages.getClipLimit() >= 1.0 && stages.getClipLimit() <= 3.0);
            assertTrue(stages.isDenoiseSkipped());
            assertEquals(1.0, stages.getSharpenStrength(), 1e-9);
            assertEquals(List.of("Denoise", "Sharpen"), result.getSkippedStages());

            // still uniform afterwards
            byte[] pixels = result.getImage().toBytes();
            for (byte b : pixels) {
                assertEquals(pixels[0], b);
            }
        }
    }

    @Test
    void secondPassOverABalancedImageChangesLittle() {
        AdaptiveEnhancer enhancer = new AdaptiveEnhancer(config);
        QualityAnalyzer analyzer = enhancer.getAnalyzer();

        EnhancementResult first = enhancer.adaptiveEnhance(SyntheticImages.midRangePhantom(42L));
        EnhancementResult second = enhancer.adaptiveEnhance(first.getImage());

        assertTrue(first.isSuccess() && second.isSuccess());
        assertTrue(first.getStageConfig().isClaheSkipped(), first.getStageConfig().toString());
        assertTrue(second.getStageConfig().isClaheSkipped(), second.getStageConfig().toString());

        Image once = first.getImage();
        Image twice = second.getImage();
        assertEquals(SyntheticImages.mean(once), SyntheticImages.mean(twice), 1.0);
        assertEquals(SyntheticImages.stdDev(once), SyntheticImages.stdDev(twice), 1.5);
        assertEquals(analyzer.analyze(once).getContrast(), analyzer.analyze(twice).getContrast(), 3.0);
    }

    @Test
    void profileIsMeasuredOnceFromTheOriginal() {
        AtomicInteger calls = new AtomicInteger();
        PatchNoiseEstimator patches = new PatchNoiseEstimator(config);
        NoiseEstimator counting = image -> {
            calls.incrementAndGet();
            return patches.estimate(image);
        };
        QualityAnalyzer analyzer = new QualityAnalyzer(config, counting);
        AdaptiveEnhancer enhancer = new AdaptiveEnhancer(analyzer, new ParameterMapper(config),
                EnhancementPipeline.standard());

        Image original = SyntheticImages.darkLowContrastNoisy();
        EnhancementResult result = enhancer.adaptiveEnhance(original);

        assertTrue(result.isSuccess());
        assertEquals(1, calls.get());
        assertEquals(analyzer.analyze(original).toString(), result.getProfile().toString());
    }

    @Test
    void everyStageSeesTheConfigDerivedFromTheOriginal() {
        List<StageConfig> seen = new ArrayList<>();
        EnhancementStage clahe = new ClaheStage();
        EnhancementStage recordingClahe = new EnhancementStage() {
            @Override
            public String getName() {
                return clahe.getName();
            }

            @Override
            public Image apply(Image input, StageConfig stageConfig) {
                seen.add(stageConfig);
                return clahe.apply(input, stageConfig);
            }
        };
        EnhancementStage sharpen = new SharpenStage();
        EnhancementStage recordingSharpen = new EnhancementStage() {
            @Override
            public String getName() {
                return sharpen.getName();
            }

            @Override
            public Image apply(Image input, StageConfig stageConfig) {
                seen.add(stageConfig);
                return sharpen.apply(input, stageConfig);
            }
        };
        AdaptiveEnhancer enhancer = new AdaptiveEnhancer(new QualityAnalyzer(config), new ParameterMapper(config),
                new EnhancementPipeline(List.of(recordingClahe, recordingSharpen)));

        EnhancementResult result = enhancer.adaptiveEnhance(SyntheticImages.darkLowContrastNoisy());

        assertEquals(2, seen.size());
        assertSame(result.getStageConfig(), seen.get(0));
        assertSame(result.getStageConfig(), seen.get(1));
    }

    @Test
    void stageFailureIsReportedWithTheStageName() {
        EnhancementStage exploding = new EnhancementStage() {
            @Override
            public String getName() {
                return "Exploding";
            }

            @Override
            public Image apply(Image input, StageConfig stageConfig) {
                throw new StageFailureException(getName(), "boom");
            }
        };
        AdaptiveEnhancer enhancer = new AdaptiveEnhancer(new QualityAnalyzer(config), new ParameterMapper(config),
                new EnhancementPipeline(List.of(new ClaheStage(), exploding)));

        EnhancementResult result = enhancer.adaptiveEnhance(SyntheticImages.darkLowContrastNoisy());

        assertFalse(result.isSuccess());
        assertEquals("Exploding", result.getFailure().getStageName());
        assertNotNull(result.getProfile());
        assertThrows(IllegalStateException.class, result::getImage);

        StageFailureException thrown = assertThrows(StageFailureException.class,
                () -> enhancer.enhanceOrThrow(SyntheticImages.darkLowContrastNoisy()));
        assertEquals("Exploding", thrown.getStageName());
    }

    @Test
    void missingImageIsAnInputFailure() {
        EnhancementResult result = new AdaptiveEnhancer(config).adaptiveEnhance(null);

        assertFalse(result.isSuccess());
        assertEquals(ProcessingFailure.INPUT_STAGE, result.getFailure().getStageName());
    }

    @Test
    void originalIsLeftUntouched() {
        Image original = SyntheticImages.darkLowContrastNoisy();
        byte[] before = original.toBytes();

        new AdaptiveEnhancer(config).adaptiveEnhance(original);

        assertArrayEquals(before, original.toBytes());
    }

    @Test
    void noNativeBuffersLeak() {
        AdaptiveEnhancer enhancer = new AdaptiveEnhancer(config);
        long before = MatScope.getActiveCount();

        enhancer.adaptiveEnhance(SyntheticImages.darkLowContrastNoisy());
        enhancer.adaptiveEnhance(SyntheticImages.flat(32, 32, 0));

        assertEquals(before, MatScope.getActiveCount());
    }

    @Test
    void customNoiseEstimatorDrivesDenoising() {
        NoiseEstimator alwaysClean = image -> new NoiseEstimate(0.0, 40, false);
        AdaptiveEnhancer enhancer = new AdaptiveEnhancer(new QualityAnalyzer(config, alwaysClean),
                new ParameterMapper(config), EnhancementPipeline.standard());

        EnhancementResult result = enhancer.adaptiveEnhance(SyntheticImages.darkLowContrastNoisy());

        assertTrue(result.isSuccess());
        assertTrue(result.getSkippedStages().contains("Denoise"));
    }
}
