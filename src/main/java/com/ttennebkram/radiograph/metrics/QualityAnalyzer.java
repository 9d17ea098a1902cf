package com.ttennebkram.radiograph.metrics;

import com.ttennebkram.radiograph.config.EnhancementConfig;
import com.ttennebkram.radiograph.image.Image;

/**
 * Measures the {@link QualityProfile} of an image.
 * Stateless apart from its configuration; safe to share between threads.
 */
public class QualityAnalyzer {

    private final EnhancementConfig config;
    private final NoiseEstimator noiseEstimator;

    public QualityAnalyzer(EnhancementConfig config) {
        this(config, new PatchNoiseEstimator(config));
    }

    public QualityAnalyzer(EnhancementConfig config, NoiseEstimator noiseEstimator) {
        if (config == null || noiseEstimator == null) {
            throw new IllegalArgumentException("config and noiseEstimator are required");
        }
        this.config = config;
        this.noiseEstimator = noiseEstimator;
    }

    public QualityProfile analyze(Image image) {
        if (image == null) {
            throw new IllegalArgumentException("image is required");
        }
        double contrast = ImageStatistics.contrast(image,
                config.getContrastLowPercentile(), config.getContrastHighPercentile());
        double sharpness = ImageStatistics.sharpness(image, config.getLaplacianApertureSize());
        double brightness = ImageStatistics.brightness(image);
        NoiseEstimate noise = noiseEstimator.estimate(image);

        return new QualityProfile(contrast, noise.level, sharpness, brightness,
                image.getWidth(), image.getHeight(), noise.undersized);
    }

    public EnhancementConfig getConfig() {
        return config;
    }

    public NoiseEstimator getNoiseEstimator() {
        return noiseEstimator;
    }
}
