package com.ttennebkram.radiograph.mapping;

import com.ttennebkram.radiograph.config.EnhancementConfig;
import com.ttennebkram.radiograph.metrics.ImageStatistics;
import com.ttennebkram.radiograph.metrics.QualityProfile;

/**
 * Translates a {@link QualityProfile} into a {@link StageConfig}.
 *
 * Every rule is a deterministic function of the profile and the injected
 * {@link EnhancementConfig}. Metrics are clamped into their valid range
 * first, so degenerate profiles (flat, all-black, all-white images) still
 * map to a usable configuration.
 *
 * The stages run in a fixed order, so two rules look ahead at what the
 * earlier stages will do to the image: denoising is sized for the noise
 * after CLAHE has amplified it, and sharpening is banded on the structure
 * that is left once denoising has removed the noise.
 */
public class ParameterMapper {

    private static final double MAX_INTENSITY = 255.0;

    private final EnhancementConfig config;
    private final double laplacianNoiseGain;

    public ParameterMapper(EnhancementConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config is required");
        }
        this.config = config;
        this.laplacianNoiseGain = ImageStatistics.laplacianNoiseGain(config.getLaplacianApertureSize());
    }

    public StageConfig map(QualityProfile profile) {
        boolean skipClahe = isClaheSkipped(profile.getContrast());
        double clipLimit = clipLimit(profile.getContrast());
        boolean skipDenoise = isDenoiseSkipped(profile.getNoiseLevel());
        double sharpness = skipDenoise
                ? profile.getSharpness()
                : structuralSharpness(profile.getSharpness(), profile.getNoiseLevel());
        return new StageConfig(
                skipClahe,
                clipLimit,
                tileCount(profile.getWidth()),
                tileCount(profile.getHeight()),
                config.getBilateralDiameter(),
                config.getBilateralSigmaColor(),
                config.getBilateralSigmaSpace(),
                skipDenoise,
                skipDenoise ? 0.0 : denoiseStrength(profile.getNoiseLevel(), skipClahe ? 1.0 : clipLimit),
                config.getDenoiseTemplateWindow(),
                config.getDenoiseSearchWindow(),
                sharpenStrength(sharpness),
                config.getSharpenKernelSize(),
                config.getSharpenSigma());
    }

    /**
     * True when the contrast is at or above the balanced level. Such images go
     * through the pipeline without CLAHE.
     */
    public boolean isClaheSkipped(double contrast) {
        return clamp(sanitize(contrast), 0.0, MAX_INTENSITY) >= config.getClaheSkipContrast();
    }

    /**
     * Low-contrast images get a clip limit near the top of the range,
     * high-contrast images stay near the bottom.
     */
    public double clipLimit(double contrast) {
        double c = clamp(sanitize(contrast), 0.0, MAX_INTENSITY);
        double min = config.getClipLimitMin();
        double max = config.getClipLimitMax();
        double lowContrastBoost = (max - min) * (1.0 - c / config.getContrastReference());
        return clamp(min + lowContrastBoost, min, max);
    }

    public boolean isDenoiseSkipped(double noiseLevel) {
        return clamp(sanitize(noiseLevel), 0.0, MAX_INTENSITY) < config.getDenoiseSkipThreshold();
    }

    /**
     * Non-local means strength h for a noise level measured on the original
     * image. CLAHE runs first and scales noise by roughly its clip limit, so
     * the level is multiplied by {@code contrastGain} (the clip limit, or 1
     * when CLAHE is skipped). Monotonically non-decreasing in both arguments;
     * returns 0 when the level is below the skip threshold.
     */
    public double denoiseStrength(double noiseLevel, double contrastGain) {
        double n = clamp(sanitize(noiseLevel), 0.0, MAX_INTENSITY);
        if (n < config.getDenoiseSkipThreshold()) {
            return 0.0;
        }
        double gain = Math.max(1.0, sanitize(contrastGain));
        return clamp(n * gain * config.getDenoiseGain(), config.getDenoiseMinStrength(), config.getDenoiseMaxStrength());
    }

    /**
     * Sharpness with the share that the measured noise contributes removed.
     * White noise of standard deviation n adds {@code gain * n^2} to the
     * Laplacian variance; denoising takes that away, so the sharpen band is
     * chosen on what remains. Never negative.
     */
    public double structuralSharpness(double sharpness, double noiseLevel) {
        double s = Math.max(0.0, sanitize(sharpness));
        double n = clamp(sanitize(noiseLevel), 0.0, MAX_INTENSITY);
        return Math.max(0.0, s - laplacianNoiseGain * n * n);
    }

    /**
     * Banded unsharp-mask strength: the first band whose upper edge is strictly
     * above the sharpness wins, so a value equal to an edge belongs to the next
     * band. A sharpness of exactly zero (flat image, or nothing but noise) maps
     * to 1.0, the identity.
     */
    public double sharpenStrength(double sharpness) {
        double s = Math.max(0.0, sanitize(sharpness));
        if (s == 0.0) {
            return 1.0;
        }
        double[] edges = config.getSharpnessBandEdges();
        double[] strengths = config.getSharpenStrengths();
        for (int band = 0; band < edges.length; band++) {
            if (s < edges[band]) {
                return strengths[band];
            }
        }
        return strengths[strengths.length - 1];
    }

    /**
     * CLAHE tiles along one axis: the configured grid, reduced so that no tile
     * is smaller than the configured minimum tile size.
     */
    public int tileCount(int axisLength) {
        int fit = axisLength / config.getClaheMinTileSize();
        return Math.max(1, Math.min(config.getClaheTileGridSize(), fit));
    }

    public EnhancementConfig getConfig() {
        return config;
    }

    private static double sanitize(double value) {
        return Double.isNaN(value) ? 0.0 : value;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
