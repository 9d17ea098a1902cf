package com.ttennebkram.radiograph.config;

import java.util.Arrays;

/**
 * All tunable thresholds of the adaptive enhancer.
 *
 * Immutable; create with {@link #builder()} or start from {@link #defaults()}
 * and adjust with {@link #toBuilder()}. The same instance can be shared by any
 * number of analyzers, mappers and enhancers.
 */
public final class EnhancementConfig {

    // Contrast estimator
    private final double contrastLowPercentile;
    private final double contrastHighPercentile;

    // Noise estimator patch layout
    private final int noisePatchSize;
    private final int noiseMinPatchSize;

    // Sharpness estimator
    private final int laplacianApertureSize;

    // CLAHE
    private final double clipLimitMin;
    private final double clipLimitMax;
    private final double contrastReference;
    private final double claheSkipContrast;
    private final int claheTileGridSize;
    private final int claheMinTileSize;

    // Bilateral filter
    private final int bilateralDiameter;
    private final double bilateralSigmaColor;
    private final double bilateralSigmaSpace;

    // Non-local means denoising
    private final double denoiseSkipThreshold;
    private final double denoiseGain;
    private final double denoiseMinStrength;
    private final double denoiseMaxStrength;
    private final int denoiseTemplateWindow;
    private final int denoiseSearchWindow;

    // Unsharp masking
    private final double[] sharpnessBandEdges;
    private final double[] sharpenStrengths;
    private final int sharpenKernelSize;
    private final double sharpenSigma;

    private static final EnhancementConfig DEFAULTS = new Builder().build();

    private EnhancementConfig(Builder b) {
        this.contrastLowPercentile = b.contrastLowPercentile;
        this.contrastHighPercentile = b.contrastHighPercentile;
        this.noisePatchSize = b.noisePatchSize;
        this.noiseMinPatchSize = b.noiseMinPatchSize;
        this.laplacianApertureSize = b.laplacianApertureSize;
        this.clipLimitMin = b.clipLimitMin;
        this.clipLimitMax = b.clipLimitMax;
        this.contrastReference = b.contrastReference;
        this.claheSkipContrast = b.claheSkipContrast;
        this.claheTileGridSize = b.claheTileGridSize;
        this.claheMinTileSize = b.claheMinTileSize;
        this.bilateralDiameter = b.bilateralDiameter;
        this.bilateralSigmaColor = b.bilateralSigmaColor;
        this.bilateralSigmaSpace = b.bilateralSigmaSpace;
        this.denoiseSkipThreshold = b.denoiseSkipThreshold;
        this.denoiseGain = b.denoiseGain;
        this.denoiseMinStrength = b.denoiseMinStrength;
        this.denoiseMaxStrength = b.denoiseMaxStrength;
        this.denoiseTemplateWindow = b.denoiseTemplateWindow;
        this.denoiseSearchWindow = b.denoiseSearchWindow;
        this.sharpnessBandEdges = b.sharpnessBandEdges.clone();
        this.sharpenStrengths = b.sharpenStrengths.clone();
        this.sharpenKernelSize = b.sharpenKernelSize;
        this.sharpenSigma = b.sharpenSigma;
    }

    public static EnhancementConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .contrastPercentiles(contrastLowPercentile, contrastHighPercentile)
                .noisePatchSize(noisePatchSize)
                .noiseMinPatchSize(noiseMinPatchSize)
                .laplacianApertureSize(laplacianApertureSize)
                .clipLimitRange(clipLimitMin, clipLimitMax)
                .contrastReference(contrastReference)
                .claheSkipContrast(claheSkipContrast)
                .claheTileGridSize(claheTileGridSize)
                .claheMinTileSize(claheMinTileSize)
                .bilateral(bilateralDiameter, bilateralSigmaColor, bilateralSigmaSpace)
                .denoiseSkipThreshold(denoiseSkipThreshold)
                .denoiseGain(denoiseGain)
                .denoiseStrengthRange(denoiseMinStrength, denoiseMaxStrength)
                .denoiseWindows(denoiseTemplateWindow, denoiseSearchWindow)
                .sharpenBands(sharpnessBandEdges, sharpenStrengths)
                .sharpenKernel(sharpenKernelSize, sharpenSigma);
    }

    public double getContrastLowPercentile() {
        return contrastLowPercentile;
    }

    public double getContrastHighPercentile() {
        return contrastHighPercentile;
    }

    public int getNoisePatchSize() {
        return noisePatchSize;
    }

    public int getNoiseMinPatchSize() {
        return noiseMinPatchSize;
    }

    public int getLaplacianApertureSize() {
        return laplacianApertureSize;
    }

    public double getClipLimitMin() {
        return clipLimitMin;
    }

    public double getClipLimitMax() {
        return clipLimitMax;
    }

    public double getContrastReference() {
        return contrastReference;
    }

    /**
     * Contrast at or above which an image counts as balanced and CLAHE is skipped.
     * A value above 255 never skips.
     */
    public double getClaheSkipContrast() {
        return claheSkipContrast;
    }

    public int getClaheTileGridSize() {
        return claheTileGridSize;
    }

    public int getClaheMinTileSize() {
        return claheMinTileSize;
    }

    public int getBilateralDiameter() {
        return bilateralDiameter;
    }

    public double getBilateralSigmaColor() {
        return bilateralSigmaColor;
    }

    public double getBilateralSigmaSpace() {
        return bilateralSigmaSpace;
    }

    public double getDenoiseSkipThreshold() {
        return denoiseSkipThreshold;
    }

    public double getDenoiseGain() {
        return denoiseGain;
    }

    public double getDenoiseMinStrength() {
        return denoiseMinStrength;
    }

    public double getDenoiseMaxStrength() {
        return denoiseMaxStrength;
    }

    public int getDenoiseTemplateWindow() {
        return denoiseTemplateWindow;
    }

    public int getDenoiseSearchWindow() {
        return denoiseSearchWindow;
    }

    public double[] getSharpnessBandEdges() {
        return sharpnessBandEdges.clone();
    }

    public double[] getSharpenStrengths() {
        return sharpenStrengths.clone();
    }

    public int getSharpenKernelSize() {
        return sharpenKernelSize;
    }

    public double getSharpenSigma() {
        return sharpenSigma;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnhancementConfig)) return false;
        EnhancementConfig that = (EnhancementConfig) o;
        return Double.compare(contrastLowPercentile, that.contrastLowPercentile) == 0
                && Double.compare(contrastHighPercentile, that.contrastHighPercentile) == 0
                && noisePatchSize == that.noisePatchSize
                && noiseMinPatchSize == that.noiseMinPatchSize
                && laplacianApertureSize == that.laplacianApertureSize
                && Double.compare(clipLimitMin, that.clipLimitMin) == 0
                && Double.compare(clipLimitMax, that.clipLimitMax) == 0
                && Double.compare(contrastReference, that.contrastReference) == 0
                && Double.compare(claheSkipContrast, that.claheSkipContrast) == 0
                && claheTileGridSize == that.claheTileGridSize
                && claheMinTileSize == that.claheMinTileSize
                && bilateralDiameter == that.bilateralDiameter
                && Double.compare(bilateralSigmaColor, that.bilateralSigmaColor) == 0
                && Double.compare(bilateralSigmaSpace, that.bilateralSigmaSpace) == 0
                && Double.compare(denoiseSkipThreshold, that.denoiseSkipThreshold) == 0
                && Double.compare(denoiseGain, that.denoiseGain) == 0
                && Double.compare(denoiseMinStrength, that.denoiseMinStrength) == 0
                && Double.compare(denoiseMaxStrength, that.denoiseMaxStrength) == 0
                && denoiseTemplateWindow == that.denoiseTemplateWindow
                && denoiseSearchWindow == that.denoiseSearchWindow
                && Arrays.equals(sharpnessBandEdges, that.sharpnessBandEdges)
                && Arrays.equals(sharpenStrengths, that.sharpenStrengths)
                && sharpenKernelSize == that.sharpenKernelSize
                && Double.compare(sharpenSigma, that.sharpenSigma) == 0;
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(sharpnessBandEdges);
        result = 31 * result + Arrays.hashCode(sharpenStrengths);
        result = 31 * result + noisePatchSize;
        result = 31 * result + claheTileGridSize;
        result = 31 * result + Double.hashCode(clipLimitMax);
        result = 31 * result + Double.hashCode(denoiseSkipThreshold);
        return result;
    }

    /**
     * Builder with the documented defaults pre-filled.
     */
    public static final class Builder {
        private double contrastLowPercentile = 1.0;
        private double contrastHighPercentile = 99.0;
        private int noisePatchSize = 40;
        private int noiseMinPatchSize = 4;
        private int laplacianApertureSize = 1;
        private double clipLimitMin = 1.0;
        private double clipLimitMax = 3.0;
        private double contrastReference = 200.0;
        private double claheSkipContrast = 64.0;
        private int claheTileGridSize = 8;
        private int claheMinTileSize = 64;
        private int bilateralDiameter = 5;
        private double bilateralSigmaColor = 10.0;
        private double bilateralSigmaSpace = 10.0;
        private double denoiseSkipThreshold = 0.5;
        private double denoiseGain = 1.0;
        private double denoiseMinStrength = 5.0;
        private double denoiseMaxStrength = 25.0;
        private int denoiseTemplateWindow = 7;
        private int denoiseSearchWindow = 21;
        private double[] sharpnessBandEdges = {20.0, 50.0, 100.0};
        private double[] sharpenStrengths = {2.0, 1.7, 1.1, 0.7};
        private int sharpenKernelSize = 5;
        private double sharpenSigma = 1.2;

        private Builder() {
        }

        public Builder contrastPercentiles(double low, double high) {
            this.contrastLowPercentile = low;
            this.contrastHighPercentile = high;
            return this;
        }

        public Builder noisePatchSize(int size) {
            this.noisePatchSize = size;
            return this;
        }

        public Builder noiseMinPatchSize(int size) {
            this.noiseMinPatchSize = size;
            return this;
        }

        public Builder laplacianApertureSize(int size) {
            this.laplacianApertureSize = size;
            return this;
        }

        public Builder clipLimitRange(double min, double max) {
            this.clipLimitMin = min;
            this.clipLimitMax = max;
            return this;
        }

        public Builder contrastReference(double reference) {
            this.contrastReference = reference;
            return this;
        }

        public Builder claheSkipContrast(double contrast) {
            this.claheSkipContrast = contrast;
            return this;
        }

        public Builder claheTileGridSize(int tiles) {
            this.claheTileGridSize = tiles;
            return this;
        }

        public Builder claheMinTileSize(int pixels) {
            this.claheMinTileSize = pixels;
            return this;
        }

        public Builder bilateral(int diameter, double sigmaColor, double sigmaSpace) {
            this.bilateralDiameter = diameter;
            this.bilateralSigmaColor = sigmaColor;
            this.bilateralSigmaSpace = sigmaSpace;
            return this;
        }

        public Builder denoiseSkipThreshold(double threshold) {
            this.denoiseSkipThreshold = threshold;
            return this;
        }

        public Builder denoiseGain(double gain) {
            this.denoiseGain = gain;
            return this;
        }

        public Builder denoiseStrengthRange(double min, double max) {
            this.denoiseMinStrength = min;
            this.denoiseMaxStrength = max;
            return this;
        }

        public Builder denoiseWindows(int templateWindow, int searchWindow) {
            this.denoiseTemplateWindow = templateWindow;
            this.denoiseSearchWindow = searchWindow;
            return this;
        }

        /**
         * @param edges     ascending band edges
         * @param strengths one strength per band, i.e. {@code edges.length + 1} values
         */
        public Builder sharpenBands(double[] edges, double[] strengths) {
            this.sharpnessBandEdges = edges == null ? null : edges.clone();
            this.sharpenStrengths = strengths == null ? null : strengths.clone();
            return this;
        }

        public Builder sharpenKernel(int kernelSize, double sigma) {
            this.sharpenKernelSize = kernelSize;
            this.sharpenSigma = sigma;
            return this;
        }

        public EnhancementConfig build() {
            validate();
            return new EnhancementConfig(this);
        }

        private void validate() {
            require(contrastLowPercentile >= 0 && contrastHighPercentile <= 100
                            && contrastLowPercentile < contrastHighPercentile,
                    "contrast percentiles must satisfy 0 <= low < high <= 100");
            require(noisePatchSize > 0, "noisePatchSize must be positive");
            require(noiseMinPatchSize > 0 && noiseMinPatchSize <= noisePatchSize,
                    "noiseMinPatchSize must be in 1..noisePatchSize");
            require(laplacianApertureSize == 1 || (laplacianApertureSize % 2 == 1 && laplacianApertureSize <= 31),
                    "laplacianApertureSize must be 1 or an odd value up to 31");
            require(clipLimitMin > 0 && clipLimitMin <= clipLimitMax,
                    "clip limit range must satisfy 0 < min <= max");
            require(contrastReference > 0, "contrastReference must be positive");
            require(claheSkipContrast > 0, "claheSkipContrast must be positive");
            require(claheTileGridSize >= 1, "claheTileGridSize must be at least 1");
            require(claheMinTileSize >= 1, "claheMinTileSize must be at least 1");
            require(bilateralDiameter > 0, "bilateralDiameter must be positive");
            require(bilateralSigmaColor > 0 && bilateralSigmaSpace > 0, "bilateral sigmas must be positive");
            require(denoiseSkipThreshold >= 0, "denoiseSkipThreshold must not be negative");
            require(denoiseGain > 0, "denoiseGain must be positive");
            require(denoiseMinStrength > 0 && denoiseMinStrength <= denoiseMaxStrength,
                    "denoise strength range must satisfy 0 < min <= max");
            require(isOddPositive(denoiseTemplateWindow) && isOddPositive(denoiseSearchWindow),
                    "denoise windows must be odd and positive");
            require(sharpnessBandEdges != null && sharpenStrengths != null,
                    "sharpen bands must not be null");
            require(sharpenStrengths.length == sharpnessBandEdges.length + 1,
                    "need exactly one more sharpen strength than band edges");
            for (int i = 1; i < sharpnessBandEdges.length; i++) {
                require(sharpnessBandEdges[i] > sharpnessBandEdges[i - 1],
                        "sharpness band edges must be strictly ascending");
            }
            for (double strength : sharpenStrengths) {
                require(strength > 0, "sharpen strengths must be positive");
            }
            require(isOddPositive(sharpenKernelSize), "sharpenKernelSize must be odd and positive");
            require(sharpenSigma > 0, "sharpenSigma must be positive");
        }

        private static boolean isOddPositive(int value) {
            return value > 0 && value % 2 == 1;
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new IllegalArgumentException(message);
            }
        }
    }
}
