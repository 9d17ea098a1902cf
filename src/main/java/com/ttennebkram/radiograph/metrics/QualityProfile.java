package com.ttennebkram.radiograph.metrics;

/**
 * Quality metrics measured once from the original image.
 * All stage configurations for that image are derived from this profile.
 */
public final class QualityProfile {

    private final double contrast;
    private final double noiseLevel;
    private final double sharpness;
    private final double brightness;
    private final int width;
    private final int height;
    private final boolean undersized;

    public QualityProfile(double contrast, double noiseLevel, double sharpness, double brightness,
                          int width, int height, boolean undersized) {
        this.contrast = contrast;
        this.noiseLevel = noiseLevel;
        this.sharpness = sharpness;
        this.brightness = brightness;
        this.width = width;
        this.height = height;
        this.undersized = undersized;
    }

    public double getContrast() {
        return contrast;
    }

    public double getNoiseLevel() {
        return noiseLevel;
    }

    public double getSharpness() {
        return sharpness;
    }

    public double getBrightness() {
        return brightness;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * True when the image was too small for the standard noise patch layout.
     */
    public boolean isUndersized() {
        return undersized;
    }

    @Override
    public String toString() {
        return String.format("QualityProfile{contrast=%.2f, noise=%.3f, sharpness=%.2f, brightness=%.2f, %dx%d%s}",
                contrast, noiseLevel, sharpness, brightness, width, height, undersized ? ", undersized" : "");
    }
}
