package com.ttennebkram.radiograph.metrics;

/**
 * Result of a noise estimate.
 */
public final class NoiseEstimate {

    public final double level;
    public final int patchSize;
    public final boolean undersized;

    public NoiseEstimate(double level, int patchSize, boolean undersized) {
        this.level = level;
        this.patchSize = patchSize;
        this.undersized = undersized;
    }

    @Override
    public String toString() {
        return String.format("NoiseEstimate{level=%.3f, patchSize=%d, undersized=%s}", level, patchSize, undersized);
    }
}
