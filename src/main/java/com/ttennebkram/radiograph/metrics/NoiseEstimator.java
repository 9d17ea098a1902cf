package com.ttennebkram.radiograph.metrics;

import com.ttennebkram.radiograph.image.Image;

/**
 * Estimates acquisition noise of an image.
 *
 * The default implementation assumes corners and edge midpoints are
 * background; deployments where that does not hold can plug in another
 * estimator without touching the mapper or the stages.
 */
@FunctionalInterface
public interface NoiseEstimator {

    /**
     * Estimate the noise of an image. Must not throw for small or flat images;
     * return a degraded estimate flagged as undersized instead.
     */
    NoiseEstimate estimate(Image image);
}
