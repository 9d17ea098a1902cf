package com.ttennebkram.radiograph;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.mapping.StageConfig;
import com.ttennebkram.radiograph.metrics.QualityProfile;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link AdaptiveEnhancer#adaptiveEnhance(Image)}: either the
 * enhanced image or a {@link ProcessingFailure}, never a partial image.
 */
public final class EnhancementResult {

    private final Image image;
    private final ProcessingFailure failure;
    private final QualityProfile profile;
    private final StageConfig stageConfig;
    private final List<String> appliedStages;
    private final List<String> skippedStages;

    private EnhancementResult(Image image, ProcessingFailure failure, QualityProfile profile,
                              StageConfig stageConfig, List<String> appliedStages, List<String> skippedStages) {
        this.image = image;
        this.failure = failure;
        this.profile = profile;
        this.stageConfig = stageConfig;
        this.appliedStages = appliedStages;
        this.skippedStages = skippedStages;
    }

    public static EnhancementResult success(Image image, QualityProfile profile, StageConfig stageConfig,
                                            List<String> appliedStages, List<String> skippedStages) {
        if (image == null) {
            throw new IllegalArgumentException("A successful result needs an image");
        }
        return new EnhancementResult(image, null, profile, stageConfig,
                List.copyOf(appliedStages), List.copyOf(skippedStages));
    }

    /**
     * @param profile     profile measured before the failure, or null if the input was unusable
     * @param stageConfig config in use when the failure happened, or null
     */
    public static EnhancementResult failure(ProcessingFailure failure, QualityProfile profile, StageConfig stageConfig) {
        if (failure == null) {
            throw new IllegalArgumentException("A failed result needs a failure");
        }
        return new EnhancementResult(null, failure, profile, stageConfig,
                Collections.emptyList(), Collections.emptyList());
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * The enhanced image.
     *
     * @throws IllegalStateException if processing failed
     */
    public Image getImage() {
        if (image == null) {
            throw new IllegalStateException("No image: " + failure);
        }
        return image;
    }

    /**
     * The failure, or null on success.
     */
    public ProcessingFailure getFailure() {
        return failure;
    }

    public QualityProfile getProfile() {
        return profile;
    }

    public StageConfig getStageConfig() {
        return stageConfig;
    }

    public List<String> getAppliedStages() {
        return appliedStages;
    }

    public List<String> getSkippedStages() {
        return skippedStages;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "EnhancementResult{success, applied=" + appliedStages + ", skipped=" + skippedStages + "}"
                : "EnhancementResult{" + failure + "}";
    }
}
