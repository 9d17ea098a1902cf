package com.ttennebkram.radiograph.processing;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.mapping.StageConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs enhancement stages strictly in sequence, each one consuming the
 * previous stage's output. All stages share the single StageConfig computed
 * from the original image.
 *
 * The standard order is local contrast, edge-preserving smoothing,
 * denoising, then sharpening, so sharpening works on the already denoised
 * result.
 */
public class EnhancementPipeline {

    private final List<EnhancementStage> stages;

    public EnhancementPipeline(List<? extends EnhancementStage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one stage");
        }
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
    }

    /**
     * CLAHE, bilateral filter, non-local means denoising, unsharp mask.
     */
    public static EnhancementPipeline standard() {
        return new EnhancementPipeline(List.of(
                new ClaheStage(),
                new BilateralFilterStage(),
                new DenoiseStage(),
                new SharpenStage()));
    }

    /**
     * Run every stage in order.
     *
     * @throws StageFailureException from the first stage that fails; no partial
     *                               result is returned in that case
     */
    public Run run(Image input, StageConfig config) {
        List<String> applied = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        Image current = input;
        for (EnhancementStage stage : stages) {
            if (stage.isSkipped(config)) {
                skipped.add(stage.getName());
                continue;
            }
            current = stage.apply(current, config);
            if (current == null) {
                throw new StageFailureException(stage.getName(), "stage produced no image");
            }
            applied.add(stage.getName());
        }
        return new Run(current, applied, skipped);
    }

    public List<EnhancementStage> getStages() {
        return stages;
    }

    /**
     * Output of a successful pipeline run.
     */
    public static class Run {
        public final Image image;
        public final List<String> appliedStages;
        public final List<String> skippedStages;

        public Run(Image image, List<String> appliedStages, List<String> skippedStages) {
            this.image = image;
            this.appliedStages = Collections.unmodifiableList(new ArrayList<>(appliedStages));
            this.skippedStages = Collections.unmodifiableList(new ArrayList<>(skippedStages));
        }
    }
}
