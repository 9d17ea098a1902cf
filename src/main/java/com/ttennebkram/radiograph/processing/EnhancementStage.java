package com.ttennebkram.radiograph.processing;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.mapping.StageConfig;

/**
 * One step of the enhancement pipeline.
 *
 * A stage is a pure transform: it reads its parameters from the StageConfig
 * computed up front for the whole image and never from the image it is given.
 */
public interface EnhancementStage {

    /**
     * Stage name used in failure reports (e.g. "CLAHE", "Denoise").
     */
    String getName();

    /**
     * Whether this stage would pass its input through unchanged for the given config.
     */
    default boolean isSkipped(StageConfig config) {
        return false;
    }

    /**
     * Apply the stage.
     *
     * @param input  image produced by the previous stage (not modified)
     * @param config parameters for this image
     * @return a new image
     * @throws StageFailureException if the stage cannot process the input
     */
    Image apply(Image input, StageConfig config);
}
