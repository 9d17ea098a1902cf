package com.ttennebkram.radiograph;

import com.ttennebkram.radiograph.config.EnhancementConfig;
import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.mapping.ParameterMapper;
import com.ttennebkram.radiograph.mapping.StageConfig;
import com.ttennebkram.radiograph.metrics.QualityAnalyzer;
import com.ttennebkram.radiograph.metrics.QualityProfile;
import com.ttennebkram.radiograph.processing.EnhancementPipeline;
import com.ttennebkram.radiograph.processing.StageFailureException;

/**
 * Adaptive enhancement of a single radiograph.
 *
 * The quality profile is measured exactly once from the original image and
 * every stage parameter is derived from it; no stage re-measures an
 * intermediate result. Instances hold no per-image state and can be shared
 * across threads, each thread processing its own image.
 */
public class AdaptiveEnhancer {

    private final QualityAnalyzer analyzer;
    private final ParameterMapper mapper;
    private final EnhancementPipeline pipeline;

    public AdaptiveEnhancer() {
        this(EnhancementConfig.defaults());
    }

    public AdaptiveEnhancer(EnhancementConfig config) {
        this(new QualityAnalyzer(config), new ParameterMapper(config), EnhancementPipeline.standard());
    }

    public AdaptiveEnhancer(QualityAnalyzer analyzer, ParameterMapper mapper, EnhancementPipeline pipeline) {
        if (analyzer == null || mapper == null || pipeline == null) {
            throw new IllegalArgumentException("analyzer, mapper and pipeline are required");
        }
        this.analyzer = analyzer;
        this.mapper = mapper;
        this.pipeline = pipeline;
    }

    /**
     * Measure, map and run the pipeline.
     * Stage failures are returned as a {@link ProcessingFailure}, not thrown.
     */
    public EnhancementResult adaptiveEnhance(Image image) {
        if (image == null) {
            return EnhancementResult.failure(
                    new ProcessingFailure(ProcessingFailure.INPUT_STAGE, "no image supplied", null), null, null);
        }

        QualityProfile profile = analyzer.analyze(image);
        StageConfig stageConfig = mapper.map(profile);
        try {
            EnhancementPipeline.Run run = pipeline.run(image, stageConfig);
            return EnhancementResult.success(run.image, profile, stageConfig, run.appliedStages, run.skippedStages);
        } catch (StageFailureException e) {
            return EnhancementResult.failure(
                    new ProcessingFailure(e.getStageName(), e.getMessage(), e), profile, stageConfig);
        }
    }

    /**
     * Same as {@link #adaptiveEnhance(Image)} but throws on failure.
     *
     * @throws StageFailureException if any stage fails
     */
    public Image enhanceOrThrow(Image image) {
        EnhancementResult result = adaptiveEnhance(image);
        if (!result.isSuccess()) {
            ProcessingFailure failure = result.getFailure();
            if (failure.getCause() instanceof StageFailureException) {
                throw (StageFailureException) failure.getCause();
            }
            throw new StageFailureException(failure.getStageName(), failure.getMessage());
        }
        return result.getImage();
    }

    public QualityAnalyzer getAnalyzer() {
        return analyzer;
    }

    public ParameterMapper getMapper() {
        return mapper;
    }

    public EnhancementPipeline getPipeline() {
        return pipeline;
    }
}
