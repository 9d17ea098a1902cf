package com.ttennebkram.radiograph.processing;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.mapping.StageConfig;
import com.ttennebkram.radiograph.util.MatScope;
import org.opencv.core.Mat;
import org.opencv.photo.Photo;

/**
 * Non-local means denoising stage.
 * Passes the input through untouched when the measured noise was below the
 * skip threshold, so clean images keep their fine detail.
 */
@StageInfo(name = "Denoise",
        description = "Non-Local Means Denoising\nPhoto.fastNlMeansDenoising(src, dst, h, templateWindowSize, searchWindowSize)")
public class DenoiseStage extends StageBase {

    @Override
    public boolean isSkipped(StageConfig config) {
        return config.isDenoiseSkipped();
    }

    @Override
    protected void validate(Image input, StageConfig config) {
        if (!(config.getDenoiseStrength() > 0)) {
            throw failure("filter strength must be positive, got " + config.getDenoiseStrength());
        }
        if (config.getDenoiseTemplateWindow() % 2 == 0 || config.getDenoiseSearchWindow() % 2 == 0
                || config.getDenoiseTemplateWindow() <= 0 || config.getDenoiseSearchWindow() <= 0) {
            throw failure("template and search windows must be odd and positive");
        }
    }

    @Override
    protected Mat process(Mat input, StageConfig config, MatScope scope) {
        Mat output = scope.create();
        Photo.fastNlMeansDenoising(input, output, (float) config.getDenoiseStrength(),
                config.getDenoiseTemplateWindow(), config.getDenoiseSearchWindow());
        return output;
    }
}
