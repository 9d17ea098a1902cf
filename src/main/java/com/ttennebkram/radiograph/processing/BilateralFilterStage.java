package com.ttennebkram.radiograph.processing;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.mapping.StageConfig;
import com.ttennebkram.radiograph.util.MatScope;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Bilateral filter stage.
 * Edge-preserving smoothing - reduces noise while keeping edges sharp.
 */
@StageInfo(name = "BilateralFilter",
        description = "Bilateral Filter (Edge-Preserving)\nImgproc.bilateralFilter(src, dst, d, sigmaColor, sigmaSpace)")
public class BilateralFilterStage extends StageBase {

    @Override
    protected void validate(Image input, StageConfig config) {
        if (config.getBilateralDiameter() <= 0) {
            throw failure("diameter must be positive, got " + config.getBilateralDiameter());
        }
        if (!(config.getBilateralSigmaColor() > 0) || !(config.getBilateralSigmaSpace() > 0)) {
            throw failure("sigmas must be positive");
        }
    }

    @Override
    protected Mat process(Mat input, StageConfig config, MatScope scope) {
        Mat output = scope.create();
        Imgproc.bilateralFilter(input, output, config.getBilateralDiameter(),
                config.getBilateralSigmaColor(), config.getBilateralSigmaSpace());
        return output;
    }
}
