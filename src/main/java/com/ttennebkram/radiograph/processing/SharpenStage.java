package com.ttennebkram.radiograph.processing;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.mapping.StageConfig;
import com.ttennebkram.radiograph.util.MatScope;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Unsharp masking stage.
 * output = input * s + gaussian * (1 - s); s above 1 sharpens, below 1 softens.
 */
@StageInfo(name = "Sharpen",
        description = "Unsharp mask\nCore.addWeighted(src, s, GaussianBlur(src), 1 - s, 0, dst)")
public class SharpenStage extends StageBase {

    @Override
    public boolean isSkipped(StageConfig config) {
        return config.getSharpenStrength() == 1.0;
    }

    @Override
    protected void validate(Image input, StageConfig config) {
        int ksize = config.getSharpenKernelSize();
        if (ksize <= 0 || ksize % 2 == 0) {
            throw failure("kernel size must be odd and positive, got " + ksize);
        }
        if (!(config.getSharpenSigma() > 0)) {
            throw failure("sigma must be positive, got " + config.getSharpenSigma());
        }
        if (!(config.getSharpenStrength() > 0)) {
            throw failure("strength must be positive, got " + config.getSharpenStrength());
        }
    }

    @Override
    protected Mat process(Mat input, StageConfig config, MatScope scope) {
        int ksize = config.getSharpenKernelSize();
        double strength = config.getSharpenStrength();

        Mat blurred = scope.create();
        Imgproc.GaussianBlur(input, blurred, new Size(ksize, ksize), config.getSharpenSigma());

        Mat output = scope.create();
        Core.addWeighted(input, strength, blurred, 1.0 - strength, 0, output);
        return output;
    }
}
