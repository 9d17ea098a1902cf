package com.ttennebkram.radiograph.processing;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.mapping.StageConfig;
import com.ttennebkram.radiograph.util.MatScope;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;

/**
 * CLAHE (Contrast Limited Adaptive Histogram Equalization) stage.
 * Enhances local contrast while the clip limit caps noise amplification.
 * Skipped for images whose contrast was already balanced; even the lowest
 * clip limit still stretches a narrow histogram.
 */
@StageInfo(name = "CLAHE",
        description = "Contrast Limited Adaptive Histogram Equalization\nImgproc.createCLAHE(clipLimit, tileGridSize)")
public class ClaheStage extends StageBase {

    @Override
    public boolean isSkipped(StageConfig config) {
        return config.isClaheSkipped();
    }

    @Override
    protected void validate(Image input, StageConfig config) {
        if (!(config.getClipLimit() > 0)) {
            throw failure("clip limit must be positive, got " + config.getClipLimit());
        }
        if (config.getClaheTileColumns() < 1 || config.getClaheTileRows() < 1) {
            throw failure("tile grid must be at least 1x1, got "
                    + config.getClaheTileColumns() + "x" + config.getClaheTileRows());
        }
    }

    @Override
    protected Mat process(Mat input, StageConfig config, MatScope scope) {
        CLAHE clahe = Imgproc.createCLAHE(config.getClipLimit(),
                new Size(config.getClaheTileColumns(), config.getClaheTileRows()));
        Mat output = scope.create();
        clahe.apply(input, output);
        return output;
    }
}
