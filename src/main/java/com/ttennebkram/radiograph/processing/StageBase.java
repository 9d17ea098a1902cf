package com.ttennebkram.radiograph.processing;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.mapping.StageConfig;
import com.ttennebkram.radiograph.util.MatScope;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Base class for OpenCV-backed stages.
 *
 * Handles the Image to Mat round trip, validates inputs, releases native
 * buffers and turns OpenCV errors into {@link StageFailureException}s.
 * Subclasses implement {@link #process(Mat, StageConfig, MatScope)}.
 */
public abstract class StageBase implements EnhancementStage {

    @Override
    public String getName() {
        StageInfo info = getClass().getAnnotation(StageInfo.class);
        return info != null ? info.name() : getClass().getSimpleName();
    }

    public String getDescription() {
        StageInfo info = getClass().getAnnotation(StageInfo.class);
        return info != null ? info.description() : "";
    }

    @Override
    public final Image apply(Image input, StageConfig config) {
        if (input == null) {
            throw new StageFailureException(getName(), "no input image");
        }
        if (config == null) {
            throw new StageFailureException(getName(), "no stage configuration");
        }
        if (isSkipped(config)) {
            return input;
        }
        validate(input, config);

        try (MatScope scope = new MatScope()) {
            Mat src = scope.track(input.toMat());
            if (isInvalidInput(src)) {
                throw new StageFailureException(getName(), "expected a non-empty 8-bit single-channel image, got "
                        + CvType.typeToString(src.type()));
            }
            Mat output = process(src, config, scope);
            return Image.fromMat(output);
        } catch (CvException e) {
            throw new StageFailureException(getName(), "OpenCV rejected the input: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new StageFailureException(getName(), e.getMessage(), e);
        }
    }

    /**
     * Check stage parameters against the input before any native call.
     * Throw a StageFailureException to reject.
     */
    protected void validate(Image input, StageConfig config) {
    }

    /**
     * Run the OpenCV operation. Mats allocated here should be tracked by the
     * scope; the returned Mat may be tracked too, it is copied before release.
     */
    protected abstract Mat process(Mat input, StageConfig config, MatScope scope);

    protected boolean isInvalidInput(Mat input) {
        return input == null || input.empty() || input.type() != CvType.CV_8UC1;
    }

    protected StageFailureException failure(String message) {
        return new StageFailureException(getName(), message);
    }
}
