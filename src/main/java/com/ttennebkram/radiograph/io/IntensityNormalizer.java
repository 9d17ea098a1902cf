package com.ttennebkram.radiograph.io;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.util.MatScope;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Brings decoded samples of any bit depth into the 8-bit range the core works on.
 *
 * Steps: convert colour to gray, apply the modality rescale
 * ({@code value * slope + intercept}), invert MONOCHROME1 data so that bright
 * means dense, then stretch min..max to 0..255. A constant image becomes all
 * zeros.
 */
public class IntensityNormalizer {

    private final double rescaleSlope;
    private final double rescaleIntercept;
    private final boolean invert;

    public IntensityNormalizer() {
        this(1.0, 0.0, false);
    }

    /**
     * @param rescaleSlope     modality rescale slope
     * @param rescaleIntercept modality rescale intercept
     * @param invert           true for MONOCHROME1 data (low values are bright)
     */
    public IntensityNormalizer(double rescaleSlope, double rescaleIntercept, boolean invert) {
        if (!Double.isFinite(rescaleSlope) || rescaleSlope == 0.0 || !Double.isFinite(rescaleIntercept)) {
            throw new IllegalArgumentException("Rescale slope must be finite and non-zero, intercept finite");
        }
        this.rescaleSlope = rescaleSlope;
        this.rescaleIntercept = rescaleIntercept;
        this.invert = invert;
    }

    /**
     * Normalize a decoded Mat of any depth and 1, 3 or 4 channels.
     * The input is not modified.
     */
    public Image normalize(Mat decoded) {
        if (decoded == null || decoded.empty()) {
            throw new IllegalArgumentException("Nothing to normalize: empty input");
        }
        try (MatScope scope = new MatScope()) {
            Mat gray = toGray(decoded, scope);

            Mat samples = scope.create();
            gray.convertTo(samples, CvType.CV_64F, rescaleSlope, rescaleIntercept);

            Core.MinMaxLocResult range = Core.minMaxLoc(samples);
            if (invert) {
                // max - value
                samples.convertTo(samples, -1, -1.0, range.maxVal);
                range = Core.minMaxLoc(samples);
            }

            Mat bytes = scope.create();
            double span = range.maxVal - range.minVal;
            if (span <= 0.0) {
                bytes = scope.track(Mat.zeros(samples.rows(), samples.cols(), CvType.CV_8UC1));
            } else {
                double scale = 255.0 / span;
                samples.convertTo(bytes, CvType.CV_8U, scale, -range.minVal * scale);
            }
            return Image.fromMat(bytes);
        }
    }

    /**
     * Normalize a [row][col] grid of raw samples, e.g. from a decoder that
     * does not produce Mats. Non-finite samples are rejected.
     */
    public Image normalize(double[][] rows) {
        if (rows == null || rows.length == 0 || rows[0] == null || rows[0].length == 0) {
            throw new IllegalArgumentException("Sample grid must be non-empty");
        }
        int height = rows.length;
        int width = rows[0].length;
        double[] flat = new double[width * height];
        for (int r = 0; r < height; r++) {
            if (rows[r] == null || rows[r].length != width) {
                throw new IllegalArgumentException("Row " + r + " is not " + width + " samples wide");
            }
            for (int c = 0; c < width; c++) {
                double v = rows[r][c];
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("Non-finite sample at (" + r + ", " + c + ")");
                }
                flat[r * width + c] = v;
            }
        }
        try (MatScope scope = new MatScope()) {
            Mat mat = scope.track(new Mat(height, width, CvType.CV_64FC1));
            mat.put(0, 0, flat);
            return normalize(mat);
        }
    }

    private static Mat toGray(Mat decoded, MatScope scope) {
        switch (decoded.channels()) {
            case 1:
                return decoded;
            case 3: {
                Mat gray = scope.create();
                Imgproc.cvtColor(decoded, gray, Imgproc.COLOR_BGR2GRAY);
                return gray;
            }
            case 4: {
                Mat gray = scope.create();
                Imgproc.cvtColor(decoded, gray, Imgproc.COLOR_BGRA2GRAY);
                return gray;
            }
            default:
                throw new IllegalArgumentException("Unsupported channel count: " + decoded.channels());
        }
    }

    public double getRescaleSlope() {
        return rescaleSlope;
    }

    public double getRescaleIntercept() {
        return rescaleIntercept;
    }

    public boolean isInvert() {
        return invert;
    }
}
