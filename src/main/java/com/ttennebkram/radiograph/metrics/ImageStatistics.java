package com.ttennebkram.radiograph.metrics;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.util.MatScope;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.imgproc.Imgproc;

/**
 * Pure measurement functions over a single image.
 * None of them depend on image size beyond averaging, so the same
 * thresholds apply across resolutions.
 */
public final class ImageStatistics {

    private ImageStatistics() {
    }

    /**
     * Arithmetic mean of all samples.
     */
    public static double brightness(Image image) {
        long sum = 0;
        for (byte b : image.toBytes()) {
            sum += b & 0xFF;
        }
        return (double) sum / image.getPixelCount();
    }

    /**
     * Spread between the high and low percentiles of the intensity distribution.
     */
    public static double contrast(Image image, double lowPercentile, double highPercentile) {
        int[] histogram = histogram(image);
        return percentile(histogram, image.getPixelCount(), highPercentile)
                - percentile(histogram, image.getPixelCount(), lowPercentile);
    }

    /**
     * Variance of the Laplacian response. Near zero for a blurred or flat image.
     *
     * @param apertureSize OpenCV Laplacian aperture; 1 uses the 3x3 cross kernel
     */
    public static double sharpness(Image image, int apertureSize) {
        try (MatScope scope = new MatScope()) {
            Mat src = scope.track(image.toMat());
            Mat laplacian = scope.create();
            Imgproc.Laplacian(src, laplacian, CvType.CV_64F, apertureSize);
            double stdDev = stdDev(laplacian, scope);
            return stdDev * stdDev;
        }
    }

    /**
     * Variance that unit white noise adds to {@link #sharpness}: the sum of the
     * squared coefficients of the Laplacian kernel OpenCV uses for the aperture.
     */
    public static double laplacianNoiseGain(int apertureSize) {
        if (apertureSize == 1) {
            // 3x3 cross: four 1s around a -4
            return 20.0;
        }
        double[] smooth = binomial(apertureSize - 1);
        double[] second = convolve(binomial(apertureSize - 3), new double[]{1, -2, 1});
        double sum = 0;
        for (int i = 0; i < apertureSize; i++) {
            for (int j = 0; j < apertureSize; j++) {
                double k = second[i] * smooth[j] + smooth[i] * second[j];
                sum += k * k;
            }
        }
        return sum;
    }

    private static double[] binomial(int order) {
        double[] row = {1};
        for (int i = 0; i < order; i++) {
            row = convolve(row, new double[]{1, 1});
        }
        return row;
    }

    private static double[] convolve(double[] a, double[] b) {
        double[] out = new double[a.length + b.length - 1];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < b.length; j++) {
                out[i + j] += a[i] * b[j];
            }
        }
        return out;
    }

    /**
     * Population standard deviation of the samples of a Mat.
     */
    static double stdDev(Mat mat, MatScope scope) {
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble stdDev = new MatOfDouble();
        scope.track(mean);
        scope.track(stdDev);
        Core.meanStdDev(mat, mean, stdDev);
        return stdDev.toArray()[0];
    }

    /**
     * 256-bin histogram of the samples.
     */
    public static int[] histogram(Image image) {
        int[] histogram = new int[256];
        for (byte b : image.toBytes()) {
            histogram[b & 0xFF]++;
        }
        return histogram;
    }

    /**
     * Percentile with linear interpolation between the two closest ranks,
     * computed from a histogram of {@code count} samples.
     *
     * @param q percentile in 0..100
     */
    public static double percentile(int[] histogram, int count, double q) {
        if (count <= 0) {
            throw new IllegalArgumentException("Percentile of an empty sample set");
        }
        double rank = (q / 100.0) * (count - 1);
        int lowerRank = (int) Math.floor(rank);
        int upperRank = Math.min(lowerRank + 1, count - 1);
        double fraction = rank - lowerRank;

        int lower = valueAtRank(histogram, lowerRank);
        int upper = valueAtRank(histogram, upperRank);
        return lower + fraction * (upper - lower);
    }

    // Value of the k-th smallest sample (0-based)
    private static int valueAtRank(int[] histogram, int k) {
        int cumulative = 0;
        for (int value = 0; value < histogram.length; value++) {
            cumulative += histogram[value];
            if (cumulative > k) {
                return value;
            }
        }
        return histogram.length - 1;
    }
}
