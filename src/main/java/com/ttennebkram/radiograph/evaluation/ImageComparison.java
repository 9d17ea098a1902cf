package com.ttennebkram.radiograph.evaluation;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.util.MatScope;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Similarity scores between two images of the same shape.
 * Both functions are symmetric and have no side effects.
 */
public final class ImageComparison {

    private static final double MAX_VALUE = 255.0;
    private static final double C1 = (0.01 * MAX_VALUE) * (0.01 * MAX_VALUE);
    private static final double C2 = (0.03 * MAX_VALUE) * (0.03 * MAX_VALUE);
    private static final Size SSIM_WINDOW = new Size(11, 11);
    private static final double SSIM_SIGMA = 1.5;

    private ImageComparison() {
    }

    /**
     * Peak signal-to-noise ratio in dB; infinite for identical images.
     */
    public static double psnr(Image a, Image b) {
        requireSameShape(a, b);
        try (MatScope scope = new MatScope()) {
            Mat ma = scope.track(a.toMat());
            Mat mb = scope.track(b.toMat());
            double l2 = Core.norm(ma, mb, Core.NORM_L2);
            double mse = (l2 * l2) / a.getPixelCount();
            if (mse == 0.0) {
                return Double.POSITIVE_INFINITY;
            }
            return 10.0 * Math.log10((MAX_VALUE * MAX_VALUE) / mse);
        }
    }

    /**
     * Mean structural similarity over 11x11 Gaussian windows (sigma 1.5).
     * 1.0 for identical images.
     */
    public static double ssim(Image a, Image b) {
        requireSameShape(a, b);
        try (MatScope scope = new MatScope()) {
            Mat i1 = toDouble(a, scope);
            Mat i2 = toDouble(b, scope);

            Mat i1Sq = scope.track(i1.mul(i1));
            Mat i2Sq = scope.track(i2.mul(i2));
            Mat i1i2 = scope.track(i1.mul(i2));

            Mat mu1 = blur(i1, scope);
            Mat mu2 = blur(i2, scope);
            Mat mu1Sq = scope.track(mu1.mul(mu1));
            Mat mu2Sq = scope.track(mu2.mul(mu2));
            Mat mu1mu2 = scope.track(mu1.mul(mu2));

            Mat sigma1Sq = scope.create();
            Core.subtract(blur(i1Sq, scope), mu1Sq, sigma1Sq);
            Mat sigma2Sq = scope.create();
            Core.subtract(blur(i2Sq, scope), mu2Sq, sigma2Sq);
            Mat sigma12 = scope.create();
            Core.subtract(blur(i1i2, scope), mu1mu2, sigma12);

            // (2 mu1 mu2 + C1)(2 sigma12 + C2)
            Mat t1 = scope.create();
            Core.multiply(mu1mu2, new Scalar(2.0), t1);
            Core.add(t1, new Scalar(C1), t1);
            Mat t2 = scope.create();
            Core.multiply(sigma12, new Scalar(2.0), t2);
            Core.add(t2, new Scalar(C2), t2);
            Mat numerator = scope.track(t1.mul(t2));

            // (mu1^2 + mu2^2 + C1)(sigma1^2 + sigma2^2 + C2)
            Mat d1 = scope.create();
            Core.add(mu1Sq, mu2Sq, d1);
            Core.add(d1, new Scalar(C1), d1);
            Mat d2 = scope.create();
            Core.add(sigma1Sq, sigma2Sq, d2);
            Core.add(d2, new Scalar(C2), d2);
            Mat denominator = scope.track(d1.mul(d2));

            Mat ssimMap = scope.create();
            Core.divide(numerator, denominator, ssimMap);
            return Core.mean(ssimMap).val[0];
        }
    }

    private static Mat toDouble(Image image, MatScope scope) {
        Mat src = scope.track(image.toMat());
        Mat dst = scope.create();
        src.convertTo(dst, CvType.CV_64F);
        return dst;
    }

    private static Mat blur(Mat src, MatScope scope) {
        Mat dst = scope.create();
        Imgproc.GaussianBlur(src, dst, SSIM_WINDOW, SSIM_SIGMA);
        return dst;
    }

    private static void requireSameShape(Image a, Image b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Both images are required");
        }
        if (!a.sameShape(b)) {
            throw new IllegalArgumentException("Images differ in shape: "
                    + a.getWidth() + "x" + a.getHeight() + " vs " + b.getWidth() + "x" + b.getHeight());
        }
    }
}
