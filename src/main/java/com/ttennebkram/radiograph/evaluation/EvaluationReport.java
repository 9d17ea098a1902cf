package com.ttennebkram.radiograph.evaluation;

import com.ttennebkram.radiograph.image.Image;
import com.ttennebkram.radiograph.metrics.QualityAnalyzer;
import com.ttennebkram.radiograph.metrics.QualityProfile;

/**
 * Before/after comparison of an enhancement, for reporting only.
 */
public final class EvaluationReport {

    private final QualityProfile before;
    private final QualityProfile after;
    private final double psnr;
    private final double ssim;

    public EvaluationReport(QualityProfile before, QualityProfile after, double psnr, double ssim) {
        this.before = before;
        this.after = after;
        this.psnr = psnr;
        this.ssim = ssim;
    }

    /**
     * Measure both images with the same analyzer and score their similarity.
     */
    public static EvaluationReport compare(Image original, Image processed, QualityAnalyzer analyzer) {
        return new EvaluationReport(
                analyzer.analyze(original),
                analyzer.analyze(processed),
                ImageComparison.psnr(original, processed),
                ImageComparison.ssim(original, processed));
    }

    public QualityProfile getBefore() {
        return before;
    }

    public QualityProfile getAfter() {
        return after;
    }

    public double getPsnr() {
        return psnr;
    }

    public double getSsim() {
        return ssim;
    }

    /**
     * Multi-line text table of the metrics.
     */
    public String summary() {
        StringBuilder report = new StringBuilder();
        report.append("Enhancement Report\n");
        report.append("==================\n");
        report.append(String.format("%-12s %10s %10s%n", "metric", "before", "after"));
        report.append(String.format("%-12s %10.2f %10.2f%n", "contrast", before.getContrast(), after.getContrast()));
        report.append(String.format("%-12s %10.2f %10.2f%n", "brightness", before.getBrightness(), after.getBrightness()));
        report.append(String.format("%-12s %10.2f %10.2f%n", "sharpness", before.getSharpness(), after.getSharpness()));
        report.append(String.format("%-12s %10.3f %10.3f%n", "noise", before.getNoiseLevel(), after.getNoiseLevel()));
        report.append(String.format("PSNR: %s%n", Double.isInfinite(psnr) ? "inf" : String.format("%.2f dB", psnr)));
        report.append(String.format("SSIM: %.4f%n", ssim));
        return report.toString();
    }

    @Override
    public String toString() {
        return String.format("EvaluationReport{psnr=%.2f, ssim=%.4f}", psnr, ssim);
    }
}
