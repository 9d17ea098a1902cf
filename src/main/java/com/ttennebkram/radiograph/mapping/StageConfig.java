package com.ttennebkram.radiograph.mapping;

/**
 * Concrete parameters for every enhancement stage of one image.
 * Produced by {@link ParameterMapper} from the image's quality profile; immutable.
 */
public final class StageConfig {

    // Local contrast (CLAHE)
    private final boolean claheSkipped;
    private final double clipLimit;
    private final int claheTileColumns;
    private final int claheTileRows;

    // Edge-preserving smoothing
    private final int bilateralDiameter;
    private final double bilateralSigmaColor;
    private final double bilateralSigmaSpace;

    // Denoising
    private final boolean denoiseSkipped;
    private final double denoiseStrength;
    private final int denoiseTemplateWindow;
    private final int denoiseSearchWindow;

    // Sharpening
    private final double sharpenStrength;
    private final int sharpenKernelSize;
    private final double sharpenSigma;

    public StageConfig(boolean claheSkipped, double clipLimit, int claheTileColumns, int claheTileRows,
                       int bilateralDiameter, double bilateralSigmaColor, double bilateralSigmaSpace,
                       boolean denoiseSkipped, double denoiseStrength,
                       int denoiseTemplateWindow, int denoiseSearchWindow,
                       double sharpenStrength, int sharpenKernelSize, double sharpenSigma) {
        this.claheSkipped = claheSkipped;
        this.clipLimit = clipLimit;
        this.claheTileColumns = claheTileColumns;
        this.claheTileRows = claheTileRows;
        this.bilateralDiameter = bilateralDiameter;
        this.bilateralSigmaColor = bilateralSigmaColor;
        this.bilateralSigmaSpace = bilateralSigmaSpace;
        this.denoiseSkipped = denoiseSkipped;
        this.denoiseStrength = denoiseStrength;
        this.denoiseTemplateWindow = denoiseTemplateWindow;
        this.denoiseSearchWindow = denoiseSearchWindow;
        this.sharpenStrength = sharpenStrength;
        this.sharpenKernelSize = sharpenKernelSize;
        this.sharpenSigma = sharpenSigma;
    }

    /**
     * True when the image already had balanced contrast; the CLAHE stage then
     * passes its input through untouched.
     */
    public boolean isClaheSkipped() {
        return claheSkipped;
    }

    public double getClipLimit() {
        return clipLimit;
    }

    public int getClaheTileColumns() {
        return claheTileColumns;
    }

    public int getClaheTileRows() {
        return claheTileRows;
    }

    public int getBilateralDiameter() {
        return bilateralDiameter;
    }

    public double getBilateralSigmaColor() {
        return bilateralSigmaColor;
    }

    public double getBilateralSigmaSpace() {
        return bilateralSigmaSpace;
    }

    /**
     * True when the noise level was below the skip threshold; the denoise stage
     * then passes its input through untouched.
     */
    public boolean isDenoiseSkipped() {
        return denoiseSkipped;
    }

    /**
     * Filter strength h for non-local means; 0 when skipped.
     */
    public double getDenoiseStrength() {
        return denoiseStrength;
    }

    public int getDenoiseTemplateWindow() {
        return denoiseTemplateWindow;
    }

    public int getDenoiseSearchWindow() {
        return denoiseSearchWindow;
    }

    public double getSharpenStrength() {
        return sharpenStrength;
    }

    public int getSharpenKernelSize() {
        return sharpenKernelSize;
    }

    public double getSharpenSigma() {
        return sharpenSigma;
    }

    @Override
    public String toString() {
        return String.format("StageConfig{clahe=%s, tiles=%dx%d, bilateral=(%d, %.1f, %.1f), denoise=%s, sharpen=%.2f}",
                claheSkipped ? "skipped" : String.format("%.2f", clipLimit), claheTileColumns, claheTileRows,
                bilateralDiameter, bilateralSigmaColor, bilateralSigmaSpace,
                denoiseSkipped ? "skipped" : String.format("%.2f", denoiseStrength),
                sharpenStrength);
    }
}
