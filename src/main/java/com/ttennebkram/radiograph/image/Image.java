package com.ttennebkram.radiograph.image;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.Arrays;

/**
 * Immutable 8-bit single-channel intensity image.
 *
 * Samples are stored row-major as unsigned bytes. Every stage of the
 * enhancement pipeline produces a new Image; nothing ever writes into an
 * existing one, so measurements taken before and after a stage always refer
 * to distinct values.
 *
 * Conversion to and from OpenCV goes through {@link #toMat()} and
 * {@link #fromMat(Mat)}; both copy, so no native buffer is shared with an Image.
 */
public final class Image {

    private final int width;
    private final int height;
    private final byte[] pixels;

    private Image(int width, int height, byte[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * Create an image from raw unsigned 8-bit samples (row-major).
     * The array is copied.
     */
    public static Image fromGray(int width, int height, byte[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image must have at least one row and column, got "
                    + width + "x" + height);
        }
        if (pixels == null || pixels.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " samples for "
                    + width + "x" + height + " image, got " + (pixels == null ? "null" : pixels.length));
        }
        return new Image(width, height, pixels.clone());
    }

    /**
     * Create an image from a rectangular grid of intensities indexed [row][col].
     * Values outside 0..255 are clamped.
     */
    public static Image fromIntensities(int[][] rows) {
        if (rows == null || rows.length == 0 || rows[0] == null || rows[0].length == 0) {
            throw new IllegalArgumentException("Intensity grid must be non-empty");
        }
        int height = rows.length;
        int width = rows[0].length;
        byte[] data = new byte[width * height];
        for (int r = 0; r < height; r++) {
            if (rows[r] == null || rows[r].length != width) {
                throw new IllegalArgumentException("Row " + r + " has "
                        + (rows[r] == null ? 0 : rows[r].length) + " samples, expected " + width);
            }
            for (int c = 0; c < width; c++) {
                data[r * width + c] = (byte) clampToByte(rows[r][c]);
            }
        }
        return new Image(width, height, data);
    }

    /**
     * Copy an OpenCV Mat into a new Image.
     * 8-bit 3 or 4 channel input is converted to grayscale; other depths are rejected.
     */
    public static Image fromMat(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException("Cannot create an image from an empty Mat");
        }
        if (mat.dims() != 2) {
            throw new IllegalArgumentException("Expected a 2-D Mat, got " + mat.dims() + " dimensions");
        }
        if (mat.depth() != CvType.CV_8U) {
            throw new IllegalArgumentException("Expected 8-bit samples, got " + CvType.typeToString(mat.type()));
        }

        Mat gray;
        switch (mat.channels()) {
            case 1:
                gray = mat;
                break;
            case 3:
                gray = new Mat();
                Imgproc.cvtColor(mat, gray, Imgproc.COLOR_BGR2GRAY);
                break;
            case 4:
                gray = new Mat();
                Imgproc.cvtColor(mat, gray, Imgproc.COLOR_BGRA2GRAY);
                break;
            default:
                throw new IllegalArgumentException("Unsupported channel count: " + mat.channels());
        }

        try {
            Mat continuous = gray.isContinuous() ? gray : gray.clone();
            byte[] data = new byte[(int) continuous.total()];
            continuous.get(0, 0, data);
            if (continuous != gray) {
                continuous.release();
            }
            return new Image(gray.cols(), gray.rows(), data);
        } finally {
            if (gray != mat) {
                gray.release();
            }
        }
    }

    /**
     * Copy this image into a new CV_8UC1 Mat. The caller owns and releases it.
     */
    public Mat toMat() {
        Mat mat = new Mat(height, width, CvType.CV_8UC1);
        mat.put(0, 0, pixels);
        return mat;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return pixels.length;
    }

    /**
     * Intensity at (row, col) in 0..255.
     */
    public int get(int row, int col) {
        if (row < 0 || row >= height || col < 0 || col >= width) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside "
                    + width + "x" + height + " image");
        }
        return pixels[row * width + col] & 0xFF;
    }

    /**
     * Copy of the raw row-major samples.
     */
    public byte[] toBytes() {
        return pixels.clone();
    }

    /**
     * Copy of the samples as a [row][col] grid of 0..255 values.
     */
    public int[][] toIntensities() {
        int[][] rows = new int[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                rows[r][c] = pixels[r * width + c] & 0xFF;
            }
        }
        return rows;
    }

    public boolean sameShape(Image other) {
        return other != null && other.width == width && other.height == height;
    }

    private static int clampToByte(int value) {
        return Math.max(0, Math.min(255, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Image)) return false;
        Image other = (Image) o;
        return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "Image{" + width + "x" + height + "}";
    }
}
