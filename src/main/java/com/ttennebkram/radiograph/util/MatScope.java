package com.ttennebkram.radiograph.util;

import org.opencv.core.Mat;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Releases every OpenCV Mat registered with it when closed.
 *
 * Usage:
 * <pre>
 * try (MatScope scope = new MatScope()) {
 *     Mat src = scope.track(image.toMat());
 *     Mat dst = scope.create();
 *     Imgproc.GaussianBlur(src, dst, ...);
 *     return Image.fromMat(dst);
 * }
 * </pre>
 *
 * Process-wide counters of tracked and released Mats are kept so tests can
 * check that a computation did not leak native buffers.
 */
public final class MatScope implements AutoCloseable {

    private static final AtomicLong totalTracked = new AtomicLong(0);
    private static final AtomicLong totalReleased = new AtomicLong(0);

    private final Deque<Mat> mats = new ArrayDeque<>();
    private boolean closed;

    /**
     * Create a new empty Mat owned by this scope.
     */
    public Mat create() {
        return track(new Mat());
    }

    /**
     * Take ownership of an existing Mat. Returns the same Mat for chaining.
     */
    public Mat track(Mat mat) {
        if (closed) {
            throw new IllegalStateException("MatScope already closed");
        }
        if (mat != null) {
            mats.push(mat);
            totalTracked.incrementAndGet();
        }
        return mat;
    }

    /**
     * Release all tracked Mats, most recently tracked first.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        while (!mats.isEmpty()) {
            mats.pop().release();
            totalReleased.incrementAndGet();
        }
    }

    /**
     * Mats tracked by any scope and not yet released.
     */
    public static long getActiveCount() {
        return totalTracked.get() - totalReleased.get();
    }

    public static long getTotalTracked() {
        return totalTracked.get();
    }

    public static long getTotalReleased() {
        return totalReleased.get();
    }
}
