package com.ttennebkram.radiograph.io;

import com.ttennebkram.radiograph.image.Image;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes enhanced images as PNG named {@code <input name>_processed.png}.
 */
public class RadiographWriter {

    public static final String OUTPUT_SUFFIX = "_processed";

    private final Path outputDirectory;

    /**
     * @param outputDirectory where to write, or null to write next to each input
     */
    public RadiographWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public Path outputPathFor(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        Path dir = outputDirectory != null ? outputDirectory : input.toAbsolutePath().getParent();
        return dir.resolve(stem + OUTPUT_SUFFIX + ".png");
    }

    /**
     * Write the image for the given input and return the path written.
     */
    public Path write(Image image, Path input) throws IOException {
        Path target = outputPathFor(input);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Mat mat = image.toMat();
        try {
            if (!Imgcodecs.imwrite(target.toString(), mat)) {
                throw new IOException("Could not write " + target);
            }
        } finally {
            mat.release();
        }
        return target;
    }
}
