package com.ttennebkram.radiograph.io;

import com.ttennebkram.radiograph.image.Image;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Decodes raster files into normalized 8-bit images.
 * Files are read at their native bit depth and then passed through an
 * {@link IntensityNormalizer}.
 */
public class RadiographReader {

    private static final Logger log = LoggerFactory.getLogger(RadiographReader.class);

    public static final Set<String> SUPPORTED_EXTENSIONS =
            Set.of("png", "tif", "tiff", "jpg", "jpeg", "bmp", "pgm");

    private final IntensityNormalizer normalizer;

    public RadiographReader(IntensityNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public Image read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("File not found: " + path);
        }
        Mat decoded = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_ANYDEPTH | Imgcodecs.IMREAD_ANYCOLOR);
        try {
            if (decoded.empty()) {
                throw new IOException("Could not decode " + path);
            }
            log.debug("Decoded {} as {}x{} {}", path, decoded.cols(), decoded.rows(),
                    CvType.typeToString(decoded.type()));
            return normalizer.normalize(decoded);
        } catch (IllegalArgumentException e) {
            throw new IOException("Unusable image data in " + path + ": " + e.getMessage(), e);
        } finally {
            decoded.release();
        }
    }

    public static boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && SUPPORTED_EXTENSIONS.contains(name.substring(dot + 1));
    }

    /**
     * Expand directories into their supported files (not recursive, sorted by
     * name). Plain file arguments are kept as given.
     */
    public static List<Path> expand(List<Path> arguments) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path argument : arguments) {
            if (Files.isDirectory(argument)) {
                try (Stream<Path> listing = Files.list(argument)) {
                    files.addAll(listing
                            .filter(Files::isRegularFile)
                            .filter(RadiographReader::isSupported)
                            .filter(p -> !p.getFileName().toString().contains(RadiographWriter.OUTPUT_SUFFIX))
                            .sorted()
                            .collect(Collectors.toList()));
                }
            } else {
                files.add(argument);
            }
        }
        return files;
    }
}
