package com.ttennebkram.radiograph.io;

import com.ttennebkram.radiograph.SyntheticImages;
import com.ttennebkram.radiograph.image.Image;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RadiographReaderWriterTest {

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    void outputNameCarriesTheProcessedSuffix(@TempDir Path dir) {
        assertEquals(dir.resolve("chest_processed.png"),
                new RadiographWriter(null).outputPathFor(dir.resolve("chest.tif")));
        assertEquals(dir.resolve("out").resolve("knee_processed.png"),
                new RadiographWriter(dir.resolve("out")).outputPathFor(Path.of("knee.png")));
    }

    @Test
    void writtenImageReadsBackUnchanged(@TempDir Path dir) throws IOException {
        // full 0..255 range, so the min-max stretch on read is the identity
        Image image = SyntheticImages.horizontalRamp(256, 8, 0, 255);
        Path written = new RadiographWriter(null).write(image, dir.resolve("ramp.png"));

        assertTrue(Files.exists(written));
        assertEquals(image, new RadiographReader(new IntensityNormalizer()).read(written));
    }

    @Test
    void unreadableFilesAreIOExceptions(@TempDir Path dir) throws IOException {
        RadiographReader reader = new RadiographReader(new IntensityNormalizer());
        Path garbage = dir.resolve("garbage.png");
        Files.write(garbage, "not an image".getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> reader.read(dir.resolve("missing.png")));
        assertThrows(IOException.class, () -> reader.read(garbage));
    }

    @Test
    void directoriesExpandToSupportedUnprocessedFiles(@TempDir Path dir) throws IOException {
        for (String name : new String[]{"b.png", "a.TIF", "notes.txt", "a_processed.png"}) {
            Files.createFile(dir.resolve(name));
        }
        Path single = dir.resolve("explicit.dat");

        List<Path> files = RadiographReader.expand(List.of(dir, single));

        assertEquals(List.of(dir.resolve("a.TIF"), dir.resolve("b.png"), single), files);
    }
}
