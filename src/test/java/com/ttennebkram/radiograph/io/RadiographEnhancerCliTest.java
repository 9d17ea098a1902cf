package com.ttennebkram.radiograph.io;

import com.ttennebkram.radiograph.SyntheticImages;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RadiographEnhancerCliTest {

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    void optionsAreParsed() {
        RadiographEnhancerCli.Options options = RadiographEnhancerCli.Options.parse(new String[]{
                "--config", "c.json", "--out", "results", "--invert", "--slope", "2.5",
                "--intercept", "-1024", "--report", "a.png", "dir"});

        assertEquals(Path.of("c.json"), options.configPath);
        assertEquals(Path.of("results"), options.outputDirectory);
        assertTrue(options.invert);
        assertTrue(options.report);
        assertEquals(2.5, options.slope);
        assertEquals(-1024.0, options.intercept);
        assertEquals(2, options.inputs.size());
    }

    @Test
    void badOptionsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> RadiographEnhancerCli.Options.parse(new String[]{"--bogus", "a.png"}));
        assertThrows(IllegalArgumentException.class,
                () -> RadiographEnhancerCli.Options.parse(new String[]{"--slope", "steep", "a.png"}));
        assertThrows(IllegalArgumentException.class,
                () -> RadiographEnhancerCli.Options.parse(new String[]{"--out"}));
        assertThrows(IllegalArgumentException.class,
                () -> RadiographEnhancerCli.Options.parse(new String[0]));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(RadiographEnhancerCli.EXIT_USAGE, new RadiographEnhancerCli().run(new String[]{"--bogus"}));
    }

    @Test
    void configWithNullValueIsAUsageError(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("config.json");
        Files.write(config, "{\"noise\": {\"patchSize\": null}}".getBytes(StandardCharsets.UTF_8));

        assertEquals(RadiographEnhancerCli.EXIT_USAGE, new RadiographEnhancerCli().run(new String[]{
                "--config", config.toString(), dir.resolve("missing.png").toString()}));
    }

    @Test
    void processesADirectory(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("in");
        Path output = dir.resolve("out");
        Files.createDirectories(input);
        Mat phantom = SyntheticImages.darkLowContrastNoisy().toMat();
        try {
            assertTrue(Imgcodecs.imwrite(input.resolve("phantom.png").toString(), phantom));
        } finally {
            phantom.release();
        }

        int exit = new RadiographEnhancerCli().run(new String[]{
                "--out", output.toString(), "--report", input.toString()});

        assertEquals(RadiographEnhancerCli.EXIT_OK, exit);
        assertTrue(Files.exists(output.resolve("phantom_processed.png")));
    }

    @Test
    void unreadableFilesAreCountedAsFailures(@TempDir Path dir) throws IOException {
        Path broken = dir.resolve("broken.png");
        Files.write(broken, "nope".getBytes(StandardCharsets.UTF_8));

        assertEquals(RadiographEnhancerCli.EXIT_FAILURES,
                new RadiographEnhancerCli().run(new String[]{broken.toString()}));
    }
}
