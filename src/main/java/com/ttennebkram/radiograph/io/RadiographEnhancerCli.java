package com.ttennebkram.radiograph.io;

import com.ttennebkram.radiograph.AdaptiveEnhancer;
import com.ttennebkram.radiograph.EnhancementResult;
import com.ttennebkram.radiograph.config.EnhancementConfig;
import com.ttennebkram.radiograph.config.EnhancementConfigSerializer;
import com.ttennebkram.radiograph.evaluation.EvaluationReport;
import com.ttennebkram.radiograph.image.Image;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: enhances each given radiograph and writes
 * {@code <name>_processed.png}. Files are processed one after another; a
 * failure on one file is logged and the next file is processed.
 *
 * <pre>
 * radiograph-enhancer [--config file.json] [--out dir] [--invert]
 *                     [--slope s] [--intercept i] [--report] &lt;file|dir&gt;...
 * </pre>
 */
public class RadiographEnhancerCli {

    private static final Logger log = LoggerFactory.getLogger(RadiographEnhancerCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        // Load OpenCV native library
        nu.pattern.OpenCV.loadLocally();

        System.exit(new RadiographEnhancerCli().run(args));
    }

    /**
     * Parsed command line.
     */
    static class Options {
        Path configPath;
        Path outputDirectory;
        boolean invert;
        double slope = 1.0;
        double intercept = 0.0;
        boolean report;
        final List<Path> inputs = new ArrayList<>();

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--config":
                        options.configPath = Paths.get(value(args, ++i, arg));
                        break;
                    case "--out":
                        options.outputDirectory = Paths.get(value(args, ++i, arg));
                        break;
                    case "--invert":
                        options.invert = true;
                        break;
                    case "--slope":
                        options.slope = number(value(args, ++i, arg), arg);
                        break;
                    case "--intercept":
                        options.intercept = number(value(args, ++i, arg), arg);
                        break;
                    case "--report":
                        options.report = true;
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option " + arg);
                        }
                        options.inputs.add(Paths.get(arg));
                }
            }
            if (options.inputs.isEmpty()) {
                throw new IllegalArgumentException("No input files given");
            }
            return options;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException(option + " needs a value");
            }
            return args[index];
        }

        private static double number(String text, String option) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(option + " expects a number, got '" + text + "'", e);
            }
        }
    }

    int run(String[] args) {
        Options options;
        EnhancementConfig config;
        List<Path> files;
        IntensityNormalizer normalizer;
        try {
            options = Options.parse(args);
            config = options.configPath != null
                    ? EnhancementConfigSerializer.load(options.configPath)
                    : EnhancementConfig.defaults();
            normalizer = new IntensityNormalizer(options.slope, options.intercept, options.invert);
            files = RadiographReader.expand(options.inputs);
        } catch (IllegalArgumentException | IOException e) {
            log.error("{}", e.getMessage());
            log.error("Usage: radiograph-enhancer [--config file.json] [--out dir] [--invert] "
                    + "[--slope s] [--intercept i] [--report] <file|dir>...");
            return EXIT_USAGE;
        }

        if (files.isEmpty()) {
            log.warn("No supported image files found");
            return EXIT_OK;
        }

        AdaptiveEnhancer enhancer = new AdaptiveEnhancer(config);
        RadiographReader reader = new RadiographReader(normalizer);
        RadiographWriter writer = new RadiographWriter(options.outputDirectory);

        int failures = 0;
        for (Path file : files) {
            if (!processFile(file, enhancer, reader, writer, options.report)) {
                failures++;
            }
        }
        log.info("Processed {} file(s), {} failed", files.size(), failures);
        return failures == 0 ? EXIT_OK : EXIT_FAILURES;
    }

    boolean processFile(Path file, AdaptiveEnhancer enhancer, RadiographReader reader,
                        RadiographWriter writer, boolean report) {
        log.info("=== Processing {} ===", file);

        Image original;
        try {
            original = reader.read(file);
        } catch (IOException e) {
            log.error("Error loading {}: {}", file, e.getMessage());
            return false;
        }

        EnhancementResult result = enhancer.adaptiveEnhance(original);
        if (result.getProfile() != null) {
            log.info("Measured {}", result.getProfile());
            if (result.getProfile().isUndersized()) {
                log.warn("{} is smaller than the standard noise patch layout; noise estimate is degraded", file);
            }
        }
        if (!result.isSuccess()) {
            log.warn("Adaptive preprocessing failed for {} in stage {}: {}", file,
                    result.getFailure().getStageName(), result.getFailure().getMessage());
            return false;
        }
        log.info("Applied {} (skipped {}) with {}", result.getAppliedStages(), result.getSkippedStages(),
                result.getStageConfig());

        try {
            Path written = writer.write(result.getImage(), file);
            log.info("Saved processed image: {}", written);
        } catch (IOException e) {
            log.error("Could not save processed image for {}: {}", file, e.getMessage());
            return false;
        }

        if (report) {
            EvaluationReport evaluation = EvaluationReport.compare(original, result.getImage(), enhancer.getAnalyzer());
            log.info("{}\n{}", file.getFileName(), evaluation.summary());
        }
        return true;
    }
}
