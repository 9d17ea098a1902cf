package com.ttennebkram.radiograph.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link EnhancementConfig} as JSON.
 *
 * Every key is optional: anything missing keeps the default value, unknown
 * keys are ignored. A key present with a non-numeric value (null, an object,
 * text) is a JsonParseException. Values that make the config inconsistent
 * are rejected by the builder with an IllegalArgumentException.
 */
public class EnhancementConfigSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /** Classpath copy of the defaults, useful as a starting point for a deployment file. */
    public static final String DEFAULTS_RESOURCE = "/enhancement-defaults.json";

    private EnhancementConfigSerializer() {
    }

    public static JsonObject toJson(EnhancementConfig config) {
        JsonObject json = new JsonObject();

        JsonObject contrast = new JsonObject();
        contrast.addProperty("lowPercentile", config.getContrastLowPercentile());
        contrast.addProperty("highPercentile", config.getContrastHighPercentile());
        json.add("contrast", contrast);

        JsonObject noise = new JsonObject();
        noise.addProperty("patchSize", config.getNoisePatchSize());
        noise.addProperty("minPatchSize", config.getNoiseMinPatchSize());
        json.add("noise", noise);

        JsonObject sharpness = new JsonObject();
        sharpness.addProperty("laplacianApertureSize", config.getLaplacianApertureSize());
        json.add("sharpness", sharpness);

        JsonObject clahe = new JsonObject();
        clahe.addProperty("clipLimitMin", config.getClipLimitMin());
        clahe.addProperty("clipLimitMax", config.getClipLimitMax());
        clahe.addProperty("contrastReference", config.getContrastReference());
        clahe.addProperty("skipContrast", config.getClaheSkipContrast());
        clahe.addProperty("tileGridSize", config.getClaheTileGridSize());
        clahe.addProperty("minTileSize", config.getClaheMinTileSize());
        json.add("clahe", clahe);

        JsonObject bilateral = new JsonObject();
        bilateral.addProperty("diameter", config.getBilateralDiameter());
        bilateral.addProperty("sigmaColor", config.getBilateralSigmaColor());
        bilateral.addProperty("sigmaSpace", config.getBilateralSigmaSpace());
        json.add("bilateral", bilateral);

        JsonObject denoise = new JsonObject();
        denoise.addProperty("skipThreshold", config.getDenoiseSkipThreshold());
        denoise.addProperty("gain", config.getDenoiseGain());
        denoise.addProperty("minStrength", config.getDenoiseMinStrength());
        denoise.addProperty("maxStrength", config.getDenoiseMaxStrength());
        denoise.addProperty("templateWindow", config.getDenoiseTemplateWindow());
        denoise.addProperty("searchWindow", config.getDenoiseSearchWindow());
        json.add("denoise", denoise);

        JsonObject sharpen = new JsonObject();
        sharpen.add("bandEdges", toArray(config.getSharpnessBandEdges()));
        sharpen.add("strengths", toArray(config.getSharpenStrengths()));
        sharpen.addProperty("kernelSize", config.getSharpenKernelSize());
        sharpen.addProperty("sigma", config.getSharpenSigma());
        json.add("sharpen", sharpen);

        return json;
    }

    public static EnhancementConfig fromJson(JsonObject json) {
        EnhancementConfig d = EnhancementConfig.defaults();
        EnhancementConfig.Builder builder = d.toBuilder();

        JsonObject contrast = section(json, "contrast");
        builder.contrastPercentiles(
                getJsonDouble(contrast, "lowPercentile", d.getContrastLowPercentile()),
                getJsonDouble(contrast, "highPercentile", d.getContrastHighPercentile()));

        JsonObject noise = section(json, "noise");
        builder.noisePatchSize(getJsonInt(noise, "patchSize", d.getNoisePatchSize()));
        builder.noiseMinPatchSize(getJsonInt(noise, "minPatchSize", d.getNoiseMinPatchSize()));

        JsonObject sharpness = section(json, "sharpness");
        builder.laplacianApertureSize(getJsonInt(sharpness, "laplacianApertureSize", d.getLaplacianApertureSize()));

        JsonObject clahe = section(json, "clahe");
        builder.clipLimitRange(
                getJsonDouble(clahe, "clipLimitMin", d.getClipLimitMin()),
                getJsonDouble(clahe, "clipLimitMax", d.getClipLimitMax()));
        builder.contrastReference(getJsonDouble(clahe, "contrastReference", d.getContrastReference()));
        builder.claheSkipContrast(getJsonDouble(clahe, "skipContrast", d.getClaheSkipContrast()));
        builder.claheTileGridSize(getJsonInt(clahe, "tileGridSize", d.getClaheTileGridSize()));
        builder.claheMinTileSize(getJsonInt(clahe, "minTileSize", d.getClaheMinTileSize()));

        JsonObject bilateral = section(json, "bilateral");
        builder.bilateral(
                getJsonInt(bilateral, "diameter", d.getBilateralDiameter()),
                getJsonDouble(bilateral, "sigmaColor", d.getBilateralSigmaColor()),
                getJsonDouble(bilateral, "sigmaSpace", d.getBilateralSigmaSpace()));

        JsonObject denoise = section(json, "denoise");
        builder.denoiseSkipThreshold(getJsonDouble(denoise, "skipThreshold", d.getDenoiseSkipThreshold()));
        builder.denoiseGain(getJsonDouble(denoise, "gain", d.getDenoiseGain()));
        builder.denoiseStrengthRange(
                getJsonDouble(denoise, "minStrength", d.getDenoiseMinStrength()),
                getJsonDouble(denoise, "maxStrength", d.getDenoiseMaxStrength()));
        builder.denoiseWindows(
                getJsonInt(denoise, "templateWindow", d.getDenoiseTemplateWindow()),
                getJsonInt(denoise, "searchWindow", d.getDenoiseSearchWindow()));

        JsonObject sharpen = section(json, "sharpen");
        builder.sharpenBands(
                getJsonDoubleArray(sharpen, "bandEdges", d.getSharpnessBandEdges()),
                getJsonDoubleArray(sharpen, "strengths", d.getSharpenStrengths()));
        builder.sharpenKernel(
                getJsonInt(sharpen, "kernelSize", d.getSharpenKernelSize()),
                getJsonDouble(sharpen, "sigma", d.getSharpenSigma()));

        return builder.build();
    }

    public static String toJsonString(EnhancementConfig config) {
        return GSON.toJson(toJson(config));
    }

    public static EnhancementConfig fromJsonString(String text) {
        return fromJson(parseObject(JsonParser.parseString(text)));
    }

    /**
     * Load a config file. Missing keys fall back to the defaults.
     */
    public static EnhancementConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(parseObject(JsonParser.parseReader(reader)));
        } catch (JsonParseException e) {
            throw new IOException("Malformed enhancement config " + path + ": " + e.getMessage(), e);
        }
    }

    public static void save(Path path, EnhancementConfig config) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(config), writer);
        }
    }

    /**
     * Load the defaults shipped on the classpath.
     */
    public static EnhancementConfig loadBundledDefaults() {
        try (InputStream in = EnhancementConfigSerializer.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                return EnhancementConfig.defaults();
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                return fromJson(parseObject(JsonParser.parseReader(reader)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + DEFAULTS_RESOURCE, e);
        }
    }

    private static JsonObject parseObject(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            throw new JsonParseException("Enhancement config must be a JSON object");
        }
        return element.getAsJsonObject();
    }

    private static JsonObject section(JsonObject json, String key) {
        if (json.has(key) && json.get(key).isJsonObject()) {
            return json.getAsJsonObject(key);
        }
        return new JsonObject();
    }

    private static JsonArray toArray(double[] values) {
        JsonArray array = new JsonArray();
        for (double v : values) {
            array.add(v);
        }
        return array;
    }

    private static int getJsonInt(JsonObject json, String key, int defaultValue) {
        if (!json.has(key)) {
            return defaultValue;
        }
        JsonPrimitive value = numberAt(json.get(key), key);
        try {
            return value.getAsInt();
        } catch (NumberFormatException e) {
            throw new JsonParseException("Config key '" + key + "' must be an integer, got " + value, e);
        }
    }

    private static double getJsonDouble(JsonObject json, String key, double defaultValue) {
        if (!json.has(key)) {
            return defaultValue;
        }
        return numberAt(json.get(key), key).getAsDouble();
    }

    private static double[] getJsonDoubleArray(JsonObject json, String key, double[] defaultValue) {
        if (!json.has(key)) {
            return defaultValue;
        }
        JsonElement element = json.get(key);
        if (!element.isJsonArray()) {
            throw new JsonParseException("Config key '" + key + "' must be an array of numbers, got " + element);
        }
        JsonArray array = element.getAsJsonArray();
        double[] values = new double[array.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = numberAt(array.get(i), key + "[" + i + "]").getAsDouble();
        }
        return values;
    }

    // null, objects, arrays, booleans and non-numeric strings are all malformed
    private static JsonPrimitive numberAt(JsonElement element, String key) {
        if (element == null || !element.isJsonPrimitive()) {
            throw new JsonParseException("Config key '" + key + "' must be a number, got " + element);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            return primitive;
        }
        if (primitive.isString()) {
            try {
                Double.parseDouble(primitive.getAsString());
                return primitive;
            } catch (NumberFormatException e) {
                throw new JsonParseException("Config key '" + key + "' must be a number, got " + primitive, e);
            }
        }
        throw new JsonParseException("Config key '" + key + "' must be a number, got " + primitive);
    }
}
