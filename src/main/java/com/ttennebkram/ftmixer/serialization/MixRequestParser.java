package com.ttennebkram.ftmixer.serialization;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.ftmixer.config.MixerConfig;
import com.ttennebkram.ftmixer.model.ComponentType;
import com.ttennebkram.ftmixer.model.MixMode;
import com.ttennebkram.ftmixer.model.MixerException;
import com.ttennebkram.ftmixer.model.RegionConfig;
import com.ttennebkram.ftmixer.model.RegionType;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads mix requests from JSON.
 *
 * <pre>
 * {
 *   "active_slots": [0, 1],
 *   "mode": "magnitude_phase",
 *   "weights": {"magnitude": [1, 0, 0, 0], "phase": [0, 1, 0, 0]},
 *   "region": {"enabled": true, "size": 0.3, "type": "inner"},
 *   "output_port": 0
 * }
 * </pre>
 *
 * Missing weight lists default to the configured weight for every slot.
 * The region may give one "type" or a type per component; it may give
 * "width"/"height" or a single "size", and "x"/"y" for its center.
 */
public class MixRequestParser {

    private final MixerConfig config;

    public MixRequestParser() {
        this(MixerConfig.load());
    }

    public MixRequestParser(MixerConfig config) {
        this.config = config;
    }

    public MixRequest parse(String json) {
        try {
            return parse(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            throw new MixerException(MixerException.Kind.INVALID_REQUEST, "Malformed mix request: " + e.getMessage(), e);
        }
    }

    public MixRequest parse(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(JsonParser.parseReader(reader));
        } catch (IOException e) {
            throw new MixerException(MixerException.Kind.IO_ERROR,
                "Could not read mix request " + path + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new MixerException(MixerException.Kind.INVALID_REQUEST,
                "Malformed mix request in " + path + ": " + e.getMessage(), e);
        }
    }

    private MixRequest parse(JsonElement root) {
        if (root == null || !root.isJsonObject()) {
            throw new MixerException(MixerException.Kind.INVALID_REQUEST, "Mix request must be a JSON object");
        }
        return parse(root.getAsJsonObject());
    }

    public MixRequest parse(JsonObject json) {
        List<Integer> activeSlots = parseActiveSlots(json);

        MixMode mode = MixMode.MAGNITUDE_PHASE;
        if (json.has("mode")) {
            mode = MixMode.fromKey(getString(json, "mode"));
        }

        Map<ComponentType, double[]> weights = parseWeights(json.get("weights"));
        RegionConfig region = parseRegion(json.get("region"));

        int outputPort = 0;
        if (json.has("output_port")) {
            outputPort = getInt(json, "output_port");
        }
        return new MixRequest(activeSlots, mode, weights, region, outputPort);
    }

    private List<Integer> parseActiveSlots(JsonObject json) {
        JsonElement element = json.get("active_slots");
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonArray()) {
            throw new MixerException(MixerException.Kind.INVALID_REQUEST, "active_slots must be an array");
        }
        List<Integer> slots = new ArrayList<>();
        for (JsonElement item : element.getAsJsonArray()) {
            if (!isNumber(item)) {
                throw new MixerException(MixerException.Kind.INVALID_REQUEST, "active_slots must contain integers");
            }
            int slot = toInt(item, "active_slots");
            if (slot < 0 || slot >= config.getSlotCount()) {
                throw new MixerException(MixerException.Kind.INVALID_SLOT,
                    "Invalid image index. Must be 0-" + (config.getSlotCount() - 1) + ", got: " + slot);
            }
            if (!slots.contains(slot)) {
                slots.add(slot);
            }
        }
        return slots;
    }

    private Map<ComponentType, double[]> parseWeights(JsonElement element) {
        Map<ComponentType, double[]> weights = new EnumMap<>(ComponentType.class);
        if (element != null && !element.isJsonNull() && !element.isJsonObject()) {
            throw new MixerException(MixerException.Kind.INVALID_REQUEST, "weights must be an object");
        }
        JsonObject json = element != null && element.isJsonObject() ? element.getAsJsonObject() : new JsonObject();
        for (ComponentType component : ComponentType.values()) {
            JsonElement list = json.get(component.getKey());
            if (list == null || list.isJsonNull()) {
                double[] defaults = new double[config.getSlotCount()];
                Arrays.fill(defaults, config.getDefaultWeight());
                weights.put(component, defaults);
            } else {
                weights.put(component, toDoubles(component.getKey(), list));
            }
        }
        return weights;
    }

    private static double[] toDoubles(String name, JsonElement list) {
        if (!list.isJsonArray()) {
            throw new MixerException(MixerException.Kind.INVALID_WEIGHT, name + " weights must be an array");
        }
        JsonArray array = list.getAsJsonArray();
        double[] values = new double[array.size()];
        for (int i = 0; i < array.size(); i++) {
            JsonElement item = array.get(i);
            if (!isNumber(item)) {
                throw new MixerException(MixerException.Kind.INVALID_WEIGHT,
                    name + " weight " + i + " is not a number: " + item);
            }
            values[i] = item.getAsDouble();
        }
        return values;
    }

    private RegionConfig parseRegion(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return RegionConfig.disabled();
        }
        if (!element.isJsonObject()) {
            throw new MixerException(MixerException.Kind.INVALID_REGION, "region must be an object");
        }
        JsonObject json = element.getAsJsonObject();

        boolean enabled = json.has("enabled") && getBoolean(json, "enabled");
        double size = getDouble(json, "size", config.getDefaultRegionSize());
        double width = getDouble(json, "width", size);
        double height = getDouble(json, "height", size);
        double x = getDouble(json, "x", config.getDefaultRegionCenter());
        double y = getDouble(json, "y", config.getDefaultRegionCenter());

        Map<ComponentType, RegionType> types = new EnumMap<>(ComponentType.class);
        boolean perComponent = false;
        for (ComponentType component : ComponentType.values()) {
            if (json.has(component.getKey())) {
                perComponent = true;
            }
        }
        if (perComponent) {
            for (ComponentType component : ComponentType.values()) {
                String key = json.has(component.getKey()) ? getString(json, component.getKey()) : RegionType.INNER.getKey();
                types.put(component, RegionType.fromKey(key));
            }
        } else {
            String key = json.has("type") ? getString(json, "type") : RegionType.INNER.getKey();
            types.putAll(RegionConfig.uniform(RegionType.fromKey(key)));
        }
        return new RegionConfig(enabled, x, y, width, height, types);
    }

    // ===== JSON helpers =====

    private static boolean isNumber(JsonElement e) {
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber();
    }

    private static String getString(JsonObject json, String key) {
        JsonElement e = json.get(key);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
            throw new MixerException(MixerException.Kind.INVALID_REQUEST, key + " must be a string");
        }
        return e.getAsString();
    }

    private static int getInt(JsonObject json, String key) {
        JsonElement e = json.get(key);
        if (!isNumber(e)) {
            throw new MixerException(MixerException.Kind.INVALID_REQUEST, key + " must be an integer");
        }
        return toInt(e, key);
    }

    /**
     * Integral JSON number as an int; fractional or out-of-range values are rejected, not truncated.
     */
    private static int toInt(JsonElement e, String key) {
        double value = e.getAsDouble();
        if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new MixerException(MixerException.Kind.INVALID_REQUEST,
                key + " must be an integer, got " + e.getAsString());
        }
        return (int) value;
    }

    private static double getDouble(JsonObject json, String key, double defaultValue) {
        JsonElement e = json.get(key);
        if (e == null || e.isJsonNull()) {
            return defaultValue;
        }
        if (!isNumber(e)) {
            throw new MixerException(MixerException.Kind.INVALID_REGION, "region " + key + " must be a number");
        }
        return e.getAsDouble();
    }

    private static boolean getBoolean(JsonObject json, String key) {
        JsonElement e = json.get(key);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isBoolean()) {
            throw new MixerException(MixerException.Kind.INVALID_REQUEST, key + " must be true or false");
        }
        return e.getAsBoolean();
    }
}
