package com.ttennebkram.ftmixer.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.ftmixer.model.MixerException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Mixer settings that are not part of an individual mix request.
 *
 * Defaults come from the classpath resource {@value #DEFAULTS_RESOURCE};
 * a user file can overlay any subset of the keys. Keys with the wrong JSON
 * type keep their previous value.
 */
public class MixerConfig {

    public static final String DEFAULTS_RESOURCE = "/ftmixer-defaults.json";

    public static final int MAX_SLOTS = 4;

    private int slotCount = MAX_SLOTS;
    private long cancelJoinTimeoutMs = 1000;
    private boolean notifyOnCancel = true;
    private boolean discardStaleResults = true;
    private double defaultWeight = 0.5;
    private double defaultRegionSize = 0.3;
    private double defaultRegionCenter = 0.5;

    /**
     * Built-in defaults overlaid with the bundled defaults resource, if present.
     */
    public static MixerConfig load() {
        MixerConfig config = new MixerConfig();
        try (InputStream in = MixerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                config.apply(read(new InputStreamReader(in, StandardCharsets.UTF_8)));
            } else {
                System.err.println("[MixerConfig] " + DEFAULTS_RESOURCE + " not found, using built-in defaults");
            }
        } catch (IOException e) {
            System.err.println("[MixerConfig] Could not read " + DEFAULTS_RESOURCE + ": " + e.getMessage());
        }
        return config;
    }

    /**
     * Defaults overlaid with a user configuration file.
     */
    public static MixerConfig load(Path overlay) {
        MixerConfig config = load();
        try (Reader reader = Files.newBufferedReader(overlay, StandardCharsets.UTF_8)) {
            config.apply(read(reader));
        } catch (IOException e) {
            throw new MixerException(MixerException.Kind.IO_ERROR,
                "Could not read config file " + overlay + ": " + e.getMessage(), e);
        }
        System.out.println("[MixerConfig] Loaded overlay " + overlay);
        return config;
    }

    private static JsonObject read(Reader reader) {
        try {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                throw new MixerException(MixerException.Kind.INVALID_REQUEST, "Config root must be a JSON object");
            }
            return root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new MixerException(MixerException.Kind.INVALID_REQUEST, "Malformed config JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Overlay the keys present in {@code json}.
     */
    public void apply(JsonObject json) {
        int slots = getJsonInt(json, "slot_count", slotCount);
        if (slots < 1 || slots > MAX_SLOTS) {
            throw new MixerException(MixerException.Kind.INVALID_SLOT,
                "slot_count must be between 1 and " + MAX_SLOTS + ", got " + slots);
        }
        slotCount = slots;
        cancelJoinTimeoutMs = Math.max(0, getJsonLong(json, "cancel_join_timeout_ms", cancelJoinTimeoutMs));
        notifyOnCancel = getJsonBoolean(json, "notify_on_cancel", notifyOnCancel);
        discardStaleResults = getJsonBoolean(json, "discard_stale_results", discardStaleResults);
        defaultWeight = getJsonDouble(json, "default_weight", defaultWeight);
        defaultRegionSize = getJsonDouble(json, "default_region_size", defaultRegionSize);
        defaultRegionCenter = getJsonDouble(json, "default_region_center", defaultRegionCenter);
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("slot_count", slotCount);
        json.addProperty("cancel_join_timeout_ms", cancelJoinTimeoutMs);
        json.addProperty("notify_on_cancel", notifyOnCancel);
        json.addProperty("discard_stale_results", discardStaleResults);
        json.addProperty("default_weight", defaultWeight);
        json.addProperty("default_region_size", defaultRegionSize);
        json.addProperty("default_region_center", defaultRegionCenter);
        return json;
    }

    // ===== JSON helpers =====

    static int getJsonInt(JsonObject json, String key, int defaultValue) {
        JsonElement e = json.get(key);
        if (e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber()) {
            return e.getAsInt();
        }
        return defaultValue;
    }

    static long getJsonLong(JsonObject json, String key, long defaultValue) {
        JsonElement e = json.get(key);
        if (e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber()) {
            return e.getAsLong();
        }
        return defaultValue;
    }

    static double getJsonDouble(JsonObject json, String key, double defaultValue) {
        JsonElement e = json.get(key);
        if (e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber()) {
            return e.getAsDouble();
        }
        return defaultValue;
    }

    static boolean getJsonBoolean(JsonObject json, String key, boolean defaultValue) {
        JsonElement e = json.get(key);
        if (e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isBoolean()) {
            return e.getAsBoolean();
        }
        return defaultValue;
    }

    // ===== Accessors =====

    public int getSlotCount() {
        return slotCount;
    }

    public long getCancelJoinTimeoutMs() {
        return cancelJoinTimeoutMs;
    }

    public void setCancelJoinTimeoutMs(long cancelJoinTimeoutMs) {
        this.cancelJoinTimeoutMs = Math.max(0, cancelJoinTimeoutMs);
    }

    public boolean isNotifyOnCancel() {
        return notifyOnCancel;
    }

    public void setNotifyOnCancel(boolean notifyOnCancel) {
        this.notifyOnCancel = notifyOnCancel;
    }

    public boolean isDiscardStaleResults() {
        return discardStaleResults;
    }

    public void setDiscardStaleResults(boolean discardStaleResults) {
        this.discardStaleResults = discardStaleResults;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }

    public double getDefaultRegionSize() {
        return defaultRegionSize;
    }

    public double getDefaultRegionCenter() {
        return defaultRegionCenter;
    }
}
