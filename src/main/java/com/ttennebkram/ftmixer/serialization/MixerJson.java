package com.ttennebkram.ftmixer.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.ttennebkram.ftmixer.model.MixResult;

import java.util.List;
import java.util.Locale;

/**
 * JSON shapes of the mixer's responses.
 */
public final class MixerJson {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private MixerJson() {
    }

    public static JsonObject result(MixResult result) {
        if (result.getStatus() == MixResult.Status.FAILED || result.getStatus() == MixResult.Status.CANCELLED) {
            JsonObject json = failure(result.getError());
            json.addProperty("output_port", result.getOutputPort());
            json.addProperty("progress", result.getProgress());
            json.addProperty("generation", result.getGeneration());
            json.addProperty("status", result.getStatus().name().toLowerCase(Locale.ROOT));
            return json;
        }
        JsonObject json = new JsonObject();
        json.addProperty("success", result.isSuccess());
        JsonArray shape = new JsonArray();
        shape.add(result.getRows());
        shape.add(result.getCols());
        json.add("shape", shape);
        json.addProperty("output_port", result.getOutputPort());
        json.addProperty("progress", result.getProgress());
        json.addProperty("generation", result.getGeneration());
        json.addProperty("status", result.getStatus().name().toLowerCase(Locale.ROOT));
        return json;
    }

    public static JsonObject failure(String error) {
        JsonObject json = new JsonObject();
        json.addProperty("success", false);
        json.addProperty("error", error);
        return json;
    }

    public static JsonObject progress(int progress, boolean processing) {
        JsonObject json = new JsonObject();
        json.addProperty("progress", progress);
        json.addProperty("is_processing", processing);
        return json;
    }

    public static JsonObject cancel(boolean cancelled) {
        JsonObject json = new JsonObject();
        json.addProperty("success", cancelled);
        json.addProperty("message", cancelled ? "Mixing operation cancelled" : "No operation in progress");
        return json;
    }

    public static JsonObject status(List<Integer> loaded, List<Integer> computed, boolean processing,
                                    boolean[] outputPorts) {
        JsonObject json = new JsonObject();
        json.add("loaded_images", toArray(loaded));
        json.add("fft_computed", toArray(computed));
        json.addProperty("is_processing", processing);
        JsonArray ports = new JsonArray();
        for (boolean has : outputPorts) {
            ports.add(has);
        }
        json.add("output_ports", ports);
        return json;
    }

    private static JsonArray toArray(List<Integer> values) {
        JsonArray array = new JsonArray();
        for (Integer value : values) {
            array.add(value);
        }
        return array;
    }

    public static String toJson(JsonElement json) {
        return GSON.toJson(json);
    }
}
