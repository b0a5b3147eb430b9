package com.ttennebkram.ftmixer.serialization;

import com.google.gson.JsonObject;
import com.ttennebkram.ftmixer.model.MixResult;
import com.ttennebkram.ftmixer.util.MatUtils;
import com.ttennebkram.ftmixer.util.OpenCVLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class MixerJsonTest {

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.load();
    }

    @Test
    void completedResult() {
        MixResult result = MixResult.completed(MatUtils.fromArray(new double[][] {{1, 2, 3}, {4, 5, 6}}), 1, 7);
        JsonObject json = MixerJson.result(result);

        assertTrue(json.get("success").getAsBoolean());
        assertEquals(2, json.getAsJsonArray("shape").get(0).getAsInt());
        assertEquals(3, json.getAsJsonArray("shape").get(1).getAsInt());
        assertEquals(1, json.get("output_port").getAsInt());
        assertEquals(100, json.get("progress").getAsInt());
        assertEquals(7, json.get("generation").getAsLong());
        assertEquals("completed", json.get("status").getAsString());
    }

    @Test
    void failedAndCancelledResults() {
        JsonObject failed = MixerJson.result(MixResult.failed(0, 50, 3, "bad things"));
        assertFalse(failed.get("success").getAsBoolean());
        assertEquals("bad things", failed.get("error").getAsString());
        assertEquals("failed", failed.get("status").getAsString());

        JsonObject cancelled = MixerJson.result(MixResult.cancelled(1, 10, 4));
        assertEquals("Operation was cancelled", cancelled.get("error").getAsString());
        assertEquals(10, cancelled.get("progress").getAsInt());
    }

    @Test
    void progressCancelAndStatus() {
        JsonObject progress = MixerJson.progress(70, true);
        assertEquals(70, progress.get("progress").getAsInt());
        assertTrue(progress.get("is_processing").getAsBoolean());

        assertFalse(MixerJson.cancel(false).get("success").getAsBoolean());
        assertTrue(MixerJson.cancel(true).get("success").getAsBoolean());

        JsonObject status = MixerJson.status(Arrays.asList(0, 2), Collections.singletonList(2), false,
            new boolean[] {true, false});
        assertEquals(2, status.getAsJsonArray("loaded_images").size());
        assertEquals(2, status.getAsJsonArray("fft_computed").get(0).getAsInt());
        assertFalse(status.get("is_processing").getAsBoolean());
        assertTrue(status.getAsJsonArray("output_ports").get(0).getAsBoolean());
        assertFalse(status.getAsJsonArray("output_ports").get(1).getAsBoolean());
        assertTrue(MixerJson.toJson(status).contains("\"loaded_images\""));
    }
}
