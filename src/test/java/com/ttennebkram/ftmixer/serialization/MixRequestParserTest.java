package com.ttennebkram.ftmixer.serialization;

import com.ttennebkram.ftmixer.config.MixerConfig;
import com.ttennebkram.ftmixer.model.ComponentType;
import com.ttennebkram.ftmixer.model.MagnitudePhaseSettings;
import com.ttennebkram.ftmixer.model.MixMode;
import com.ttennebkram.ftmixer.model.MixSettings;
import com.ttennebkram.ftmixer.model.MixerException;
import com.ttennebkram.ftmixer.model.RealImaginarySettings;
import com.ttennebkram.ftmixer.model.RegionConfig;
import com.ttennebkram.ftmixer.model.RegionType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class MixRequestParserTest {

    private final MixRequestParser parser = new MixRequestParser(MixerConfig.load());

    @Test
    void fullRequest() {
        MixRequest request = parser.parse("{"
            + "\"active_slots\": [0, 2],"
            + "\"mode\": \"magnitude_phase\","
            + "\"weights\": {\"magnitude\": [1, 0.2, 0.3, 0.4], \"phase\": [0, 0.5, 1, 0]},"
            + "\"region\": {\"enabled\": true, \"size\": 0.4, \"type\": \"outer\"},"
            + "\"output_port\": 1}");

        assertEquals(Arrays.asList(0, 2), request.getActiveSlots());
        assertEquals(MixMode.MAGNITUDE_PHASE, request.getMode());
        assertEquals(1, request.getOutputPort());

        RegionConfig region = request.getRegion();
        assertTrue(region.isEnabled());
        assertEquals(0.4, region.getWidth(), 0.0);
        assertEquals(0.4, region.getHeight(), 0.0);
        assertEquals(0.5, region.getX(), 0.0);
        assertEquals(RegionType.OUTER, region.getType(ComponentType.PHASE));

        MixSettings settings = request.toSettings(request.getActiveSlots());
        assertTrue(settings instanceof MagnitudePhaseSettings);
        MagnitudePhaseSettings mp = (MagnitudePhaseSettings) settings;
        assertArrayEquals(new double[] {1, 0.3}, mp.getMagnitudeWeights().toArray(), 0.0);
        assertArrayEquals(new double[] {0, 1}, mp.getPhaseWeights().toArray(), 0.0);
        assertEquals(1, mp.getOutputPort());
    }

    @Test
    void defaultsFillMissingFields() {
        MixRequest request = parser.parse("{}");
        assertFalse(request.hasActiveSlots());
        assertEquals(MixMode.MAGNITUDE_PHASE, request.getMode());
        assertEquals(0, request.getOutputPort());
        assertFalse(request.getRegion().isEnabled());
        assertArrayEquals(new double[] {0.5, 0.5, 0.5, 0.5}, request.getSlotWeights(ComponentType.REAL), 0.0);
    }

    @Test
    void weightsAreFilteredToUsedSlots() {
        MixRequest request = parser.parse("{\"mode\": \"real_imaginary\","
            + "\"weights\": {\"real\": [0.1, 0.2, 0.3, 0.4], \"imaginary\": [0.5, 0.6, 0.7, 0.8]}}");
        RealImaginarySettings settings = (RealImaginarySettings) request.toSettings(Arrays.asList(1, 3));
        assertArrayEquals(new double[] {0.2, 0.4}, settings.getRealWeights().toArray(), 0.0);
        assertArrayEquals(new double[] {0.6, 0.8}, settings.getImaginaryWeights().toArray(), 0.0);
        assertEquals(2, settings.getSlotCount());
    }

    @Test
    void perComponentRegionTypes() {
        MixRequest request = parser.parse("{\"region\": {\"enabled\": true, \"x\": 0.4, \"y\": 0.6,"
            + "\"width\": 0.2, \"height\": 0.1, \"magnitude\": \"outer\", \"phase\": \"inner\"}}");
        RegionConfig region = request.getRegion();
        assertEquals(RegionType.OUTER, region.getType(ComponentType.MAGNITUDE));
        assertEquals(RegionType.INNER, region.getType(ComponentType.PHASE));
        assertEquals(RegionType.INNER, region.getType(ComponentType.REAL));
        assertEquals(0.4, region.getX(), 0.0);
        assertEquals(0.6, region.getY(), 0.0);
        assertEquals(0.2, region.getWidth(), 0.0);
        assertEquals(0.1, region.getHeight(), 0.0);
    }

    @Test
    void invalidValuesAreReportedByKind() {
        assertKind(MixerException.Kind.INVALID_MODE, "{\"mode\": \"hsv\"}");
        assertKind(MixerException.Kind.INVALID_SLOT, "{\"active_slots\": [4]}");
        assertKind(MixerException.Kind.INVALID_REGION, "{\"region\": {\"enabled\": true, \"size\": 1.5}}");
        assertKind(MixerException.Kind.INVALID_REGION, "{\"region\": {\"type\": \"middle\"}}");
        assertKind(MixerException.Kind.INVALID_WEIGHT, "{\"weights\": {\"magnitude\": [\"a\"]}}");
        assertKind(MixerException.Kind.INVALID_REQUEST, "{\"output_port\": \"left\"}");
        assertKind(MixerException.Kind.INVALID_REQUEST, "[1, 2]");
        assertKind(MixerException.Kind.INVALID_REQUEST, "{\"mode\": ");
    }

    @Test
    void negativeOrShortWeightsFailWhenSettingsAreBuilt() {
        MixRequest negative = parser.parse("{\"weights\": {\"magnitude\": [-1, 0, 0, 0]}}");
        assertEquals(MixerException.Kind.INVALID_WEIGHT,
            assertThrows(MixerException.class, () -> negative.toSettings(Arrays.asList(0))).getKind());

        MixRequest shortList = parser.parse("{\"weights\": {\"phase\": [1]}}");
        assertEquals(MixerException.Kind.INVALID_WEIGHT,
            assertThrows(MixerException.class, () -> shortList.toSettings(Arrays.asList(0, 1))).getKind());
    }

    @Test
    void outOfRangePortIsRejectedWhenSettingsAreBuilt() {
        MixRequest request = parser.parse("{\"output_port\": 2}");
        assertEquals(MixerException.Kind.INVALID_PORT,
            assertThrows(MixerException.class, () -> request.toSettings(Arrays.asList(0))).getKind());
    }

    @Test
    void readsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("request.json");
        Files.write(file, "{\"active_slots\": [1], \"output_port\": 1}".getBytes(StandardCharsets.UTF_8));
        MixRequest request = parser.parse(file);
        assertEquals(Arrays.asList(1), request.getActiveSlots());

        assertEquals(MixerException.Kind.IO_ERROR,
            assertThrows(MixerException.class, () -> parser.parse(dir.resolve("missing.json"))).getKind());
    }

    private void assertKind(MixerException.Kind kind, String json) {
        MixerException e = assertThrows(MixerException.class, () -> parser.parse(json), json);
        assertEquals(kind, e.getKind(), json);
    }

    @Test
    void fractionalIntegersAreRejectedNotTruncated() {
        assertEquals(MixerException.Kind.INVALID_REQUEST,
            assertThrows(MixerException.class, () -> parser.parse("{\"output_port\": 1.7}")).getKind());
        assertEquals(MixerException.Kind.INVALID_REQUEST,
            assertThrows(MixerException.class, () -> parser.parse("{\"active_slots\": [0.9]}")).getKind());

        MixRequest integral = parser.parse("{\"active_slots\": [1.0], \"output_port\": 1.0}");
        assertEquals(Arrays.asList(1), integral.getActiveSlots());
        assertEquals(1, integral.getOutputPort());
    }
}
