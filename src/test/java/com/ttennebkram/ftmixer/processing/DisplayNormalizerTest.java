package com.ttennebkram.ftmixer.processing;

import com.ttennebkram.ftmixer.TestImages;
import com.ttennebkram.ftmixer.model.ComponentType;
import com.ttennebkram.ftmixer.spectrum.ImageSlot;
import com.ttennebkram.ftmixer.util.MatUtils;
import com.ttennebkram.ftmixer.util.OpenCVLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DisplayNormalizerTest {

    private final DisplayNormalizer normalizer = new DisplayNormalizer();

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.load();
    }

    @Test
    void flatComponentMapsToMidpoint() {
        Mat flat = new Mat(2, 2, CvType.CV_64FC1, new Scalar(-3));
        Mat display = normalizer.prepare(flat, ComponentType.REAL);

        assertEquals(CvType.CV_8UC1, display.type());
        // 127.5 truncates to 127
        assertEquals(127.0, display.get(0, 0)[0], 0.0);
    }

    @Test
    void linearComponentsSpanFullRange() {
        Mat values = MatUtils.fromArray(new double[][] {{-2, 0, 2}});
        Mat display = normalizer.prepare(values, ComponentType.PHASE);
        assertEquals(0.0, display.get(0, 0)[0], 0.0);
        assertEquals(127.0, display.get(0, 1)[0], 0.0);
        assertEquals(255.0, display.get(0, 2)[0], 0.0);
    }

    @Test
    void magnitudeIsLogCompressed() {
        Mat values = MatUtils.fromArray(new double[][] {{0, Math.E - 1, Math.E * Math.E - 1}});
        Mat display = normalizer.prepare(values, ComponentType.MAGNITUDE);
        // log(1+x) gives 0, 1, 2, so the middle value lands halfway
        assertEquals(127.0, display.get(0, 1)[0], 0.0);
    }

    @Test
    void brightnessAndContrastAreClamped() {
        Mat values = MatUtils.fromArray(new double[][] {{0, 10}});
        Mat display = normalizer.prepare(values, ComponentType.REAL, 20, 2.0);
        assertEquals(20.0, display.get(0, 0)[0], 0.0);
        assertEquals(255.0, display.get(0, 1)[0], 0.0);
    }

    @Test
    void statisticsOfKnownValues() {
        Mat values = MatUtils.fromArray(new double[][] {{1, 2}, {3, 4}});
        DisplayNormalizer.ComponentStatistics stats = normalizer.statistics(values, ComponentType.REAL);
        assertEquals(1.0, stats.min, 0.0);
        assertEquals(4.0, stats.max, 0.0);
        assertEquals(2.5, stats.mean, 1e-12);
        assertEquals(2.5, stats.median, 1e-12);
        assertEquals(Math.sqrt(1.25), stats.std, 1e-12);
        assertEquals(2, stats.rows);
    }

    @Test
    void allComponentsAndGrid() {
        ImageSlot slot = new ImageSlot(0);
        slot.load(TestImages.noise(10, 12, 4));
        slot.computeSpectrum();

        Map<ComponentType, Mat> views = normalizer.prepareAll(slot);
        assertEquals(4, views.size());
        for (Mat view : views.values()) {
            assertEquals(10, view.rows());
            assertEquals(12, view.cols());
        }

        Mat grid = normalizer.componentGrid(slot, false);
        assertEquals(20, grid.rows());
        assertEquals(24, grid.cols());

        Mat withOriginal = normalizer.componentGrid(slot, true);
        assertEquals(20, withOriginal.rows());
        assertEquals(36, withOriginal.cols());
        assertEquals(CvType.CV_8UC1, withOriginal.type());
        // the blank cell in the bottom right stays black
        assertEquals(0.0, withOriginal.get(15, 30)[0], 0.0);
        assertTrue(Core.minMaxLoc(grid).maxVal > 0);
    }
}
