package com.ttennebkram.ftmixer.job;

import com.ttennebkram.ftmixer.model.MixerException;
import com.ttennebkram.ftmixer.util.MatUtils;
import com.ttennebkram.ftmixer.util.OpenCVLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import static org.junit.jupiter.api.Assertions.*;

class OutputPortsTest {

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.load();
    }

    @Test
    void storesCopies() {
        OutputPorts ports = new OutputPorts();
        Mat image = MatUtils.fromArray(new double[][] {{1, 2}, {3, 4}});
        ports.set(0, image);
        image.setTo(new Scalar(0));

        Mat stored = ports.get(0);
        assertEquals(4.0, MatUtils.toArray(stored)[1][1], 0.0);
        stored.setTo(new Scalar(0));
        assertEquals(4.0, MatUtils.toArray(ports.get(0))[1][1], 0.0);
        assertNull(ports.get(1));
    }

    @Test
    void onlyPortsZeroAndOneExist() {
        OutputPorts ports = new OutputPorts();
        assertEquals(MixerException.Kind.INVALID_PORT,
            assertThrows(MixerException.class, () -> ports.get(2)).getKind());
        assertThrows(MixerException.class, () -> ports.has(-1));
    }

    @Test
    void adjustClampsInPlace() {
        OutputPorts ports = new OutputPorts();
        ports.set(1, MatUtils.fromArray(new double[][] {{0, 100, 200}}));
        ports.adjust(1, 10, 1.5);
        assertArrayEquals(new double[] {10, 160, 255}, MatUtils.toArray(ports.get(1))[0], 1e-9);

        MixerException e = assertThrows(MixerException.class, () -> ports.adjust(0, 1, 1));
        assertEquals(MixerException.Kind.NOT_LOADED, e.getKind());
    }

    @Test
    void clearEmptiesBothPorts() {
        OutputPorts ports = new OutputPorts();
        ports.set(0, MatUtils.fromArray(new double[][] {{1}}));
        ports.set(1, MatUtils.fromArray(new double[][] {{2}}));
        ports.clear();
        assertFalse(ports.has(0));
        assertFalse(ports.has(1));
    }
}
