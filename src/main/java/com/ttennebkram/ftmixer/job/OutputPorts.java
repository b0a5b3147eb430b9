package com.ttennebkram.ftmixer.job;

import com.ttennebkram.ftmixer.model.MixSettings;
import com.ttennebkram.ftmixer.model.MixerException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * The two output slots holding the most recent reconstructed images.
 * Ports are numbered 0 and 1. Stored Mats are owned here; readers get copies.
 */
public class OutputPorts {

    private final Mat[] ports = new Mat[MixSettings.OUTPUT_PORT_COUNT];

    public static void checkPort(int port) {
        if (port < 0 || port >= MixSettings.OUTPUT_PORT_COUNT) {
            throw new MixerException(MixerException.Kind.INVALID_PORT,
                "Invalid output port. Must be 0 or 1, got: " + port);
        }
    }

    /**
     * Store a copy of {@code output} in the port, releasing what was there.
     */
    public synchronized void set(int port, Mat output) {
        checkPort(port);
        Mat previous = ports[port];
        ports[port] = output.clone();
        if (previous != null) {
            previous.release();
        }
    }

    public synchronized boolean has(int port) {
        checkPort(port);
        return ports[port] != null;
    }

    /**
     * Copy of the port's image, or null if nothing has been written yet.
     */
    public synchronized Mat get(int port) {
        checkPort(port);
        Mat current = ports[port];
        return current != null ? current.clone() : null;
    }

    /**
     * In place: x' = clamp(x * contrast + brightness, 0, 255).
     */
    public synchronized void adjust(int port, double brightness, double contrast) {
        checkPort(port);
        Mat current = ports[port];
        if (current == null) {
            throw new MixerException(MixerException.Kind.NOT_LOADED, "No output in port " + port);
        }
        Mat adjusted = new Mat();
        current.convertTo(adjusted, CvType.CV_64F, contrast, brightness);
        Core.min(adjusted, new Scalar(255.0), adjusted);
        Core.max(adjusted, new Scalar(0.0), adjusted);
        set(port, adjusted);
        adjusted.release();
    }

    public synchronized void clear() {
        for (int i = 0; i < ports.length; i++) {
            if (ports[i] != null) {
                ports[i].release();
                ports[i] = null;
            }
        }
    }
}
