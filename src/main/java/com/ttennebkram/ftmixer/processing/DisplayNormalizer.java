package com.ttennebkram.ftmixer.processing;

import com.ttennebkram.ftmixer.model.ComponentType;
import com.ttennebkram.ftmixer.spectrum.ImageSlot;
import com.ttennebkram.ftmixer.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Prepares spectrum components and images for inspection as 8-bit views.
 *
 * Magnitude is log(1+x) compressed before min-max scaling; the other
 * components are scaled directly. A flat input maps to the middle of the
 * range. Brightness/contrast is applied after scaling, then values are
 * truncated (not rounded) to bytes.
 */
public class DisplayNormalizer {

    public static final double DISPLAY_MIN = 0.0;
    public static final double DISPLAY_MAX = 255.0;

    /**
     * Summary statistics of a raw component.
     */
    public static final class ComponentStatistics {
        public final ComponentType type;
        public final int rows;
        public final int cols;
        public final double min;
        public final double max;
        public final double mean;
        public final double std;
        public final double median;

        ComponentStatistics(ComponentType type, int rows, int cols,
                            double min, double max, double mean, double std, double median) {
            this.type = type;
            this.rows = rows;
            this.cols = cols;
            this.min = min;
            this.max = max;
            this.mean = mean;
            this.std = std;
            this.median = median;
        }

        @Override
        public String toString() {
            return String.format("%s %dx%d: min=%.4f max=%.4f mean=%.4f std=%.4f median=%.4f",
                type.getKey(), rows, cols, min, max, mean, std, median);
        }
    }

    public Mat prepare(Mat component, ComponentType type) {
        return prepare(component, type, 0.0, 1.0);
    }

    /**
     * Display-ready CV_8U view of a raw component.
     */
    public Mat prepare(Mat component, ComponentType type, double brightness, double contrast) {
        Mat scaled;
        if (type == ComponentType.MAGNITUDE) {
            Mat logMagnitude = logScale(component);
            scaled = normalizeForDisplay(logMagnitude, DISPLAY_MIN, DISPLAY_MAX);
            logMagnitude.release();
        } else {
            scaled = normalizeForDisplay(component, DISPLAY_MIN, DISPLAY_MAX);
        }

        if (brightness != 0.0 || contrast != 1.0) {
            adjust(scaled, brightness, contrast);
        }
        Mat bytes = toBytes(scaled);
        scaled.release();
        return bytes;
    }

    /**
     * log(1 + x); the +1 keeps zero magnitudes finite.
     */
    public Mat logScale(Mat magnitude) {
        Mat result = new Mat();
        magnitude.convertTo(result, CvType.CV_64F);
        Core.add(result, new Scalar(1.0), result);
        Core.log(result, result);
        return result;
    }

    /**
     * Linear min-max scaling to [lo, hi]; flat input becomes (lo + hi) / 2.
     *
     * @return new CV_64F Mat
     */
    public Mat normalizeForDisplay(Mat array, double lo, double hi) {
        Mat result = new Mat();
        array.convertTo(result, CvType.CV_64F);
        Core.MinMaxLocResult range = Core.minMaxLoc(result);
        if (range.maxVal == range.minVal) {
            result.setTo(new Scalar((lo + hi) / 2.0));
            return result;
        }
        double scale = (hi - lo) / (range.maxVal - range.minVal);
        result.convertTo(result, CvType.CV_64F, scale, lo - range.minVal * scale);
        return result;
    }

    /**
     * In place: x' = clamp(x * contrast + brightness, 0, 255).
     */
    public void adjust(Mat display, double brightness, double contrast) {
        display.convertTo(display, CvType.CV_64F, contrast, brightness);
        Core.min(display, new Scalar(DISPLAY_MAX), display);
        Core.max(display, new Scalar(DISPLAY_MIN), display);
    }

    /**
     * Truncating conversion of [0,255] doubles to CV_8U.
     * convertTo() would round, so the values are cast one by one.
     */
    public Mat toBytes(Mat display) {
        double[] values = MatUtils.data(display);
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            double v = Math.max(DISPLAY_MIN, Math.min(DISPLAY_MAX, values[i]));
            bytes[i] = (byte) (int) v;
        }
        Mat result = new Mat(display.rows(), display.cols(), CvType.CV_8UC1);
        result.put(0, 0, bytes);
        return result;
    }

    /**
     * All four components of a slot's cached spectrum, prepared with default adjustment.
     */
    public Map<ComponentType, Mat> prepareAll(ImageSlot slot) {
        Map<ComponentType, Mat> prepared = new EnumMap<>(ComponentType.class);
        for (ComponentType type : ComponentType.values()) {
            Mat raw = slot.component(type);
            prepared.put(type, prepare(raw, type));
            raw.release();
        }
        return prepared;
    }

    /**
     * Grid of component views: [magnitude, phase] / [real, imaginary], or with
     * the original image: [original, magnitude, phase] / [real, imaginary, blank].
     */
    public Mat componentGrid(ImageSlot slot, boolean includeOriginal) {
        Map<ComponentType, Mat> parts = prepareAll(slot);
        List<Mat> toRelease = new ArrayList<>(parts.values());
        try {
            List<Mat> top = new ArrayList<>();
            List<Mat> bottom = new ArrayList<>();
            if (includeOriginal) {
                Mat image = slot.getImage();
                Mat scaled = normalizeForDisplay(image, DISPLAY_MIN, DISPLAY_MAX);
                Mat original = toBytes(scaled);
                image.release();
                scaled.release();
                Mat blank = Mat.zeros(original.size(), CvType.CV_8UC1);
                toRelease.add(original);
                toRelease.add(blank);
                top.add(original);
                top.add(parts.get(ComponentType.MAGNITUDE));
                top.add(parts.get(ComponentType.PHASE));
                bottom.add(parts.get(ComponentType.REAL));
                bottom.add(parts.get(ComponentType.IMAGINARY));
                bottom.add(blank);
            } else {
                top.add(parts.get(ComponentType.MAGNITUDE));
                top.add(parts.get(ComponentType.PHASE));
                bottom.add(parts.get(ComponentType.REAL));
                bottom.add(parts.get(ComponentType.IMAGINARY));
            }

            Mat topRow = new Mat();
            Mat bottomRow = new Mat();
            Core.hconcat(top, topRow);
            Core.hconcat(bottom, bottomRow);
            toRelease.add(topRow);
            toRelease.add(bottomRow);

            Mat grid = new Mat();
            Core.vconcat(Arrays.asList(topRow, bottomRow), grid);
            return grid;
        } finally {
            MatUtils.releaseAll(toRelease);
        }
    }

    public ComponentStatistics statistics(Mat component, ComponentType type) {
        double[] values = MatUtils.data(component);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
            sum += v;
        }
        double mean = sum / values.length;
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(squares / values.length);

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        double median = sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;

        return new ComponentStatistics(type, component.rows(), component.cols(), min, max, mean, std, median);
    }
}
