package com.ttennebkram.ftmixer.util;

import com.ttennebkram.ftmixer.model.MixerException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Conversions between OpenCV Mats and plain Java arrays, plus shape checks.
 */
public final class MatUtils {

    private MatUtils() {
    }

    /**
     * Copy a single-channel Mat into a row-major double[rows][cols].
     */
    public static double[][] toArray(Mat mat) {
        Mat source = mat;
        if (mat.type() != CvType.CV_64FC1 || !mat.isContinuous()) {
            source = new Mat();
            mat.convertTo(source, CvType.CV_64F);
        }
        try {
            int rows = source.rows();
            int cols = source.cols();
            double[] flat = new double[rows * cols];
            source.get(0, 0, flat);
            double[][] result = new double[rows][cols];
            for (int r = 0; r < rows; r++) {
                System.arraycopy(flat, r * cols, result[r], 0, cols);
            }
            return result;
        } finally {
            if (source != mat) {
                source.release();
            }
        }
    }

    /**
     * Build a CV_64F Mat from a rectangular double[rows][cols].
     */
    public static Mat fromArray(double[][] values) {
        if (values == null || values.length == 0 || values[0] == null || values[0].length == 0) {
            throw new MixerException(MixerException.Kind.NOT_LOADED, "Image array is empty");
        }
        int rows = values.length;
        int cols = values[0].length;
        double[] flat = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (values[r] == null || values[r].length != cols) {
                throw new MixerException(MixerException.Kind.SHAPE_MISMATCH,
                    "Image array is not rectangular: row " + r + " differs from " + cols + " columns");
            }
            System.arraycopy(values[r], 0, flat, r * cols, cols);
        }
        Mat mat = new Mat(rows, cols, CvType.CV_64FC1);
        mat.put(0, 0, flat);
        return mat;
    }

    /**
     * Read every element of a continuous Mat of depth CV_64F (any channel count).
     */
    public static double[] data(Mat mat) {
        Mat source = mat.isContinuous() ? mat : mat.clone();
        try {
            double[] flat = new double[(int) source.total() * source.channels()];
            source.get(0, 0, flat);
            return flat;
        } finally {
            if (source != mat) {
                source.release();
            }
        }
    }

    /**
     * Wrap a flat array into a new Mat of the given shape and type.
     */
    public static Mat fromData(int rows, int cols, int type, double[] flat) {
        Mat mat = new Mat(rows, cols, type);
        mat.put(0, 0, flat);
        return mat;
    }

    public static String shapeOf(Mat mat) {
        return "(" + mat.rows() + ", " + mat.cols() + ")";
    }

    public static boolean sameShape(Mat a, Mat b) {
        return a.rows() == b.rows() && a.cols() == b.cols();
    }

    /**
     * Throws SHAPE_MISMATCH unless every Mat has the dimensions of the first.
     */
    public static void requireSameShape(List<Mat> mats) {
        if (mats.isEmpty()) {
            return;
        }
        Mat first = mats.get(0);
        for (int i = 1; i < mats.size(); i++) {
            if (!sameShape(first, mats.get(i))) {
                StringBuilder shapes = new StringBuilder();
                for (Mat m : mats) {
                    if (shapes.length() > 0) shapes.append(", ");
                    shapes.append(shapeOf(m));
                }
                throw new MixerException(MixerException.Kind.SHAPE_MISMATCH,
                    "Image sizes mismatch: [" + shapes + "]. Resize all images first.");
            }
        }
    }

    public static void releaseAll(List<Mat> mats) {
        for (Mat m : mats) {
            if (m != null) {
                m.release();
            }
        }
    }
}
