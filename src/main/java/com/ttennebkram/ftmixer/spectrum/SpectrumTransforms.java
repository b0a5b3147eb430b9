package com.ttennebkram.ftmixer.spectrum;

import com.ttennebkram.ftmixer.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;

import java.util.ArrayList;
import java.util.List;

/**
 * FFT helpers shared by the slot cache and the inverse pipeline.
 *
 * Spectra are two-channel CV_64FC2 Mats (real, imaginary) with the zero
 * frequency moved to the center. Unlike a quadrant swap, the shifts here
 * are circular and work for odd dimensions too.
 */
public final class SpectrumTransforms {

    private SpectrumTransforms() {
    }

    /**
     * Forward 2D DFT of a single-channel image, zero frequency centered.
     *
     * @param image single-channel image of any depth (caller keeps ownership)
     * @return new CV_64FC2 spectrum
     */
    public static Mat forward(Mat image) {
        Mat floatImage = new Mat();
        image.convertTo(floatImage, CvType.CV_64F);

        List<Mat> planes = new ArrayList<>();
        planes.add(floatImage);
        planes.add(Mat.zeros(floatImage.size(), CvType.CV_64F));
        Mat complex = new Mat();
        Core.merge(planes, complex);
        MatUtils.releaseAll(planes);

        Core.dft(complex, complex);
        Mat shifted = fftShift(complex);
        complex.release();
        return shifted;
    }

    /**
     * Inverse 2D DFT of an uncentered spectrum, scaled by 1/N.
     *
     * @return new CV_64F Mat holding the real part; the imaginary residue is dropped
     */
    public static Mat inverse(Mat uncenteredSpectrum) {
        Mat spatial = new Mat();
        Core.idft(uncenteredSpectrum, spatial, Core.DFT_SCALE);

        List<Mat> planes = new ArrayList<>();
        Core.split(spatial, planes);
        spatial.release();

        Mat real = planes.get(0);
        planes.get(1).release();
        return real;
    }

    /**
     * Move the zero-frequency term to the center (numpy fftshift).
     */
    public static Mat fftShift(Mat input) {
        return circularShift(input, input.rows() / 2, input.cols() / 2);
    }

    /**
     * Undo {@link #fftShift} (numpy ifftshift).
     */
    public static Mat ifftShift(Mat input) {
        return circularShift(input, -(input.rows() / 2), -(input.cols() / 2));
    }

    /**
     * Shift every element down by {@code dy} rows and right by {@code dx} columns, wrapping around.
     *
     * @return a new Mat; the input is not modified
     */
    public static Mat circularShift(Mat input, int dy, int dx) {
        int rows = input.rows();
        int cols = input.cols();
        int sy = Math.floorMod(dy, rows);
        int sx = Math.floorMod(dx, cols);

        Mat output = new Mat(rows, cols, input.type());
        // Source block [0, rows - sy) lands at [sy, rows); [rows - sy, rows) wraps to [0, sy)
        int[][] rowBlocks = {{0, sy, rows - sy}, {rows - sy, 0, sy}};
        int[][] colBlocks = {{0, sx, cols - sx}, {cols - sx, 0, sx}};
        for (int[] rb : rowBlocks) {
            if (rb[2] == 0) continue;
            for (int[] cb : colBlocks) {
                if (cb[2] == 0) continue;
                Mat src = input.submat(new Rect(cb[0], rb[0], cb[2], rb[2]));
                Mat dst = output.submat(new Rect(cb[1], rb[1], cb[2], rb[2]));
                src.copyTo(dst);
                src.release();
                dst.release();
            }
        }
        return output;
    }

    // ===== Projections =====

    /**
     * |F| of a CV_64FC2 spectrum as a new CV_64F Mat.
     */
    public static Mat magnitude(Mat spectrum) {
        List<Mat> planes = new ArrayList<>();
        Core.split(spectrum, planes);
        Mat magnitude = new Mat();
        Core.magnitude(planes.get(0), planes.get(1), magnitude);
        MatUtils.releaseAll(planes);
        return magnitude;
    }

    /**
     * Angle of F in (-pi, pi] as a new CV_64F Mat.
     * Core.phase() is not used: it returns [0, 2pi), which would change
     * weighted phase sums.
     */
    public static Mat phase(Mat spectrum) {
        double[] data = MatUtils.data(spectrum);
        double[] angles = new double[data.length / 2];
        for (int i = 0; i < angles.length; i++) {
            angles[i] = Math.atan2(data[2 * i + 1], data[2 * i]);
        }
        return MatUtils.fromData(spectrum.rows(), spectrum.cols(), CvType.CV_64FC1, angles);
    }

    public static Mat real(Mat spectrum) {
        return plane(spectrum, 0);
    }

    public static Mat imaginary(Mat spectrum) {
        return plane(spectrum, 1);
    }

    private static Mat plane(Mat spectrum, int index) {
        Mat plane = new Mat();
        Core.extractChannel(spectrum, plane, index);
        return plane;
    }

    /**
     * Combine real and imaginary planes into a new CV_64FC2 spectrum.
     */
    public static Mat complex(Mat real, Mat imaginary) {
        List<Mat> planes = new ArrayList<>();
        planes.add(real);
        planes.add(imaginary);
        Mat complex = new Mat();
        Core.merge(planes, complex);
        return complex;
    }
}
