package com.ttennebkram.ftmixer.processing;

import com.ttennebkram.ftmixer.spectrum.SpectrumTransforms;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Turns a centered spectrum back into a displayable image.
 * The steps are public so a job can report progress between them.
 */
public class InverseTransformPipeline {

    public static final double OUTPUT_MAX = 255.0;

    /**
     * unshift, inverse DFT, real part, normalize to [0,255].
     *
     * @return new CV_64F Mat
     */
    public Mat reconstruct(Mat centeredSpectrum) {
        Mat uncentered = unshift(centeredSpectrum);
        Mat spatial = inverse(uncentered);
        uncentered.release();
        Mat normalized = normalize(spatial);
        spatial.release();
        return normalized;
    }

    public Mat unshift(Mat centeredSpectrum) {
        return SpectrumTransforms.ifftShift(centeredSpectrum);
    }

    /**
     * Inverse DFT of an uncentered spectrum; returns the real part.
     */
    public Mat inverse(Mat uncenteredSpectrum) {
        return SpectrumTransforms.inverse(uncenteredSpectrum);
    }

    /**
     * Subtract the minimum, then scale so the maximum is 255.
     * A flat input stays all zero.
     */
    public Mat normalize(Mat spatial) {
        Core.MinMaxLocResult range = Core.minMaxLoc(spatial);
        Mat shifted = new Mat();
        Core.subtract(spatial, new Scalar(range.minVal), shifted);
        if (shifted.type() != CvType.CV_64F) {
            shifted.convertTo(shifted, CvType.CV_64F);
        }

        double max = range.maxVal - range.minVal;
        if (max > 0) {
            Core.multiply(shifted, new Scalar(OUTPUT_MAX / max), shifted);
        } else {
            shifted.setTo(new Scalar(0.0));
        }
        return shifted;
    }
}
