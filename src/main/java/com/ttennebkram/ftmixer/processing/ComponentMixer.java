package com.ttennebkram.ftmixer.processing;

import com.ttennebkram.ftmixer.model.ComponentType;
import com.ttennebkram.ftmixer.model.MagnitudePhaseSettings;
import com.ttennebkram.ftmixer.model.MixSettings;
import com.ttennebkram.ftmixer.model.MixerException;
import com.ttennebkram.ftmixer.model.RealImaginarySettings;
import com.ttennebkram.ftmixer.model.RegionConfig;
import com.ttennebkram.ftmixer.model.RegionType;
import com.ttennebkram.ftmixer.model.WeightVector;
import com.ttennebkram.ftmixer.spectrum.SpectrumTransforms;
import com.ttennebkram.ftmixer.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;

/**
 * Blends the centered spectra of the active slots into one spectrum.
 *
 * Spectra are CV_64FC2 Mats of identical shape, in slot order matching the
 * weight vectors. Inputs are never modified; every method returns a new Mat.
 */
public class ComponentMixer {

    private final FrequencyMaskGenerator maskGenerator;

    public ComponentMixer() {
        this(new FrequencyMaskGenerator());
    }

    public ComponentMixer(FrequencyMaskGenerator maskGenerator) {
        this.maskGenerator = maskGenerator;
    }

    /**
     * Check that spectra and settings can be mixed together.
     * Called before a job starts so errors surface at the caller.
     */
    public void validate(List<Mat> spectra, MixSettings settings) {
        if (spectra == null || spectra.isEmpty()) {
            throw new MixerException(MixerException.Kind.NO_ACTIVE_SLOTS, "No images loaded with FFT computed.");
        }
        if (settings.getSlotCount() != spectra.size()) {
            throw new MixerException(MixerException.Kind.INVALID_WEIGHT,
                "Must provide exactly " + spectra.size() + " weights (matching number of active images), got "
                    + settings.getSlotCount());
        }
        for (Mat spectrum : spectra) {
            if (spectrum == null || spectrum.empty()) {
                throw new MixerException(MixerException.Kind.SPECTRUM_NOT_COMPUTED, "Active slot has no spectrum");
            }
            if (spectrum.type() != CvType.CV_64FC2) {
                throw new MixerException(MixerException.Kind.SPECTRUM_NOT_COMPUTED,
                    "Spectrum must be CV_64FC2, got " + CvType.typeToString(spectrum.type()));
            }
        }
        MatUtils.requireSameShape(spectra);
    }

    /**
     * Mix according to the settings' mode.
     *
     * @return new CV_64FC2 spectrum of the common shape
     */
    public Mat mix(List<Mat> spectra, MixSettings settings) {
        validate(spectra, settings);
        int rows = spectra.get(0).rows();
        int cols = spectra.get(0).cols();

        if (settings.totalWeight() == 0.0) {
            // No signal: a black image, not an error
            return Mat.zeros(rows, cols, CvType.CV_64FC2);
        }

        if (settings instanceof MagnitudePhaseSettings) {
            MagnitudePhaseSettings mp = (MagnitudePhaseSettings) settings;
            if (mp.hasEqualWeights()) {
                return mixDirect(spectra, mp.getMagnitudeWeights(), mp.getRegion(),
                    mp.getRegion().getType(ComponentType.MAGNITUDE));
            }
            return mixPolar(spectra, mp.getMagnitudeWeights(), mp.getPhaseWeights(), mp.getRegion());
        }
        RealImaginarySettings ri = (RealImaginarySettings) settings;
        return mixCartesian(spectra, ri.getRealWeights(), ri.getImaginaryWeights(), ri.getRegion());
    }

    /**
     * Sum(w_i * F_i), then one mask over both planes.
     * Used when magnitude and phase share the same weights.
     */
    public Mat mixDirect(List<Mat> spectra, WeightVector weights, RegionConfig region, RegionType maskType) {
        Mat first = spectra.get(0);
        Mat mixed = Mat.zeros(first.rows(), first.cols(), CvType.CV_64FC2);
        for (int i = 0; i < spectra.size(); i++) {
            double w = weights.get(i);
            if (w > 0) {
                Core.scaleAdd(spectra.get(i), w, mixed, mixed);
            }
        }

        if (!region.isEnabled()) {
            return mixed;
        }

        Mat mask = maskGenerator.buildMask(first.rows(), first.cols(), region, maskType);
        List<Mat> planes = new ArrayList<>();
        Core.split(mixed, planes);
        mixed.release();
        Core.multiply(planes.get(0), mask, planes.get(0));
        Core.multiply(planes.get(1), mask, planes.get(1));
        mask.release();

        Mat masked = new Mat();
        Core.merge(planes, masked);
        MatUtils.releaseAll(planes);
        return masked;
    }

    /**
     * Separate magnitude and phase blends, recombined as M * exp(iP).
     *
     * The phase mask multiplies the accumulated phase, so bins outside the
     * phase region keep their magnitude with zero phase rather than being
     * dropped.
     */
    public Mat mixPolar(List<Mat> spectra, WeightVector magnitudeWeights, WeightVector phaseWeights,
                        RegionConfig region) {
        Mat first = spectra.get(0);
        int rows = first.rows();
        int cols = first.cols();

        Mat mixedMagnitude = Mat.zeros(rows, cols, CvType.CV_64F);
        Mat mixedPhase = Mat.zeros(rows, cols, CvType.CV_64F);

        for (int i = 0; i < spectra.size(); i++) {
            double w = magnitudeWeights.get(i);
            if (w > 0) {
                Mat magnitude = SpectrumTransforms.magnitude(spectra.get(i));
                Core.scaleAdd(magnitude, w, mixedMagnitude, mixedMagnitude);
                magnitude.release();
            }
        }
        for (int i = 0; i < spectra.size(); i++) {
            double w = phaseWeights.get(i);
            if (w > 0) {
                Mat phase = SpectrumTransforms.phase(spectra.get(i));
                Core.scaleAdd(phase, w, mixedPhase, mixedPhase);
                phase.release();
            }
        }

        applyMask(mixedMagnitude, region, ComponentType.MAGNITUDE);
        applyMask(mixedPhase, region, ComponentType.PHASE);

        // polarToCart is avoided for its reduced precision
        double[] magnitude = MatUtils.data(mixedMagnitude);
        double[] phase = MatUtils.data(mixedPhase);
        mixedMagnitude.release();
        mixedPhase.release();

        double[] complex = new double[magnitude.length * 2];
        for (int i = 0; i < magnitude.length; i++) {
            complex[2 * i] = magnitude[i] * Math.cos(phase[i]);
            complex[2 * i + 1] = magnitude[i] * Math.sin(phase[i]);
        }
        return MatUtils.fromData(rows, cols, CvType.CV_64FC2, complex);
    }

    /**
     * Separate real and imaginary blends, recombined as R + iI.
     */
    public Mat mixCartesian(List<Mat> spectra, WeightVector realWeights, WeightVector imaginaryWeights,
                            RegionConfig region) {
        Mat first = spectra.get(0);
        Mat mixedReal = Mat.zeros(first.rows(), first.cols(), CvType.CV_64F);
        Mat mixedImaginary = Mat.zeros(first.rows(), first.cols(), CvType.CV_64F);

        for (int i = 0; i < spectra.size(); i++) {
            double w = realWeights.get(i);
            if (w > 0) {
                Mat real = SpectrumTransforms.real(spectra.get(i));
                Core.scaleAdd(real, w, mixedReal, mixedReal);
                real.release();
            }
        }
        for (int i = 0; i < spectra.size(); i++) {
            double w = imaginaryWeights.get(i);
            if (w > 0) {
                Mat imaginary = SpectrumTransforms.imaginary(spectra.get(i));
                Core.scaleAdd(imaginary, w, mixedImaginary, mixedImaginary);
                imaginary.release();
            }
        }

        applyMask(mixedReal, region, ComponentType.REAL);
        applyMask(mixedImaginary, region, ComponentType.IMAGINARY);

        Mat mixed = SpectrumTransforms.complex(mixedReal, mixedImaginary);
        mixedReal.release();
        mixedImaginary.release();
        return mixed;
    }

    private void applyMask(Mat plane, RegionConfig region, ComponentType component) {
        if (!region.isEnabled()) {
            return;
        }
        Mat mask = maskGenerator.buildMask(plane.rows(), plane.cols(), region, component);
        Core.multiply(plane, mask, plane);
        mask.release();
    }
}
