package com.ttennebkram.ftmixer.processing;

import com.ttennebkram.ftmixer.TestImages;
import com.ttennebkram.ftmixer.model.MagnitudePhaseSettings;
import com.ttennebkram.ftmixer.model.MixSettings;
import com.ttennebkram.ftmixer.model.RegionConfig;
import com.ttennebkram.ftmixer.model.RegionType;
import com.ttennebkram.ftmixer.model.WeightVector;
import com.ttennebkram.ftmixer.spectrum.SpectrumTransforms;
import com.ttennebkram.ftmixer.util.OpenCVLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Perceptual behaviour of whole mixes, measured on synthetic images.
 */
class MixingPropertiesTest {

    private final ComponentMixer mixer = new ComponentMixer();
    private final InverseTransformPipeline pipeline = new InverseTransformPipeline();

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.load();
    }

    private Mat mixAndReconstruct(List<Mat> images, MixSettings settings) {
        Mat[] spectra = new Mat[images.size()];
        for (int i = 0; i < spectra.length; i++) {
            spectra[i] = SpectrumTransforms.forward(images.get(i));
        }
        Mat mixed = mixer.mix(Arrays.asList(spectra), settings);
        return pipeline.reconstruct(mixed);
    }

    // --- Phase dominance ---

    @Test
    void smoothBlobMagnitudeWithTexturePhaseLooksLikeTexture() {
        Mat blob = TestImages.blurredDelta(256, 256, 2.0);
        Mat texture = TestImages.blurredNoise(256, 256, 2024, 2.0);
        MagnitudePhaseSettings settings = new MagnitudePhaseSettings(
            WeightVector.of(1, 0), WeightVector.of(0, 1), RegionConfig.disabled());

        Mat output = mixAndReconstruct(Arrays.asList(blob, texture), settings);

        assertEquals(256, output.rows());
        assertEquals(256, output.cols());
        assertTrue(TestImages.correlation(output, texture) > 0.8);
        assertTrue(Math.abs(TestImages.correlation(output, blob)) < 0.5);
    }

    @Test
    void phaseDecidesWhichImageIsRecognised() {
        Mat first = TestImages.blurredNoise(64, 64, 1, 1.5);
        Mat second = TestImages.blurredNoise(64, 64, 2, 1.5);
        MagnitudePhaseSettings settings = new MagnitudePhaseSettings(
            WeightVector.of(1, 0), WeightVector.of(0, 1), RegionConfig.disabled());

        Mat output = mixAndReconstruct(Arrays.asList(first, second), settings);

        double toPhaseSource = TestImages.correlation(output, second);
        double toMagnitudeSource = TestImages.correlation(output, first);
        assertTrue(toPhaseSource > toMagnitudeSource + 0.3,
            "phase source r=" + toPhaseSource + ", magnitude source r=" + toMagnitudeSource);
    }

    // --- Weighting ---

    @Test
    void moreWeightMeansMoreResemblance() {
        Mat first = TestImages.blurredNoise(48, 48, 10, 1.0);
        Mat second = TestImages.blurredNoise(48, 48, 20, 1.0);
        double previous = Double.NEGATIVE_INFINITY;
        for (double w : new double[] {0.0, 0.25, 0.5, 0.75, 1.0}) {
            WeightVector weights = WeightVector.of(w, 1 - w);
            MagnitudePhaseSettings settings = new MagnitudePhaseSettings(weights, weights, RegionConfig.disabled());
            double r = TestImages.correlation(mixAndReconstruct(Arrays.asList(first, second), settings), first);
            assertTrue(r > previous, "correlation did not increase at w=" + w + ": " + r + " <= " + previous);
            previous = r;
        }
        assertEquals(1.0, previous, 1e-9);
    }

    // --- Region filtering ---

    @Test
    void innerRegionSmoothsAndOuterRegionSharpens() {
        List<Mat> images = Collections.singletonList(TestImages.twoScale(64));
        WeightVector one = WeightVector.of(1);

        double inner = TestImages.meanSobel(mixAndReconstruct(images,
            new MagnitudePhaseSettings(one, one, RegionConfig.centered(0.3, RegionType.INNER))));
        double full = TestImages.meanSobel(mixAndReconstruct(images,
            new MagnitudePhaseSettings(one, one, RegionConfig.disabled())));
        double outer = TestImages.meanSobel(mixAndReconstruct(images,
            new MagnitudePhaseSettings(one, one, RegionConfig.centered(0.3, RegionType.OUTER))));

        assertTrue(inner < full, "inner " + inner + " >= full " + full);
        assertTrue(full < outer, "full " + full + " >= outer " + outer);
    }

    @Test
    void outerRegionRemovesSlowPartEntirely() {
        Mat image = TestImages.twoScale(64);
        WeightVector one = WeightVector.of(1);
        Mat outer = mixAndReconstruct(Collections.singletonList(image),
            new MagnitudePhaseSettings(one, one, RegionConfig.centered(0.3, RegionType.OUTER)));

        // only the 20- and 22-cycle cosines survive, so columns repeat every 16 pixels
        double[] a = outer.get(5, 3);
        double[] b = outer.get(5, 19);
        assertEquals(a[0], b[0], 1e-6);
    }
}
