package com.ttennebkram.ftmixer.spectrum;

import com.ttennebkram.ftmixer.model.ComponentType;
import com.ttennebkram.ftmixer.model.MixerException;
import com.ttennebkram.ftmixer.util.MatUtils;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * One input slot: a grayscale image and its lazily computed, cached spectrum.
 *
 * Any change to the image (load, resize, grayscale conversion, brightness/contrast)
 * drops the cached spectrum. The slot owns its Mats; callers receive copies.
 */
public class ImageSlot {

    // Luminosity weights, applied to OpenCV's BGR channel order
    private static final double LUMA_BLUE = 0.114;
    private static final double LUMA_GREEN = 0.587;
    private static final double LUMA_RED = 0.299;

    private final int index;

    private Mat image;
    private Mat originalImage;
    private Mat spectrum;
    private boolean dirty = true;
    private String sourcePath;

    public ImageSlot(int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    // ===== Loading =====

    /**
     * Load an image, converting colour input to grayscale.
     * The Mat may be 1, 3 (BGR) or 4 (BGRA) channels of any depth; it is copied.
     */
    public synchronized void load(Mat input) {
        if (input == null || input.empty()) {
            throw new MixerException(MixerException.Kind.NOT_LOADED, "Slot " + index + ": image is empty");
        }
        Mat gray = toGrayscale(input);
        replaceImage(gray);
        releaseMat(originalImage);
        originalImage = gray.clone();
        System.out.println("[ImageSlot] Slot " + index + " loaded " + MatUtils.shapeOf(gray)
            + " from " + input.channels() + " channel(s)");
    }

    public synchronized void load(Mat input, String path) {
        load(input);
        this.sourcePath = path;
    }

    public synchronized void setImage(double[][] values) {
        Mat mat = MatUtils.fromArray(values);
        try {
            load(mat);
        } finally {
            mat.release();
        }
    }

    /**
     * Luminosity conversion; single-channel input is only converted to CV_64F.
     */
    static Mat toGrayscale(Mat input) {
        Mat floatInput = new Mat();
        input.convertTo(floatInput, CvType.CV_64F);
        if (floatInput.channels() == 1) {
            return floatInput;
        }
        if (floatInput.channels() < 3) {
            floatInput.release();
            throw new MixerException(MixerException.Kind.NOT_LOADED,
                "Unsupported channel count: " + input.channels());
        }

        List<Mat> channels = new ArrayList<>();
        Core.split(floatInput, channels);
        floatInput.release();
        try {
            Mat gray = new Mat();
            Core.addWeighted(channels.get(0), LUMA_BLUE, channels.get(1), LUMA_GREEN, 0.0, gray);
            Core.scaleAdd(channels.get(2), LUMA_RED, gray, gray);
            return gray;
        } finally {
            MatUtils.releaseAll(channels);
        }
    }

    private void replaceImage(Mat newImage) {
        releaseMat(image);
        image = newImage;
        invalidate();
    }

    private void invalidate() {
        releaseMat(spectrum);
        spectrum = null;
        dirty = true;
    }

    // ===== Image edits =====

    /**
     * Resize to width x height with Lanczos resampling.
     */
    public synchronized void resize(int width, int height) {
        requireImage();
        if (width <= 0 || height <= 0) {
            throw new MixerException(MixerException.Kind.SHAPE_MISMATCH,
                "Target size must be positive, got " + width + "x" + height);
        }
        if (image.cols() == width && image.rows() == height) {
            return;
        }
        Mat resized = new Mat();
        Imgproc.resize(image, resized, new Size(width, height), 0, 0, Imgproc.INTER_LANCZOS4);
        replaceImage(resized);
        System.out.println("[ImageSlot] Slot " + index + " resized to " + width + "x" + height);
    }

    /**
     * x' = clamp(x * contrast + brightness, 0, 255), applied to the stored image.
     */
    public synchronized void applyBrightnessContrast(double brightness, double contrast) {
        requireImage();
        Mat adjusted = new Mat();
        image.convertTo(adjusted, CvType.CV_64F, contrast, brightness);
        Core.min(adjusted, new Scalar(255.0), adjusted);
        Core.max(adjusted, new Scalar(0.0), adjusted);
        replaceImage(adjusted);
    }

    public synchronized void resetToOriginal() {
        if (originalImage == null) {
            System.out.println("[ImageSlot] Slot " + index + ": no original image to reset to");
            return;
        }
        replaceImage(originalImage.clone());
    }

    public synchronized void clear() {
        releaseMat(image);
        releaseMat(originalImage);
        image = null;
        originalImage = null;
        sourcePath = null;
        invalidate();
    }

    // ===== Spectrum =====

    /**
     * Centered 2D DFT of the image, cached until the image changes.
     *
     * @param force recompute even if a valid cache exists
     * @return the cached spectrum (owned by this slot; do not release)
     */
    public synchronized Mat computeSpectrum(boolean force) {
        requireImage();
        if (spectrum != null && !dirty && !force) {
            return spectrum;
        }
        releaseMat(spectrum);
        spectrum = SpectrumTransforms.forward(image);
        dirty = false;
        return spectrum;
    }

    public Mat computeSpectrum() {
        return computeSpectrum(false);
    }

    /**
     * The cached spectrum (owned by this slot).
     */
    public synchronized Mat getSpectrum() {
        requireSpectrum();
        return spectrum;
    }

    public synchronized Mat magnitude() {
        requireSpectrum();
        return SpectrumTransforms.magnitude(spectrum);
    }

    public synchronized Mat phase() {
        requireSpectrum();
        return SpectrumTransforms.phase(spectrum);
    }

    public synchronized Mat real() {
        requireSpectrum();
        return SpectrumTransforms.real(spectrum);
    }

    public synchronized Mat imaginary() {
        requireSpectrum();
        return SpectrumTransforms.imaginary(spectrum);
    }

    public Mat component(ComponentType type) {
        switch (type) {
            case MAGNITUDE: return magnitude();
            case PHASE: return phase();
            case REAL: return real();
            case IMAGINARY: return imaginary();
            default: throw new MixerException(MixerException.Kind.INVALID_COMPONENT, "Unknown component " + type);
        }
    }

    // ===== State =====

    public synchronized boolean isLoaded() {
        return image != null;
    }

    public synchronized boolean hasSpectrum() {
        return spectrum != null && !dirty;
    }

    /**
     * Copy of the current grayscale image.
     */
    public synchronized Mat getImage() {
        requireImage();
        return image.clone();
    }

    public synchronized double[][] getImageArray() {
        requireImage();
        return MatUtils.toArray(image);
    }

    public synchronized int rows() {
        requireImage();
        return image.rows();
    }

    public synchronized int cols() {
        requireImage();
        return image.cols();
    }

    /**
     * {rows, cols} of the current image.
     */
    public synchronized int[] shape() {
        requireImage();
        return new int[] {image.rows(), image.cols()};
    }

    public synchronized String getSourcePath() {
        return sourcePath;
    }

    private void requireImage() {
        if (image == null) {
            throw new MixerException(MixerException.Kind.NOT_LOADED,
                "No image loaded in slot " + index + ". Load an image first.");
        }
    }

    private void requireSpectrum() {
        if (spectrum == null || dirty) {
            throw new MixerException(MixerException.Kind.SPECTRUM_NOT_COMPUTED,
                "FFT not computed for slot " + index + ". Call computeSpectrum() first.");
        }
    }

    private static void releaseMat(Mat mat) {
        if (mat != null) {
            mat.release();
        }
    }

    @Override
    public synchronized String toString() {
        if (image == null) {
            return "ImageSlot(" + index + ", no image loaded)";
        }
        return "ImageSlot(" + index + ", shape=" + MatUtils.shapeOf(image)
            + (sourcePath != null ? ", path='" + sourcePath + "'" : "") + ")";
    }
}
