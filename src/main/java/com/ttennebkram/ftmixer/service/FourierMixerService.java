package com.ttennebkram.ftmixer.service;

import com.google.gson.JsonObject;
import com.ttennebkram.ftmixer.config.MixerConfig;
import com.ttennebkram.ftmixer.job.MixCallback;
import com.ttennebkram.ftmixer.job.MixJob;
import com.ttennebkram.ftmixer.job.MixJobController;
import com.ttennebkram.ftmixer.job.OutputPorts;
import com.ttennebkram.ftmixer.model.ComponentType;
import com.ttennebkram.ftmixer.model.MixResult;
import com.ttennebkram.ftmixer.model.MixSettings;
import com.ttennebkram.ftmixer.model.MixerException;
import com.ttennebkram.ftmixer.processing.DisplayNormalizer;
import com.ttennebkram.ftmixer.processing.FrequencyMaskGenerator;
import com.ttennebkram.ftmixer.serialization.MixRequest;
import com.ttennebkram.ftmixer.serialization.MixRequestParser;
import com.ttennebkram.ftmixer.serialization.MixerJson;
import com.ttennebkram.ftmixer.spectrum.ImageSlot;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for everything the mixer can do: manages the input slots,
 * their display settings, mix jobs and output ports.
 *
 * Slots are numbered from 0. Adjustment targets 0..3 address input slots and
 * 4..5 address output ports 0..1.
 */
public class FourierMixerService {

    public static final int FIRST_OUTPUT_TARGET = 4;

    private final MixerConfig config;
    private final ImageSlot[] slots;
    private final MixJobController controller;
    private final MixRequestParser parser;
    private final DisplayNormalizer normalizer = new DisplayNormalizer();
    private final FrequencyMaskGenerator maskGenerator = new FrequencyMaskGenerator();

    // [slot][component] -> {brightness, contrast}
    private final List<Map<ComponentType, double[]>> componentAdjustments = new ArrayList<>();

    public FourierMixerService() {
        this(MixerConfig.load());
    }

    public FourierMixerService(MixerConfig config) {
        this(config, new MixJobController(config));
    }

    public FourierMixerService(MixerConfig config, MixJobController controller) {
        this.config = config;
        this.controller = controller;
        this.parser = new MixRequestParser(config);
        this.slots = new ImageSlot[config.getSlotCount()];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = new ImageSlot(i);
            componentAdjustments.add(defaultAdjustments());
        }
    }

    private static Map<ComponentType, double[]> defaultAdjustments() {
        Map<ComponentType, double[]> map = new EnumMap<>(ComponentType.class);
        for (ComponentType type : ComponentType.values()) {
            map.put(type, new double[] {0.0, 1.0});
        }
        return map;
    }

    // ===== Loading =====

    public ImageSlot loadImage(int slot, Path path) {
        ImageSlot target = slot(slot);
        if (!Files.isRegularFile(path)) {
            throw new MixerException(MixerException.Kind.IO_ERROR, "Image file not found: " + path);
        }
        Mat decoded = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_COLOR);
        if (decoded.empty()) {
            decoded.release();
            throw new MixerException(MixerException.Kind.IO_ERROR, "Could not decode image: " + path);
        }
        try {
            target.load(decoded, path.toString());
        } finally {
            decoded.release();
        }
        return target;
    }

    public ImageSlot loadImage(int slot, Mat image) {
        ImageSlot target = slot(slot);
        target.load(image);
        return target;
    }

    public ImageSlot loadImage(int slot, double[][] values) {
        ImageSlot target = slot(slot);
        target.setImage(values);
        return target;
    }

    /**
     * Resize every loaded slot to the smallest width and smallest height among them,
     * then compute their spectra.
     *
     * @return {width, height}
     */
    public int[] resizeAllToSmallest() {
        List<ImageSlot> loaded = loadedSlots();
        if (loaded.isEmpty()) {
            throw new MixerException(MixerException.Kind.NOT_LOADED, "No images loaded");
        }
        int width = Integer.MAX_VALUE;
        int height = Integer.MAX_VALUE;
        for (ImageSlot s : loaded) {
            width = Math.min(width, s.cols());
            height = Math.min(height, s.rows());
        }
        for (ImageSlot s : loaded) {
            s.resize(width, height);
            s.computeSpectrum();
        }
        System.out.println("[FourierMixerService] " + loaded.size() + " image(s) at " + width + "x" + height
            + ", spectra computed");
        return new int[] {width, height};
    }

    // ===== Views =====

    /**
     * 8-bit view of a slot's current image.
     */
    public Mat imageView(int slot) {
        Mat image = slot(slot).getImage();
        Mat scaled = normalizer.normalizeForDisplay(image, DisplayNormalizer.DISPLAY_MIN, DisplayNormalizer.DISPLAY_MAX);
        image.release();
        Mat bytes = normalizer.toBytes(scaled);
        scaled.release();
        return bytes;
    }

    /**
     * 8-bit view of one spectrum component, using the slot's display adjustment for it.
     */
    public Mat componentView(int slot, ComponentType type) {
        ImageSlot target = slot(slot);
        double[] adjustment = adjustment(slot, type);
        Mat raw = target.component(type);
        try {
            return normalizer.prepare(raw, type, adjustment[0], adjustment[1]);
        } finally {
            raw.release();
        }
    }

    public Map<ComponentType, Mat> allComponentViews(int slot) {
        Map<ComponentType, Mat> views = new EnumMap<>(ComponentType.class);
        for (ComponentType type : ComponentType.values()) {
            views.put(type, componentView(slot, type));
        }
        return views;
    }

    /**
     * Change how a component is displayed. The spectrum itself is not touched.
     */
    public Mat setComponentDisplayAdjustment(int slot, ComponentType type, double brightness, double contrast) {
        ImageSlot target = slot(slot);
        if (!target.hasSpectrum()) {
            throw new MixerException(MixerException.Kind.SPECTRUM_NOT_COMPUTED,
                "FFT not computed for slot " + slot);
        }
        synchronized (componentAdjustments) {
            componentAdjustments.get(slot).put(type, new double[] {brightness, contrast});
        }
        return componentView(slot, type);
    }

    public double[] getComponentDisplayAdjustment(int slot, ComponentType type) {
        slot(slot);
        return adjustment(slot, type).clone();
    }

    private double[] adjustment(int slot, ComponentType type) {
        synchronized (componentAdjustments) {
            return componentAdjustments.get(slot).get(type);
        }
    }

    /**
     * Brightness/contrast on an input image (targets 0..3, drops its spectrum)
     * or on an output port (targets 4..5).
     *
     * @return 8-bit view of the adjusted image
     */
    public Mat applyBrightnessContrast(int target, double brightness, double contrast) {
        if (target >= 0 && target < slots.length) {
            slots[target].applyBrightnessContrast(brightness, contrast);
            return imageView(target);
        }
        if (target >= FIRST_OUTPUT_TARGET && target < FIRST_OUTPUT_TARGET + MixSettings.OUTPUT_PORT_COUNT) {
            int port = target - FIRST_OUTPUT_TARGET;
            controller.getOutputPorts().adjust(port, brightness, contrast);
            return outputView(port);
        }
        throw new MixerException(MixerException.Kind.INVALID_SLOT,
            "Invalid adjustment target " + target + ". Must be 0-" + (slots.length - 1)
                + " for images or " + FIRST_OUTPUT_TARGET + "-" + (FIRST_OUTPUT_TARGET + 1) + " for outputs");
    }

    public void resetToOriginal(int slot) {
        slot(slot).resetToOriginal();
    }

    // ===== Mixing =====

    public MixRequest parseRequest(String json) {
        return parser.parse(json);
    }

    /**
     * Run a mix and wait for it.
     */
    public MixResult mix(MixRequest request) {
        List<Integer> active = resolveSlots(request);
        MixSettings settings = request.toSettings(active);
        return controller.run(spectra(active), settings);
    }

    public MixResult mix(String json) {
        return mix(parser.parse(json));
    }

    /**
     * Start a mix in the background, cancelling one that is still running.
     */
    public MixJob mixAsync(MixRequest request, MixCallback callback) {
        List<Integer> active = resolveSlots(request);
        MixSettings settings = request.toSettings(active);
        return controller.start(spectra(active), settings, callback);
    }

    /**
     * Requested slots that hold an image, or every loaded slot when the request names none.
     */
    List<Integer> resolveSlots(MixRequest request) {
        List<Integer> requested = request.hasActiveSlots() ? request.getActiveSlots() : allSlotIndices();
        List<Integer> active = new ArrayList<>();
        for (int index : requested) {
            if (slot(index).isLoaded()) {
                active.add(index);
            }
        }
        if (active.isEmpty()) {
            throw new MixerException(MixerException.Kind.NO_ACTIVE_SLOTS, "No images loaded in active slots");
        }
        return active;
    }

    private List<Mat> spectra(List<Integer> active) {
        List<Mat> spectra = new ArrayList<>(active.size());
        for (int index : active) {
            spectra.add(slots[index].computeSpectrum());
        }
        return spectra;
    }

    public int progress() {
        return controller.getProgress();
    }

    public boolean isProcessing() {
        return controller.isProcessing();
    }

    public boolean cancel() {
        return controller.cancel();
    }

    public String getLastError() {
        return controller.getLastError();
    }

    /**
     * Raw copy of an output port (CV_64F, 0..255), or null if it is empty.
     */
    public Mat output(int port) {
        return controller.output(port);
    }

    public Mat outputView(int port) {
        Mat output = output(port);
        if (output == null) {
            throw new MixerException(MixerException.Kind.NOT_LOADED, "No output in port " + port + " yet");
        }
        Mat scaled = normalizer.normalizeForDisplay(output, DisplayNormalizer.DISPLAY_MIN, DisplayNormalizer.DISPLAY_MAX);
        output.release();
        Mat bytes = normalizer.toBytes(scaled);
        scaled.release();
        return bytes;
    }

    /**
     * 8-bit view of the mask a request would apply to one component.
     */
    public Mat maskView(MixRequest request, ComponentType component) {
        ImageSlot reference = slots[resolveSlots(request).get(0)];
        Mat mask = maskGenerator.buildMask(reference.rows(), reference.cols(), request.getRegion(), component);
        try {
            return maskGenerator.toDisplay(mask);
        } finally {
            mask.release();
        }
    }

    // ===== State =====

    public List<Integer> loadedSlotIndices() {
        List<Integer> indices = new ArrayList<>();
        for (ImageSlot s : slots) {
            if (s.isLoaded()) {
                indices.add(s.getIndex());
            }
        }
        return indices;
    }

    public List<Integer> spectrumSlotIndices() {
        List<Integer> indices = new ArrayList<>();
        for (ImageSlot s : slots) {
            if (s.hasSpectrum()) {
                indices.add(s.getIndex());
            }
        }
        return indices;
    }

    public JsonObject status() {
        OutputPorts ports = controller.getOutputPorts();
        boolean[] filled = new boolean[MixSettings.OUTPUT_PORT_COUNT];
        for (int i = 0; i < filled.length; i++) {
            filled[i] = ports.has(i);
        }
        return MixerJson.status(loadedSlotIndices(), spectrumSlotIndices(), controller.isProcessing(), filled);
    }

    /**
     * Clear every slot, output and display setting; cancels a running job.
     */
    public void reset() {
        controller.reset();
        for (ImageSlot s : slots) {
            s.clear();
        }
        synchronized (componentAdjustments) {
            for (int i = 0; i < componentAdjustments.size(); i++) {
                componentAdjustments.set(i, defaultAdjustments());
            }
        }
        System.out.println("[FourierMixerService] Reset");
    }

    public ImageSlot slot(int index) {
        if (index < 0 || index >= slots.length) {
            throw new MixerException(MixerException.Kind.INVALID_SLOT,
                "Invalid image index. Must be 0-" + (slots.length - 1) + ", got: " + index);
        }
        return slots[index];
    }

    public int getSlotCount() {
        return slots.length;
    }

    public MixerConfig getConfig() {
        return config;
    }

    public MixJobController getController() {
        return controller;
    }

    private List<ImageSlot> loadedSlots() {
        List<ImageSlot> loaded = new ArrayList<>();
        for (ImageSlot s : slots) {
            if (s.isLoaded()) {
                loaded.add(s);
            }
        }
        return loaded;
    }

    private List<Integer> allSlotIndices() {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < slots.length; i++) {
            indices.add(i);
        }
        return indices;
    }
}
