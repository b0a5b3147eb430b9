package com.ttennebkram.ftmixer.serialization;

import com.ttennebkram.ftmixer.model.ComponentType;
import com.ttennebkram.ftmixer.model.MagnitudePhaseSettings;
import com.ttennebkram.ftmixer.model.MixMode;
import com.ttennebkram.ftmixer.model.MixSettings;
import com.ttennebkram.ftmixer.model.MixerException;
import com.ttennebkram.ftmixer.model.RealImaginarySettings;
import com.ttennebkram.ftmixer.model.RegionConfig;
import com.ttennebkram.ftmixer.model.WeightVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A mix request addressed by slot index, before it is narrowed to the slots
 * that are actually loaded.
 *
 * Weight vectors hold one entry per slot (not per active slot);
 * {@link #toSettings(List)} picks out the entries of the slots that take part.
 */
public class MixRequest {

    private final List<Integer> activeSlots;
    private final MixMode mode;
    private final Map<ComponentType, double[]> slotWeights;
    private final RegionConfig region;
    private final int outputPort;

    /**
     * @param activeSlots slot indices to mix, or null to use every loaded slot
     */
    public MixRequest(List<Integer> activeSlots, MixMode mode, Map<ComponentType, double[]> slotWeights,
                      RegionConfig region, int outputPort) {
        this.activeSlots = activeSlots != null ? Collections.unmodifiableList(new ArrayList<>(activeSlots)) : null;
        this.mode = mode;
        this.slotWeights = new EnumMap<>(ComponentType.class);
        for (Map.Entry<ComponentType, double[]> entry : slotWeights.entrySet()) {
            this.slotWeights.put(entry.getKey(), entry.getValue().clone());
        }
        this.region = region != null ? region : RegionConfig.disabled();
        this.outputPort = outputPort;
    }

    public boolean hasActiveSlots() {
        return activeSlots != null;
    }

    /**
     * Requested slot indices, or null when the request names none.
     */
    public List<Integer> getActiveSlots() {
        return activeSlots;
    }

    public MixMode getMode() {
        return mode;
    }

    public RegionConfig getRegion() {
        return region;
    }

    public int getOutputPort() {
        return outputPort;
    }

    /**
     * Per-slot weights for a component, or null if the request carries none.
     */
    public double[] getSlotWeights(ComponentType component) {
        double[] weights = slotWeights.get(component);
        return weights != null ? weights.clone() : null;
    }

    /**
     * Settings for the given slots, in the given order.
     *
     * @param slots indices of the slots whose spectra will be mixed
     */
    public MixSettings toSettings(List<Integer> slots) {
        if (slots.isEmpty()) {
            throw new MixerException(MixerException.Kind.NO_ACTIVE_SLOTS, "No images loaded in active slots");
        }
        WeightVector first = select(mode.getFirstComponent(), slots);
        WeightVector second = select(mode.getSecondComponent(), slots);
        if (mode == MixMode.MAGNITUDE_PHASE) {
            return new MagnitudePhaseSettings(slots.size(), first, second, region, outputPort);
        }
        return new RealImaginarySettings(slots.size(), first, second, region, outputPort);
    }

    private WeightVector select(ComponentType component, List<Integer> slots) {
        double[] all = slotWeights.get(component);
        if (all == null) {
            throw new MixerException(MixerException.Kind.INVALID_WEIGHT,
                "Missing " + component.getKey() + " weights");
        }
        double[] selected = new double[slots.size()];
        for (int i = 0; i < slots.size(); i++) {
            int slot = slots.get(i);
            if (slot < 0 || slot >= all.length) {
                throw new MixerException(MixerException.Kind.INVALID_WEIGHT,
                    "No " + component.getKey() + " weight for slot " + slot + " (got " + all.length + " weights)");
            }
            selected[i] = all[slot];
        }
        return WeightVector.of(selected);
    }

    @Override
    public String toString() {
        return "MixRequest[slots=" + activeSlots + ", mode=" + mode.getKey() + ", region=" + region
            + ", port=" + outputPort + "]";
    }
}
