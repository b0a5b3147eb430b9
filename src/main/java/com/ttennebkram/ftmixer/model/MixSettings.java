package com.ttennebkram.ftmixer.model;

/**
 * Validated configuration of one mix.
 * Each mode has its own subclass naming the two weight vectors it blends;
 * both vectors always have one entry per active slot.
 */
public abstract class MixSettings {

    public static final int OUTPUT_PORT_COUNT = 2;

    private final int slotCount;
    private final WeightVector first;
    private final WeightVector second;
    private final RegionConfig region;
    private final int outputPort;

    protected MixSettings(int slotCount, WeightVector first, WeightVector second,
                          RegionConfig region, int outputPort) {
        if (slotCount <= 0) {
            throw new MixerException(MixerException.Kind.NO_ACTIVE_SLOTS,
                "At least one active slot is required");
        }
        if (outputPort < 0 || outputPort >= OUTPUT_PORT_COUNT) {
            throw new MixerException(MixerException.Kind.INVALID_PORT,
                "Output port must be 0 or 1, got: " + outputPort);
        }
        this.slotCount = slotCount;
        this.first = checkLength(first, slotCount, getMode().getFirstComponent());
        this.second = checkLength(second, slotCount, getMode().getSecondComponent());
        this.region = region != null ? region : RegionConfig.disabled();
        this.outputPort = outputPort;
    }

    private static WeightVector checkLength(WeightVector weights, int slotCount, ComponentType component) {
        if (weights == null) {
            return WeightVector.zeros(slotCount);
        }
        if (weights.size() != slotCount) {
            throw new MixerException(MixerException.Kind.INVALID_WEIGHT,
                "Must provide exactly " + slotCount + " " + component.getKey()
                    + " weights (matching number of active images), got " + weights.size());
        }
        return weights;
    }

    public abstract MixMode getMode();

    /**
     * Returns a copy of these settings sending the result to another port.
     */
    public abstract MixSettings withOutputPort(int port);

    public int getSlotCount() {
        return slotCount;
    }

    public RegionConfig getRegion() {
        return region;
    }

    public int getOutputPort() {
        return outputPort;
    }

    protected WeightVector getFirstWeights() {
        return first;
    }

    protected WeightVector getSecondWeights() {
        return second;
    }

    /**
     * Weights for a component used by this mode.
     */
    public WeightVector getWeights(ComponentType component) {
        if (component == getMode().getFirstComponent()) {
            return first;
        }
        if (component == getMode().getSecondComponent()) {
            return second;
        }
        throw new MixerException(MixerException.Kind.INVALID_COMPONENT,
            component.getKey() + " weights are not used in " + getMode().getKey() + " mode");
    }

    /**
     * Sum of every weight this mode looks at. Zero means the mix carries no signal.
     */
    public double totalWeight() {
        return first.sum() + second.sum();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getMode().getFirstComponent().getKey() + "=" + first
            + ", " + getMode().getSecondComponent().getKey() + "=" + second
            + ", region=" + region + ", port=" + outputPort + "]";
    }
}
