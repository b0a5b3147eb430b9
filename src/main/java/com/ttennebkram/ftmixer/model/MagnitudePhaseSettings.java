package com.ttennebkram.ftmixer.model;

/**
 * Blend of magnitude and phase components.
 */
public final class MagnitudePhaseSettings extends MixSettings {

    public MagnitudePhaseSettings(int slotCount, WeightVector magnitude, WeightVector phase,
                                  RegionConfig region, int outputPort) {
        super(slotCount, magnitude, phase, region, outputPort);
    }

    public MagnitudePhaseSettings(WeightVector magnitude, WeightVector phase, RegionConfig region) {
        this(magnitude.size(), magnitude, phase, region, 0);
    }

    @Override
    public MixMode getMode() {
        return MixMode.MAGNITUDE_PHASE;
    }

    @Override
    public MagnitudePhaseSettings withOutputPort(int port) {
        return new MagnitudePhaseSettings(getSlotCount(), getMagnitudeWeights(), getPhaseWeights(), getRegion(), port);
    }

    public WeightVector getMagnitudeWeights() {
        return getFirstWeights();
    }

    public WeightVector getPhaseWeights() {
        return getSecondWeights();
    }

    /**
     * True when magnitude and phase use the same weights, in which case the
     * complex spectra can be summed directly.
     */
    public boolean hasEqualWeights() {
        return getMagnitudeWeights().approximatelyEquals(getPhaseWeights());
    }
}
