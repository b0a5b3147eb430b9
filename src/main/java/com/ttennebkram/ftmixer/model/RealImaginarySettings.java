package com.ttennebkram.ftmixer.model;

/**
 * Blend of real and imaginary components.
 */
public final class RealImaginarySettings extends MixSettings {

    public RealImaginarySettings(int slotCount, WeightVector real, WeightVector imaginary,
                                 RegionConfig region, int outputPort) {
        super(slotCount, real, imaginary, region, outputPort);
    }

    public RealImaginarySettings(WeightVector real, WeightVector imaginary, RegionConfig region) {
        this(real.size(), real, imaginary, region, 0);
    }

    @Override
    public MixMode getMode() {
        return MixMode.REAL_IMAGINARY;
    }

    @Override
    public RealImaginarySettings withOutputPort(int port) {
        return new RealImaginarySettings(getSlotCount(), getRealWeights(), getImaginaryWeights(), getRegion(), port);
    }

    public WeightVector getRealWeights() {
        return getFirstWeights();
    }

    public WeightVector getImaginaryWeights() {
        return getSecondWeights();
    }
}
