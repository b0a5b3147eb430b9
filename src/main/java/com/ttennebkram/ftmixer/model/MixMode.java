package com.ttennebkram.ftmixer.model;

/**
 * Which pair of spectrum components a mix blends.
 */
public enum MixMode {
    MAGNITUDE_PHASE("magnitude_phase", ComponentType.MAGNITUDE, ComponentType.PHASE),
    REAL_IMAGINARY("real_imaginary", ComponentType.REAL, ComponentType.IMAGINARY);

    private final String key;
    private final ComponentType first;
    private final ComponentType second;

    MixMode(String key, ComponentType first, ComponentType second) {
        this.key = key;
        this.first = first;
        this.second = second;
    }

    public String getKey() {
        return key;
    }

    public ComponentType getFirstComponent() {
        return first;
    }

    public ComponentType getSecondComponent() {
        return second;
    }

    public boolean uses(ComponentType type) {
        return type == first || type == second;
    }

    public static MixMode fromKey(String key) {
        for (MixMode mode : values()) {
            if (mode.key.equals(key)) {
                return mode;
            }
        }
        throw new MixerException(MixerException.Kind.INVALID_MODE,
            "Mode must be 'magnitude_phase' or 'real_imaginary', got: " + key);
    }
}
