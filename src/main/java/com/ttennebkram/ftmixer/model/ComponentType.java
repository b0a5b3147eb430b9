package com.ttennebkram.ftmixer.model;

/**
 * The four ways a complex spectrum value can be looked at.
 */
public enum ComponentType {
    MAGNITUDE("magnitude"),
    PHASE("phase"),
    REAL("real"),
    IMAGINARY("imaginary");

    private final String key;

    ComponentType(String key) {
        this.key = key;
    }

    /**
     * JSON / command-line name of this component.
     */
    public String getKey() {
        return key;
    }

    public static ComponentType fromKey(String key) {
        for (ComponentType type : values()) {
            if (type.key.equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new MixerException(MixerException.Kind.INVALID_COMPONENT,
            "Invalid component type: " + key + ". Must be one of magnitude, phase, real, imaginary");
    }
}
