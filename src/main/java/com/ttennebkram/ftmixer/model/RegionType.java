package com.ttennebkram.ftmixer.model;

/**
 * Which side of the region rectangle a mask keeps.
 * INNER keeps the rectangle (low frequencies when centered), OUTER keeps the rest.
 */
public enum RegionType {
    INNER("inner"),
    OUTER("outer");

    private final String key;

    RegionType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static RegionType fromKey(String key) {
        for (RegionType type : values()) {
            if (type.key.equals(key)) {
                return type;
            }
        }
        throw new MixerException(MixerException.Kind.INVALID_REGION,
            "Region type must be 'inner' or 'outer', got: " + key);
    }
}
