package com.ttennebkram.ftmixer.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Rectangular frequency region shared by all components of a mix.
 * Position and size are fractions of the spectrum dimensions; each component
 * chooses independently whether it keeps the inside or the outside.
 * Instances are immutable; the with* methods return modified copies.
 */
public final class RegionConfig {

    public static final double DEFAULT_SIZE = 0.3;
    public static final double DEFAULT_CENTER = 0.5;

    private final boolean enabled;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final EnumMap<ComponentType, RegionType> types;

    public RegionConfig(boolean enabled, double x, double y, double width, double height,
                        Map<ComponentType, RegionType> types) {
        checkFraction("x", x);
        checkFraction("y", y);
        checkFraction("width", width);
        checkFraction("height", height);
        this.enabled = enabled;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.types = new EnumMap<>(ComponentType.class);
        for (ComponentType component : ComponentType.values()) {
            RegionType type = types != null ? types.get(component) : null;
            this.types.put(component, type != null ? type : RegionType.INNER);
        }
    }

    /**
     * A disabled region: every mask built from it is all ones.
     */
    public static RegionConfig disabled() {
        return new RegionConfig(false, DEFAULT_CENTER, DEFAULT_CENTER, DEFAULT_SIZE, DEFAULT_SIZE, null);
    }

    /**
     * An enabled, centered square region of the given size applying one type to every component.
     */
    public static RegionConfig centered(double size, RegionType type) {
        return new RegionConfig(true, DEFAULT_CENTER, DEFAULT_CENTER, size, size, uniform(type));
    }

    public static Map<ComponentType, RegionType> uniform(RegionType type) {
        EnumMap<ComponentType, RegionType> map = new EnumMap<>(ComponentType.class);
        for (ComponentType component : ComponentType.values()) {
            map.put(component, type);
        }
        return map;
    }

    private static void checkFraction(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new MixerException(MixerException.Kind.INVALID_REGION,
                "Region " + name + " must be between 0.0 and 1.0, got: " + value);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public RegionType getType(ComponentType component) {
        return types.get(component);
    }

    public Map<ComponentType, RegionType> getTypes() {
        return new EnumMap<>(types);
    }

    public RegionConfig withEnabled(boolean enabled) {
        return new RegionConfig(enabled, x, y, width, height, types);
    }

    public RegionConfig withCenter(double x, double y) {
        return new RegionConfig(enabled, x, y, width, height, types);
    }

    public RegionConfig withSize(double width, double height) {
        return new RegionConfig(enabled, x, y, width, height, types);
    }

    public RegionConfig withType(ComponentType component, RegionType type) {
        EnumMap<ComponentType, RegionType> copy = new EnumMap<>(types);
        copy.put(component, type);
        return new RegionConfig(enabled, x, y, width, height, copy);
    }

    public RegionConfig withType(RegionType type) {
        return new RegionConfig(enabled, x, y, width, height, uniform(type));
    }

    @Override
    public String toString() {
        return String.format("RegionConfig[enabled=%s, pos=(%.2f,%.2f), size=(%.2fx%.2f), types=%s]",
            enabled, x, y, width, height, types);
    }
}
