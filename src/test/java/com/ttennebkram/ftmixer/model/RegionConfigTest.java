package com.ttennebkram.ftmixer.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegionConfigTest {

    @Test
    void fractionsOutsideUnitRangeAreRejected() {
        MixerException e = assertThrows(MixerException.class,
            () -> new RegionConfig(true, 0.5, 0.5, 1.2, 0.3, null));
        assertEquals(MixerException.Kind.INVALID_REGION, e.getKind());
        assertThrows(MixerException.class, () -> new RegionConfig(true, -0.1, 0.5, 0.3, 0.3, null));
        assertThrows(MixerException.class, () -> new RegionConfig(true, 0.5, Double.NaN, 0.3, 0.3, null));
    }

    @Test
    void missingTypesDefaultToInner() {
        RegionConfig region = new RegionConfig(true, 0.5, 0.5, 0.3, 0.3, null);
        for (ComponentType type : ComponentType.values()) {
            assertEquals(RegionType.INNER, region.getType(type));
        }
    }

    @Test
    void withMethodsReturnModifiedCopies() {
        RegionConfig base = RegionConfig.centered(0.3, RegionType.INNER);
        RegionConfig changed = base.withType(ComponentType.PHASE, RegionType.OUTER).withSize(0.2, 0.4).withEnabled(false);

        assertTrue(base.isEnabled());
        assertEquals(RegionType.INNER, base.getType(ComponentType.PHASE));
        assertFalse(changed.isEnabled());
        assertEquals(RegionType.OUTER, changed.getType(ComponentType.PHASE));
        assertEquals(RegionType.INNER, changed.getType(ComponentType.MAGNITUDE));
        assertEquals(0.2, changed.getWidth(), 0.0);
        assertEquals(0.4, changed.getHeight(), 0.0);
        assertEquals(RegionType.OUTER, changed.withType(RegionType.OUTER).getType(ComponentType.REAL));
    }

    @Test
    void disabledRegionUsesDefaults() {
        RegionConfig region = RegionConfig.disabled();
        assertFalse(region.isEnabled());
        assertEquals(RegionConfig.DEFAULT_SIZE, region.getWidth(), 0.0);
        assertEquals(RegionConfig.DEFAULT_CENTER, region.getX(), 0.0);
    }

    @Test
    void keysParse() {
        assertEquals(RegionType.OUTER, RegionType.fromKey("outer"));
        assertEquals(MixerException.Kind.INVALID_REGION,
            assertThrows(MixerException.class, () -> RegionType.fromKey("middle")).getKind());
        assertEquals(ComponentType.IMAGINARY, ComponentType.fromKey("Imaginary"));
        assertEquals(MixerException.Kind.INVALID_COMPONENT,
            assertThrows(MixerException.class, () -> ComponentType.fromKey("color")).getKind());
        assertEquals(MixMode.REAL_IMAGINARY, MixMode.fromKey("real_imaginary"));
        assertEquals(MixerException.Kind.INVALID_MODE,
            assertThrows(MixerException.class, () -> MixMode.fromKey("polar")).getKind());
    }
}
