package com.ttennebkram.ftmixer.util;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact, once per JVM.
 */
public final class OpenCVLoader {

    private static volatile boolean loaded = false;

    private OpenCVLoader() {
    }

    public static void load() {
        if (loaded) {
            return;
        }
        synchronized (OpenCVLoader.class) {
            if (!loaded) {
                nu.pattern.OpenCV.loadLocally();
                loaded = true;
                System.out.println("[OpenCVLoader] Loaded OpenCV " + org.opencv.core.Core.VERSION);
            }
        }
    }
}
