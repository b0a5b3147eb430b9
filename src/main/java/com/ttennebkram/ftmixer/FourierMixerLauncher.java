package com.ttennebkram.ftmixer;

import com.ttennebkram.ftmixer.config.MixerConfig;
import com.ttennebkram.ftmixer.job.MixJob;
import com.ttennebkram.ftmixer.model.ComponentType;
import com.ttennebkram.ftmixer.model.MixResult;
import com.ttennebkram.ftmixer.model.MixerException;
import com.ttennebkram.ftmixer.serialization.MixRequest;
import com.ttennebkram.ftmixer.serialization.MixRequestParser;
import com.ttennebkram.ftmixer.serialization.MixerJson;
import com.ttennebkram.ftmixer.service.FourierMixerService;
import com.ttennebkram.ftmixer.util.OpenCVLoader;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command-line front end: mix up to four images according to a JSON request
 * and write the reconstructed image.
 *
 * <pre>
 * FourierMixerLauncher [--config mixer.json] [--view slot component out.png]
 *                      request.json output.png image1 [image2 [image3 [image4]]]
 * </pre>
 */
public class FourierMixerLauncher {

    private static final String APP_NAME = "Fourier Mixer";
    private static final long POLL_INTERVAL_MS = 50;

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } catch (MixerException e) {
            System.err.println("[" + APP_NAME + "] " + e.getKind() + ": " + e.getMessage());
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    static int run(String[] args) {
        Path configPath = null;
        List<String[]> views = new ArrayList<>();
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) && i + 1 < args.length) {
                configPath = Paths.get(args[++i]);
            } else if ("--view".equals(arg) && i + 3 < args.length) {
                views.add(new String[] {args[++i], args[++i], args[++i]});
            } else if ("--help".equals(arg) || "-h".equals(arg)) {
                printUsage();
                return 0;
            } else if (arg.startsWith("--")) {
                System.err.println("Unknown or incomplete option: " + arg);
                printUsage();
                return 2;
            } else {
                positional.add(arg);
            }
        }

        if (positional.size() < 3) {
            printUsage();
            return 2;
        }

        OpenCVLoader.load();

        MixerConfig config = configPath != null ? MixerConfig.load(configPath) : MixerConfig.load();
        FourierMixerService service = new FourierMixerService(config);

        Path requestPath = Paths.get(positional.get(0));
        String outputPath = positional.get(1);
        List<String> images = positional.subList(2, positional.size());
        if (images.size() > service.getSlotCount()) {
            System.err.println("At most " + service.getSlotCount() + " images can be mixed, got " + images.size());
            return 2;
        }

        for (int i = 0; i < images.size(); i++) {
            service.loadImage(i, Paths.get(images.get(i)));
        }
        service.resizeAllToSmallest();

        for (String[] view : views) {
            writeView(service, view);
        }

        MixRequest request = new MixRequestParser(config).parse(requestPath);
        MixJob job = service.mixAsync(request, null);
        MixResult result = waitFor(service, job);
        System.out.println(MixerJson.toJson(MixerJson.result(result)));

        if (!result.isSuccess()) {
            return 1;
        }
        Mat display = service.outputView(result.getOutputPort());
        try {
            if (!Imgcodecs.imwrite(outputPath, display)) {
                throw new MixerException(MixerException.Kind.IO_ERROR, "Could not write " + outputPath);
            }
        } finally {
            display.release();
        }
        System.out.println("[" + APP_NAME + "] Wrote " + outputPath);
        return 0;
    }

    private static MixResult waitFor(FourierMixerService service, MixJob job) {
        int lastReported = -1;
        while (true) {
            try {
                MixResult result = job.await(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                System.out.println("[" + APP_NAME + "] Progress: " + result.getProgress() + "%");
                return result;
            } catch (TimeoutException e) {
                int progress = service.progress();
                if (progress != lastReported) {
                    System.out.println("[" + APP_NAME + "] Progress: " + progress + "%");
                    lastReported = progress;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                service.cancel();
                throw new MixerException(MixerException.Kind.INVALID_REQUEST, "Interrupted while mixing", e);
            }
        }
    }

    private static void writeView(FourierMixerService service, String[] view) {
        int slot;
        try {
            slot = Integer.parseInt(view[0]);
        } catch (NumberFormatException e) {
            throw new MixerException(MixerException.Kind.INVALID_SLOT, "Slot must be a number, got " + view[0], e);
        }
        ComponentType type = ComponentType.fromKey(view[1]);
        Mat display = service.componentView(slot, type);
        try {
            if (!Imgcodecs.imwrite(view[2], display)) {
                throw new MixerException(MixerException.Kind.IO_ERROR, "Could not write " + view[2]);
            }
        } finally {
            display.release();
        }
        System.out.println("[" + APP_NAME + "] Wrote " + type.getKey() + " of slot " + slot + " to " + view[2]);
    }

    private static void printUsage() {
        System.out.println("Usage: FourierMixerLauncher [--config mixer.json] [--view slot component out.png]");
        System.out.println("                            request.json output.png image1 [image2 [image3 [image4]]]");
        System.out.println("  component: magnitude | phase | real | imaginary");
    }
}
