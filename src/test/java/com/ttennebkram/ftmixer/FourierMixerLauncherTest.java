package com.ttennebkram.ftmixer;

import com.ttennebkram.ftmixer.util.OpenCVLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FourierMixerLauncherTest {

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.load();
    }

    private static Path writePng(Path dir, String name, Mat image) {
        Path file = dir.resolve(name);
        Mat bytes = new Mat();
        image.convertTo(bytes, CvType.CV_8U);
        assertTrue(Imgcodecs.imwrite(file.toString(), bytes));
        bytes.release();
        return file;
    }

    @Test
    void missingArgumentsPrintUsage() {
        assertEquals(2, FourierMixerLauncher.run(new String[0]));
        assertEquals(2, FourierMixerLauncher.run(new String[] {"request.json", "out.png"}));
    }

    @Test
    void unknownOrIncompleteOptionIsRejected() {
        assertEquals(2, FourierMixerLauncher.run(new String[] {"--verbose", "r.json", "o.png", "a.png"}));
        assertEquals(2, FourierMixerLauncher.run(new String[] {"--config"}));
        assertEquals(2, FourierMixerLauncher.run(new String[] {"--view", "0", "phase"}));
    }

    @Test
    void helpExitsCleanly() {
        assertEquals(0, FourierMixerLauncher.run(new String[] {"--help"}));
    }

    @Test
    void tooManyImagesIsAUsageError() {
        assertEquals(2, FourierMixerLauncher.run(
            new String[] {"r.json", "o.png", "a.png", "b.png", "c.png", "d.png", "e.png"}));
    }

    @Test
    void mixesImagesAndWritesOutputAndView(@TempDir Path dir) throws Exception {
        Path first = writePng(dir, "a.png", TestImages.blurredDelta(24, 24, 2.0));
        Path second = writePng(dir, "b.png", TestImages.blurredNoise(24, 24, 3, 1.5));
        Path request = dir.resolve("request.json");
        Files.write(request, ("{\"weights\": {\"magnitude\": [1, 0, 0, 0], \"phase\": [0, 1, 0, 0]},"
            + " \"output_port\": 1}").getBytes(StandardCharsets.UTF_8));
        Path output = dir.resolve("mixed.png");
        Path view = dir.resolve("phase.png");

        int exit = FourierMixerLauncher.run(new String[] {
            "--view", "1", "phase", view.toString(),
            request.toString(), output.toString(), first.toString(), second.toString()});

        assertEquals(0, exit);
        Mat written = Imgcodecs.imread(output.toString(), Imgcodecs.IMREAD_GRAYSCALE);
        assertEquals(24, written.rows());
        assertEquals(24, written.cols());
        assertTrue(Files.size(view) > 0);
    }
}
