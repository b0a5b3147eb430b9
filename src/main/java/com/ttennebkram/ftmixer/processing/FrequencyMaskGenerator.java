package com.ttennebkram.ftmixer.processing;

import com.ttennebkram.ftmixer.model.ComponentType;
import com.ttennebkram.ftmixer.model.RegionConfig;
import com.ttennebkram.ftmixer.model.RegionType;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

/**
 * Builds binary frequency masks from a {@link RegionConfig}.
 *
 * The rectangle is centered at (round(rows*y), round(cols*x)) and spans
 * max(1, round(rows*height)) by max(1, round(cols*width)) pixels, using
 * integer halves on each side and clamped to the array.
 */
public class FrequencyMaskGenerator {

    /**
     * Pixel bounds of the region rectangle, end-exclusive and already clamped.
     */
    public static final class Bounds {
        public final int rowStart;
        public final int rowEnd;
        public final int colStart;
        public final int colEnd;

        Bounds(int rowStart, int rowEnd, int colStart, int colEnd) {
            this.rowStart = rowStart;
            this.rowEnd = rowEnd;
            this.colStart = colStart;
            this.colEnd = colEnd;
        }

        public int height() {
            return Math.max(0, rowEnd - rowStart);
        }

        public int width() {
            return Math.max(0, colEnd - colStart);
        }

        public boolean isEmpty() {
            return height() == 0 || width() == 0;
        }

        @Override
        public String toString() {
            return "[" + rowStart + "," + rowEnd + ") x [" + colStart + "," + colEnd + ")";
        }
    }

    public Bounds regionBounds(int rows, int cols, RegionConfig region) {
        int regionRows = Math.max(1, (int) Math.round(rows * region.getHeight()));
        int regionCols = Math.max(1, (int) Math.round(cols * region.getWidth()));

        int centerRow = (int) Math.round(rows * region.getY());
        int centerCol = (int) Math.round(cols * region.getX());

        int rowStart = Math.max(0, centerRow - regionRows / 2);
        int rowEnd = Math.min(rows, centerRow + regionRows / 2);
        int colStart = Math.max(0, centerCol - regionCols / 2);
        int colEnd = Math.min(cols, centerCol + regionCols / 2);
        return new Bounds(rowStart, rowEnd, colStart, colEnd);
    }

    /**
     * Mask for one component, using that component's inner/outer setting.
     *
     * @return new CV_64F Mat of values 0.0 / 1.0
     */
    public Mat buildMask(int rows, int cols, RegionConfig region, ComponentType component) {
        return buildMask(rows, cols, region, region.getType(component));
    }

    public Mat buildMask(int rows, int cols, RegionConfig region, RegionType type) {
        if (!region.isEnabled()) {
            return Mat.ones(rows, cols, CvType.CV_64F);
        }

        Bounds bounds = regionBounds(rows, cols, region);
        double inside = type == RegionType.INNER ? 1.0 : 0.0;
        double outside = 1.0 - inside;

        Mat mask = new Mat(rows, cols, CvType.CV_64F, new Scalar(outside));
        if (!bounds.isEmpty()) {
            Mat rect = mask.submat(new Rect(bounds.colStart, bounds.rowStart, bounds.width(), bounds.height()));
            rect.setTo(new Scalar(inside));
            rect.release();
        }
        return mask;
    }

    /**
     * 8-bit view of a mask (0 or 255) for inspection.
     */
    public Mat toDisplay(Mat mask) {
        Mat display = new Mat();
        mask.convertTo(display, CvType.CV_8U, 255.0);
        return display;
    }
}
