package com.ttennebkram.ftmixer.model;

import com.ttennebkram.ftmixer.util.MatUtils;
import org.opencv.core.Mat;

/**
 * Outcome of one mix job.
 * Only COMPLETED results carry an output array; the other states carry the
 * target port and, for FAILED, the error message.
 */
public final class MixResult {

    public enum Status {
        /** Output written to the target port. */
        COMPLETED,
        /** Cancelled at a checkpoint; no output. */
        CANCELLED,
        /** An exception escaped the computation. */
        FAILED,
        /** Finished after a newer job superseded it; output not written to the port. */
        STALE
    }

    private final Status status;
    private final Mat output;
    private final int rows;
    private final int cols;
    private final int outputPort;
    private final int progress;
    private final long generation;
    private final String error;

    private MixResult(Status status, Mat output, int rows, int cols, int outputPort,
                      int progress, long generation, String error) {
        this.status = status;
        this.output = output;
        this.rows = rows;
        this.cols = cols;
        this.outputPort = outputPort;
        this.progress = progress;
        this.generation = generation;
        this.error = error;
    }

    public static MixResult completed(Mat output, int outputPort, long generation) {
        return new MixResult(Status.COMPLETED, output, output.rows(), output.cols(), outputPort, 100, generation, null);
    }

    public static MixResult stale(Mat output, int outputPort, long generation) {
        return new MixResult(Status.STALE, output, output.rows(), output.cols(), outputPort, 100, generation, null);
    }

    public static MixResult cancelled(int outputPort, int progress, long generation) {
        return new MixResult(Status.CANCELLED, null, 0, 0, outputPort, progress, generation, "Operation was cancelled");
    }

    public static MixResult failed(int outputPort, int progress, long generation, String error) {
        return new MixResult(Status.FAILED, null, 0, 0, outputPort, progress, generation, error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.COMPLETED;
    }

    public boolean hasOutput() {
        return output != null;
    }

    /**
     * Reconstructed image (CV_64F, values in [0,255]), or null when there is none.
     */
    public Mat getOutput() {
        return output;
    }

    public double[][] toArray() {
        return output != null ? MatUtils.toArray(output) : null;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public int getOutputPort() {
        return outputPort;
    }

    public int getProgress() {
        return progress;
    }

    public long getGeneration() {
        return generation;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "MixResult[" + status + ", job #" + generation + ", port " + outputPort
            + (output != null ? ", " + rows + "x" + cols : "")
            + (error != null ? ", error=" + error : "") + "]";
    }
}
