package com.ttennebkram.ftmixer.job;

import com.ttennebkram.ftmixer.model.MixResult;
import com.ttennebkram.ftmixer.model.MixSettings;
import com.ttennebkram.ftmixer.processing.ComponentMixer;
import com.ttennebkram.ftmixer.processing.InverseTransformPipeline;
import com.ttennebkram.ftmixer.util.MatUtils;
import org.opencv.core.Mat;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One mix-and-reconstruct computation running on its own thread.
 *
 * Progress moves through fixed checkpoints 0, 10, 50, 70, 90, 100.
 * Cancellation is cooperative: the flag is checked after mixing and after
 * the inverse DFT only. The outcome is delivered both to the callback and
 * to {@link #getFuture()}.
 */
public class MixJob {

    public enum State {
        PENDING,
        PROCESSING,
        COMPLETED,
        CANCELLED,
        FAILED,
        STALE
    }

    public static final int PROGRESS_MIXING = 10;
    public static final int PROGRESS_MIXED = 50;
    public static final int PROGRESS_UNSHIFTED = 70;
    public static final int PROGRESS_INVERTED = 90;
    public static final int PROGRESS_DONE = 100;

    private final long generation;
    private final MixSettings settings;
    private final List<Mat> spectra;
    private final MixJobController controller;
    private final MixCallback callback;
    private final JobCheckpointListener checkpointListener;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final CompletableFuture<MixResult> future = new CompletableFuture<>();
    private volatile int progress = 0;
    private volatile State state = State.PENDING;
    private Thread thread;

    MixJob(long generation, List<Mat> spectra, MixSettings settings, MixJobController controller,
           MixCallback callback, JobCheckpointListener checkpointListener) {
        this.generation = generation;
        this.spectra = spectra;
        this.settings = settings;
        this.controller = controller;
        this.callback = callback;
        this.checkpointListener = checkpointListener;
    }

    void start() {
        state = State.PROCESSING;
        thread = new Thread(this::run, "MixJob-" + generation);
        thread.setDaemon(true);
        thread.start();
    }

    private void run() {
        ComponentMixer mixer = controller.getMixer();
        InverseTransformPipeline pipeline = controller.getPipeline();
        int port = settings.getOutputPort();

        Mat mixed = null;
        Mat uncentered = null;
        Mat spatial = null;
        Mat output = null;
        MixResult result;
        try {
            checkpoint(PROGRESS_MIXING);
            mixed = mixer.mix(spectra, settings);

            if (cancelRequested.get()) {
                System.out.println("[MixJob] #" + generation + " cancelled during mixing");
                result = MixResult.cancelled(port, progress, generation);
            } else {
                checkpoint(PROGRESS_MIXED);
                uncentered = pipeline.unshift(mixed);

                checkpoint(PROGRESS_UNSHIFTED);
                spatial = pipeline.inverse(uncentered);

                if (cancelRequested.get()) {
                    System.out.println("[MixJob] #" + generation + " cancelled during IFFT");
                    result = MixResult.cancelled(port, progress, generation);
                } else {
                    checkpoint(PROGRESS_INVERTED);
                    output = pipeline.normalize(spatial);
                    checkpoint(PROGRESS_DONE);
                    result = controller.publish(this, output);
                }
            }
        } catch (Throwable t) {
            // Errors included, so the job always leaves PROCESSING
            String message = t.getMessage() != null ? t.getMessage() : t.toString();
            System.err.println("[MixJob] #" + generation + " failed: " + message);
            result = MixResult.failed(port, progress, generation, message);
        } finally {
            releaseQuietly(mixed);
            releaseQuietly(uncentered);
            releaseQuietly(spatial);
            MatUtils.releaseAll(spectra);
        }

        finish(result);
    }

    private void finish(MixResult result) {
        switch (result.getStatus()) {
            case COMPLETED: state = State.COMPLETED; break;
            case STALE: state = State.STALE; break;
            case CANCELLED: state = State.CANCELLED; break;
            default: state = State.FAILED; break;
        }
        controller.jobFinished(this, result);

        boolean notify = result.getStatus() != MixResult.Status.CANCELLED || controller.getConfig().isNotifyOnCancel();
        try {
            if (callback != null && notify) {
                callback.onResult(result, result.getOutputPort());
            }
        } catch (RuntimeException e) {
            System.err.println("[MixJob] #" + generation + " callback threw: " + e);
        } finally {
            future.complete(result);
        }
    }

    private void checkpoint(int value) throws Exception {
        progress = value;
        if (checkpointListener != null) {
            checkpointListener.onCheckpoint(this, value);
        }
    }

    private static void releaseQuietly(Mat mat) {
        if (mat != null) {
            mat.release();
        }
    }

    /**
     * Ask the job to stop at its next checkpoint. Returns false if it had already finished.
     */
    public boolean cancel() {
        if (!isProcessing()) {
            return false;
        }
        cancelRequested.set(true);
        System.out.println("[MixJob] #" + generation + " cancellation requested");
        return true;
    }

    /**
     * Wait up to {@code timeoutMs} for the worker thread to exit.
     *
     * @return true if the thread is no longer running
     */
    boolean join(long timeoutMs) {
        Thread t = thread;
        if (t == null) {
            return true;
        }
        try {
            t.join(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !t.isAlive();
    }

    /**
     * Block until the job finishes.
     */
    public MixResult await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return future.get(timeout, unit);
        } catch (ExecutionException e) {
            // finish() always completes normally
            throw new IllegalStateException("Mix job future failed", e.getCause());
        }
    }

    public CompletableFuture<MixResult> getFuture() {
        return future;
    }

    public long getGeneration() {
        return generation;
    }

    public MixSettings getSettings() {
        return settings;
    }

    public int getOutputPort() {
        return settings.getOutputPort();
    }

    public int getProgress() {
        return progress;
    }

    public State getState() {
        return state;
    }

    public boolean isProcessing() {
        return state == State.PROCESSING;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    @Override
    public String toString() {
        return "MixJob#" + generation + "[" + state + ", " + progress + "%, port " + getOutputPort() + "]";
    }
}
