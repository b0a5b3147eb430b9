package com.ttennebkram.ftmixer.job;

import com.ttennebkram.ftmixer.config.MixerConfig;
import com.ttennebkram.ftmixer.model.MixResult;
import com.ttennebkram.ftmixer.model.MixSettings;
import com.ttennebkram.ftmixer.processing.ComponentMixer;
import com.ttennebkram.ftmixer.processing.InverseTransformPipeline;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs mix jobs one at a time and routes their results to the output ports.
 *
 * Starting a job while another is processing cancels the old one and waits
 * a bounded time for it to exit. Each job gets a new generation id; a job
 * that finishes after being superseded is reported as STALE and does not
 * overwrite a port (unless stale discarding is turned off).
 *
 * The worker thread only touches atomics and the synchronized port store,
 * so {@link #start} may hold the controller lock while joining it.
 */
public class MixJobController {

    private final MixerConfig config;
    private final ComponentMixer mixer;
    private final InverseTransformPipeline pipeline;
    private final OutputPorts outputPorts;

    private final AtomicLong generation = new AtomicLong(0);
    // guards generation bumps against the check-and-write in publish(); never held while joining
    private final Object publishLock = new Object();
    private volatile MixJob currentJob;
    private volatile String lastError;
    private volatile JobCheckpointListener checkpointListener;

    public MixJobController() {
        this(MixerConfig.load());
    }

    public MixJobController(MixerConfig config) {
        this(config, new ComponentMixer(), new InverseTransformPipeline(), new OutputPorts());
    }

    public MixJobController(MixerConfig config, ComponentMixer mixer, InverseTransformPipeline pipeline,
                            OutputPorts outputPorts) {
        this.config = config;
        this.mixer = mixer;
        this.pipeline = pipeline;
        this.outputPorts = outputPorts;
    }

    public void setCheckpointListener(JobCheckpointListener listener) {
        this.checkpointListener = listener;
    }

    /**
     * Validate, then start a new job on its own thread.
     * The spectra are copied; the caller keeps ownership of the given Mats.
     *
     * @throws com.ttennebkram.ftmixer.model.MixerException if spectra and settings do not fit together
     */
    public synchronized MixJob start(List<Mat> spectra, MixSettings settings, MixCallback callback) {
        mixer.validate(spectra, settings);

        MixJob previous = currentJob;
        if (previous != null && previous.isProcessing()) {
            System.out.println("[MixJobController] Already processing job #" + previous.getGeneration()
                + ". Cancelling previous operation...");
            previous.cancel();
            if (!previous.join(config.getCancelJoinTimeoutMs())) {
                System.out.println("[MixJobController] Job #" + previous.getGeneration()
                    + " did not stop within " + config.getCancelJoinTimeoutMs() + " ms; it may still report");
            }
        }

        List<Mat> copies = new ArrayList<>(spectra.size());
        for (Mat spectrum : spectra) {
            copies.add(spectrum.clone());
        }

        lastError = null;
        long jobGeneration;
        synchronized (publishLock) {
            jobGeneration = generation.incrementAndGet();
        }
        MixJob job = new MixJob(jobGeneration, copies, settings, this, callback, checkpointListener);
        currentJob = job;
        job.start();
        System.out.println("[MixJobController] Job #" + job.getGeneration() + " started ("
            + settings.getMode().getKey() + ", " + spectra.size() + " slot(s), port " + settings.getOutputPort() + ")");
        return job;
    }

    /**
     * Run a job and wait for it on the calling thread.
     */
    public MixResult run(List<Mat> spectra, MixSettings settings) {
        MixJob job = start(spectra, settings, null);
        return job.getFuture().join();
    }

    /**
     * Request cancellation of the processing job, if any.
     *
     * @return whether a job was in progress
     */
    public boolean cancel() {
        MixJob job = currentJob;
        return job != null && job.cancel();
    }

    /**
     * Called by a job that reached 100 %: write the port unless the job was superseded.
     */
    MixResult publish(MixJob job, Mat output) {
        int port = job.getOutputPort();
        synchronized (publishLock) {
            if (config.isDiscardStaleResults() && !isCurrent(job.getGeneration())) {
                System.out.println("[MixJobController] Job #" + job.getGeneration()
                    + " finished after being superseded; result discarded");
                return MixResult.stale(output, port, job.getGeneration());
            }
            outputPorts.set(port, output);
        }
        System.out.println("[MixJobController] Job #" + job.getGeneration() + " complete: "
            + output.rows() + "x" + output.cols() + " -> port " + port);
        return MixResult.completed(output, port, job.getGeneration());
    }

    void jobFinished(MixJob job, MixResult result) {
        if (result.getStatus() == MixResult.Status.FAILED && isCurrent(job.getGeneration())) {
            lastError = result.getError();
        }
    }

    public boolean isCurrent(long jobGeneration) {
        return generation.get() == jobGeneration;
    }

    public long getCurrentGeneration() {
        return generation.get();
    }

    /**
     * The most recently started job, or null.
     */
    public MixJob getCurrentJob() {
        return currentJob;
    }

    /**
     * Last checkpoint of the current job (0 when none has run).
     */
    public int getProgress() {
        MixJob job = currentJob;
        return job != null ? job.getProgress() : 0;
    }

    public boolean isProcessing() {
        MixJob job = currentJob;
        return job != null && job.isProcessing();
    }

    /**
     * Error message of the current job if it failed, otherwise null.
     */
    public String getLastError() {
        return lastError;
    }

    /**
     * Copy of an output port's image, or null if the port is empty.
     */
    public Mat output(int port) {
        return outputPorts.get(port);
    }

    public OutputPorts getOutputPorts() {
        return outputPorts;
    }

    public MixerConfig getConfig() {
        return config;
    }

    ComponentMixer getMixer() {
        return mixer;
    }

    InverseTransformPipeline getPipeline() {
        return pipeline;
    }

    /**
     * Cancel any running job and forget all outputs.
     */
    public synchronized void reset() {
        MixJob job = currentJob;
        if (job != null && job.cancel()) {
            job.join(config.getCancelJoinTimeoutMs());
        }
        currentJob = null;
        lastError = null;
        outputPorts.clear();
    }
}
