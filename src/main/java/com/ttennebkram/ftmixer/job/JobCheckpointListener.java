package com.ttennebkram.ftmixer.job;

/**
 * Notified on the worker thread each time a job reaches a progress checkpoint
 * (10, 50, 70, 90, 100). An exception thrown here fails the job.
 */
@FunctionalInterface
public interface JobCheckpointListener {
    void onCheckpoint(MixJob job, int progress) throws Exception;
}
