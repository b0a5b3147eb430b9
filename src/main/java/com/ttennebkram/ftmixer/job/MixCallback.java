package com.ttennebkram.ftmixer.job;

import com.ttennebkram.ftmixer.model.MixResult;

/**
 * Receives the outcome of a mix job on the job's worker thread.
 * Compare {@link MixResult#getGeneration()} with the controller's current
 * generation to recognize results of superseded jobs.
 */
@FunctionalInterface
public interface MixCallback {
    void onResult(MixResult result, int outputPort);
}
