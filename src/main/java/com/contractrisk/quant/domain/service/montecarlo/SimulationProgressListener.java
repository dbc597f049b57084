package com.contractrisk.quant.domain.service.montecarlo;

@FunctionalInterface
public interface SimulationProgressListener {

    /**
     * Called from a worker thread after each batch of trials. Calls for the same run may arrive
     * concurrently and out of order, but {@code completedTrials} only grows.
     */
    void onProgress(int completedTrials, int totalTrials);
}
