package com.contractrisk.quant.domain.service.montecarlo;

/**
 * Per-run handle for cooperative cancellation and progress reporting. The engine checks
 * {@link #isCancelled()} once per batch, not per trial.
 */
public class SimulationControl {

    private static final SimulationProgressListener NO_OP = (completed, total) -> { };

    private final SimulationProgressListener listener;
    private volatile boolean cancelled;

    public SimulationControl() {
        this(NO_OP);
    }

    public SimulationControl(SimulationProgressListener listener) {
        this.listener = listener != null ? listener : NO_OP;
    }

    public static SimulationControl none() {
        return new SimulationControl();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    void reportProgress(int completedTrials, int totalTrials) {
        listener.onProgress(completedTrials, totalTrials);
    }
}
