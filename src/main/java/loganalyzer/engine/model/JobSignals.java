package loganalyzer.engine.model;

/**
 * Persisted intent flags of a job, read by the controller at batch boundaries.
 */
public record JobSignals(boolean pauseRequested, boolean cancelRequested) {

    public static final JobSignals NONE = new JobSignals(false, false);
}
