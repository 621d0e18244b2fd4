package loganalyzer.engine.model;

/**
 * Result of a pause / resume / cancel request.
 */
public enum ControlResult {
    /** Request recorded, the owning worker honors it at the next batch boundary */
    ACCEPTED,

    /** Transition performed immediately (e.g. cancel of a paused job, resume) */
    APPLIED,

    /** Job already in the requested state or the request is already pending */
    NO_OP
}
