package loganalyzer.engine.analysis;

/**
 * The alert store rejected or failed to persist an alert.
 */
public class AlertCreationException extends Exception {

    public AlertCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
