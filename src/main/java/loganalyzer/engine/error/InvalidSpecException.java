package loganalyzer.engine.error;

/**
 * Submission rejected before a job was created.
 */
public class InvalidSpecException extends IllegalArgumentException {

    public InvalidSpecException(String message) {
        super(message);
    }
}
