package loganalyzer.engine.analysis;

/**
 * Materializes findings as alerts in the alerting store.
 */
public interface AlertCreator {

    /**
     * Create the alert, or return the id of the alert already created for the same dedup key.
     *
     * @return alert id
     */
    String create(AlertRequest request) throws AlertCreationException;
}
