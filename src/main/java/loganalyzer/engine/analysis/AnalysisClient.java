package loganalyzer.engine.analysis;

import loganalyzer.engine.model.Finding;

import java.util.List;

/**
 * Abstraction over the external classifier.
 * One call covers a whole batch and may take seconds.
 */
public interface AnalysisClient {

    /**
     * Classify a batch of log lines.
     *
     * @param request the lines and their owner
     * @return findings, each referencing a line of the request; empty if nothing suspicious
     * @throws AnalysisException    if the classifier failed or answered unusably
     * @throws InterruptedException if the calling worker is being shut down
     */
    List<Finding> classify(AnalysisRequest request) throws AnalysisException, InterruptedException;
}
