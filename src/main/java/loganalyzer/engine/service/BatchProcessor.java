package loganalyzer.engine.service;

import loganalyzer.engine.analysis.AlertCreationException;
import loganalyzer.engine.analysis.AlertCreator;
import loganalyzer.engine.analysis.AlertRequest;
import loganalyzer.engine.analysis.AnalysisClient;
import loganalyzer.engine.analysis.AnalysisException;
import loganalyzer.engine.analysis.AnalysisRequest;
import loganalyzer.engine.model.AnalysisJob;
import loganalyzer.engine.model.BatchResult;
import loganalyzer.engine.model.Finding;
import loganalyzer.engine.model.LogLine;
import loganalyzer.engine.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs one batch through the classifier and turns qualifying findings into alerts.
 *
 * A single call is a single attempt; retrying is the controller's business.
 * Alerts carry a dedup key derived from job, line and issue type, so redoing a
 * batch that failed half-way does not duplicate the alerts it already created.
 */
public class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final AnalysisClient analysisClient;
    private final AlertCreator alertCreator;
    private final Severity alertThreshold;

    public BatchProcessor(AnalysisClient analysisClient, AlertCreator alertCreator, Severity alertThreshold) {
        this.analysisClient = analysisClient;
        this.alertCreator = alertCreator;
        this.alertThreshold = alertThreshold;
    }

    /**
     * @param job         owner of the batch
     * @param batchNumber 1-based number of the batch
     * @param lines       the lines of the batch, never empty
     */
    public BatchResult process(AnalysisJob job, int batchNumber, List<LogLine> lines)
            throws BatchFailureException, InterruptedException {
        long started = System.nanoTime();

        List<Finding> findings;
        try {
            findings = analysisClient.classify(
                    new AnalysisRequest(job.id(), job.organizationId(), batchNumber, lines));
        } catch (AnalysisException e) {
            throw new BatchFailureException("Analysis failed: " + e.getMessage(), e.isRetryable(), e);
        }

        Set<Long> batchLines = new HashSet<>();
        for (LogLine line : lines) {
            batchLines.add(line.lineNumber());
        }

        int issues = 0;
        Set<String> alerted = new HashSet<>();
        for (Finding finding : findings) {
            if (!batchLines.contains(finding.lineNumber())) {
                log.debug("Job {} batch {}: dropping finding for line {} outside the batch",
                        job.id(), batchNumber, finding.lineNumber());
                continue;
            }
            issues++;

            if (!finding.severity().isAtLeast(alertThreshold)) {
                continue;
            }
            String dedupKey = AlertRequest.dedupKey(job.id(), finding);
            if (!alerted.add(dedupKey)) {
                continue;
            }
            try {
                alertCreator.create(new AlertRequest(dedupKey, job.id(), job.organizationId(), job.fileId(), finding));
            } catch (AlertCreationException e) {
                throw new BatchFailureException("Alert creation failed: " + e.getMessage(), true, e);
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.debug("Job {} batch {}: {} lines, {} issues, {} alerts in {}ms",
                job.id(), batchNumber, lines.size(), issues, alerted.size(), elapsed.toMillis());
        return new BatchResult(lines.size(), issues, alerted.size(), elapsed);
    }
}
