package loganalyzer.engine.analysis;

import loganalyzer.engine.model.Finding;

/**
 * Request to materialize a finding as an alert.
 *
 * @param dedupKey stable key of the finding; repeating a request with the same
 *                 key must not create a second alert
 */
public record AlertRequest(String dedupKey, String jobId, String organizationId, String fileId, Finding finding) {

    public static String dedupKey(String jobId, Finding finding) {
        return jobId + ":" + finding.lineNumber() + ":" + finding.issueType();
    }
}
