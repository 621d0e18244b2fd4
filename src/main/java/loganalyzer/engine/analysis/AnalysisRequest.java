package loganalyzer.engine.analysis;

import loganalyzer.engine.model.LogLine;

import java.util.List;

/**
 * Input of one classifier call.
 */
public record AnalysisRequest(String jobId, String organizationId, int batchNumber, List<LogLine> lines) {

    public AnalysisRequest {
        lines = List.copyOf(lines);
    }
}
