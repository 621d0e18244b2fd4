package loganalyzer.engine.model;

import java.util.List;

/**
 * One page of a job listing.
 */
public record JobPage(List<AnalysisJob> jobs, int page, int limit, long totalItems) {

    public int totalPages() {
        return (int) ((totalItems + limit - 1) / limit);
    }

    public boolean hasNext() {
        return page < totalPages();
    }

    public boolean hasPrevious() {
        return page > 1;
    }
}
