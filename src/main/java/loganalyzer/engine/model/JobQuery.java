package loganalyzer.engine.model;

/**
 * Filter and paging for job listings. Null filters match everything.
 *
 * @param page  1-based page number
 * @param limit page size
 */
public record JobQuery(String organizationId, JobStatus status, String fileId, int page, int limit) {

    public JobQuery {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (limit < 1 || limit > 500) {
            throw new IllegalArgumentException("limit must be between 1 and 500");
        }
    }

    public static JobQuery forOrganization(String organizationId) {
        return new JobQuery(organizationId, null, null, 1, 20);
    }

    public JobQuery withStatus(JobStatus status) {
        return new JobQuery(organizationId, status, fileId, page, limit);
    }

    public JobQuery withFileId(String fileId) {
        return new JobQuery(organizationId, status, fileId, page, limit);
    }

    public JobQuery withPage(int page, int limit) {
        return new JobQuery(organizationId, status, fileId, page, limit);
    }

    public int offset() {
        return (page - 1) * limit;
    }
}
