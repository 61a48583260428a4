package com.brandinsight.research.exception;

/**
 * Raised when an orchestration run targets a job that does not exist in the store.
 * This is the only failure allowed to escape the orchestrator.
 */
public class ResearchJobNotFoundException extends RuntimeException {

    private final String jobId;

    public ResearchJobNotFoundException(String jobId) {
        super("Research job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getErrorCode() {
        return "JOB_NOT_FOUND";
    }

    public String getJobId() {
        return jobId;
    }
}
