package com.delta.catalogcrawler.crawl.error;

public class JobNotFoundException extends RuntimeException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("No crawl job with id " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
