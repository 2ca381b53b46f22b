package com.delta.catalogcrawler.crawl.error;

/**
 * Systemic failure of the storage collaborator. Escalates to job-level failure.
 */
public class PersistenceUnavailableException extends RuntimeException {
    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
