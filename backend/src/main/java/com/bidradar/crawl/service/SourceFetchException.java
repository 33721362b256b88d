package com.bidradar.crawl.service;

/**
 * The index page of a source could not be retrieved; the whole source is skipped for this run.
 */
public class SourceFetchException extends RuntimeException {
    private final String sourceId;

    public SourceFetchException(String sourceId, Throwable cause) {
        super("Failed to fetch index for source " + sourceId + ": " + cause.getMessage(), cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
