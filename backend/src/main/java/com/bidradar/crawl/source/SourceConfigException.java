package com.bidradar.crawl.source;

/**
 * A single source entry is unusable. Only that source is rejected; the rest of the file loads.
 */
public class SourceConfigException extends RuntimeException {
    private final String sourceId;

    public SourceConfigException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public SourceConfigException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
