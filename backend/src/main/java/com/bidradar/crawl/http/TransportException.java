package com.bidradar.crawl.http;

import com.bidradar.crawl.model.HttpFetchResult;

/**
 * Network or HTTP failure that survived the client's retry budget.
 */
public class TransportException extends RuntimeException {
    private final String url;
    private final int statusCode;
    private final String errorCode;

    public TransportException(String url, int statusCode, String errorCode, String message) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public static TransportException from(HttpFetchResult result) {
        return new TransportException(
            result.requestedUrl(),
            result.statusCode(),
            result.errorCode(),
            "GET " + result.requestedUrl() + " failed after " + result.attempts()
                + " attempt(s): " + result.describeFailure()
        );
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
