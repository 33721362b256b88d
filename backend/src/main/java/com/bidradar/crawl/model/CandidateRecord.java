package com.bidradar.crawl.model;

import java.time.Instant;

/**
 * One discovered opportunity before scoring. {@code id} and {@code fetchedAt} are assigned by the
 * ingestion driver; the crawler leaves them null.
 */
public record CandidateRecord(
    String id,
    String sourceId,
    String title,
    String canonicalUrl,
    String buyerOrg,
    String buyerType,
    String region,
    String pdfUrl,
    String rawDeadlineText,
    String description,
    Instant fetchedAt
) {
    public static final String UNTITLED = "Untitled";

    public CandidateRecord {
        if (title == null || title.isBlank()) {
            title = UNTITLED;
        }
        if (description == null) {
            description = "";
        }
    }

    public CandidateRecord withIdentity(String newId, Instant newFetchedAt) {
        return new CandidateRecord(
            newId,
            sourceId,
            title,
            canonicalUrl,
            buyerOrg,
            buyerType,
            region,
            pdfUrl,
            rawDeadlineText,
            description,
            newFetchedAt
        );
    }
}
