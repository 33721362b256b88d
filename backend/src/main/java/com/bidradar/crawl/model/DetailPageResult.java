package com.bidradar.crawl.model;

public record DetailPageResult(String pdfUrl, String rawDeadlineText, String description) {
    private static final DetailPageResult DEGRADED = new DetailPageResult(null, null, "");

    public DetailPageResult {
        if (description == null) {
            description = "";
        }
    }

    /** Detail fields of a listing whose detail page could not be fetched. */
    public static DetailPageResult degraded() {
        return DEGRADED;
    }

    public static DetailPageResult directDocument(String documentUrl) {
        return new DetailPageResult(documentUrl, null, "");
    }
}
