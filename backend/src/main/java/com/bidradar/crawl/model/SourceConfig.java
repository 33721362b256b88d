package com.bidradar.crawl.model;

import com.bidradar.crawl.select.SelectorChain;

/**
 * Canonical crawl target. Both configuration schemas are normalized into this shape at load time.
 */
public record SourceConfig(
    String id,
    String indexUrl,
    SelectorChain listingSelectors,
    SelectorChain pdfSelectors,
    int maxListings,
    String buyerOrg,
    String buyerType,
    String region,
    boolean directDocumentLinks
) {
    public SourceConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("source id must not be blank");
        }
        if (maxListings < 1) {
            throw new IllegalArgumentException("max_listings must be >= 1 for source " + id);
        }
    }
}
