package com.bidradar.crawl.model;

/**
 * Per-call overrides for a source crawl.
 *
 * @param listingLimit optional cap applied on top of the source's {@code max_listings}
 * @param fetchDetails when false, detail pages are never requested
 */
public record CrawlOptions(Integer listingLimit, boolean fetchDetails) {
    public static final CrawlOptions DEFAULT = new CrawlOptions(null, true);

    public int effectiveLimit(int maxListings) {
        if (listingLimit == null) {
            return maxListings;
        }
        return Math.max(1, Math.min(listingLimit, maxListings));
    }
}
