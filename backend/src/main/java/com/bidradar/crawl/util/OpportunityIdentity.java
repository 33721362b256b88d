package com.bidradar.crawl.util;

import com.bidradar.crawl.model.CandidateRecord;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content-derived opportunity id. Computed over raw crawl output, before any deadline normalization,
 * so a changed title, URL, source or deadline text yields a different opportunity.
 */
public final class OpportunityIdentity {
    private OpportunityIdentity() {
    }

    public static String stableId(CandidateRecord candidate) {
        return stableId(
            candidate.sourceId(),
            candidate.canonicalUrl(),
            candidate.title(),
            candidate.rawDeadlineText()
        );
    }

    public static String stableId(String sourceId, String canonicalUrl, String title, String rawDeadlineText) {
        String key = String.join(
            "|",
            nullToEmpty(sourceId),
            nullToEmpty(canonicalUrl),
            nullToEmpty(title),
            nullToEmpty(rawDeadlineText)
        );
        return sha256Hex(key);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
