package com.bidradar.score;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeadlineBucket {
    IMMEDIATE("immediate"),
    NEAR_TERM("near_term"),
    PLANNING("planning"),
    UNKNOWN("unknown");

    private final String wireName;

    DeadlineBucket(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
