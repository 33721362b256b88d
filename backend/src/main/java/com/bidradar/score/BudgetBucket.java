package com.bidradar.score;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BudgetBucket {
    MICRO("micro"),
    SMALL("small"),
    MID("mid"),
    ENTERPRISE("enterprise"),
    UNKNOWN("unknown");

    private final String wireName;

    BudgetBucket(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
