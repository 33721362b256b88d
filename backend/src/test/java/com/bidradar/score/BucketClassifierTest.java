package com.bidradar.score;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class BucketClassifierTest {
    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private final BucketClassifier classifier = new BucketClassifier();

    @Test
    void missingOrInvalidDeadlineIsUnknown() {
        assertThat(classifier.deadlineBucket(null, NOW)).isEqualTo(DeadlineBucket.UNKNOWN);
        assertThat(classifier.deadlineBucket("2025-13-45", NOW)).isEqualTo(DeadlineBucket.UNKNOWN);
        assertThat(classifier.deadlineBucket("soon", NOW)).isEqualTo(DeadlineBucket.UNKNOWN);
    }

    @Test
    void deadlineBoundariesUseFlooredDays() {
        // 2025-06-09T00:00Z is 7 days 12 hours away -> 7 days
        assertThat(classifier.deadlineBucket("2025-06-09", NOW)).isEqualTo(DeadlineBucket.NEAR_TERM);
        // 2025-06-08T00:00Z is 6 days 12 hours away -> 6 days
        assertThat(classifier.deadlineBucket("2025-06-08", NOW)).isEqualTo(DeadlineBucket.IMMEDIATE);
        assertThat(classifier.deadlineBucket("2025-07-01", NOW)).isEqualTo(DeadlineBucket.NEAR_TERM);
        assertThat(classifier.deadlineBucket("2025-07-02", NOW)).isEqualTo(DeadlineBucket.PLANNING);
    }

    @Test
    void passedDeadlinesAreImmediate() {
        assertThat(classifier.deadlineBucket("2024-01-01", NOW)).isEqualTo(DeadlineBucket.IMMEDIATE);
        assertThat(classifier.deadlineBucket("2025-06-01", NOW)).isEqualTo(DeadlineBucket.IMMEDIATE);
    }

    @Test
    void isoTimestampsAreClassifiedByTheirDate() {
        assertThat(classifier.deadlineBucket("2025-09-01T17:00:00Z", NOW)).isEqualTo(DeadlineBucket.PLANNING);
    }

    @Test
    void deadlineBucketIsMonotonicInDaysUntil() {
        LocalDate start = LocalDate.parse("2025-05-01");
        DeadlineBucket previous = DeadlineBucket.IMMEDIATE;
        for (int offset = 0; offset < 90; offset++) {
            DeadlineBucket bucket = classifier.deadlineBucket(start.plusDays(offset).toString(), NOW);
            assertThat(bucket.ordinal()).isGreaterThanOrEqualTo(previous.ordinal());
            previous = bucket;
        }
        assertThat(previous).isEqualTo(DeadlineBucket.PLANNING);
    }

    @Test
    void budgetBoundaries() {
        assertThat(classifier.budgetBucket(null)).isEqualTo(BudgetBucket.UNKNOWN);
        assertThat(classifier.budgetBucket(new BigDecimal("49999.99"))).isEqualTo(BudgetBucket.MICRO);
        assertThat(classifier.budgetBucket(new BigDecimal("50000"))).isEqualTo(BudgetBucket.SMALL);
        assertThat(classifier.budgetBucket(new BigDecimal("249999"))).isEqualTo(BudgetBucket.SMALL);
        assertThat(classifier.budgetBucket(new BigDecimal("250000"))).isEqualTo(BudgetBucket.MID);
        assertThat(classifier.budgetBucket(new BigDecimal("999999"))).isEqualTo(BudgetBucket.MID);
        assertThat(classifier.budgetBucket(new BigDecimal("1000000.0"))).isEqualTo(BudgetBucket.ENTERPRISE);
    }
}
