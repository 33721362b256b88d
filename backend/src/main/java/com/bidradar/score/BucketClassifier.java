package com.bidradar.score;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

@Component
public class BucketClassifier {
    static final int IMMEDIATE_DAYS = 7;
    static final int NEAR_TERM_DAYS = 30;
    static final BigDecimal MICRO_LIMIT = BigDecimal.valueOf(50_000L);
    static final BigDecimal SMALL_LIMIT = BigDecimal.valueOf(250_000L);
    static final BigDecimal MID_LIMIT = BigDecimal.valueOf(1_000_000L);

    private static final long SECONDS_PER_DAY = Duration.ofDays(1).toSeconds();

    /**
     * Days are counted from {@code now} to the deadline's midnight UTC, rounded down, so a deadline
     * later today already counts as -1 days. Past deadlines land in {@link DeadlineBucket#IMMEDIATE}.
     */
    public DeadlineBucket deadlineBucket(String isoDate, Instant now) {
        LocalDate deadline = parseDate(isoDate);
        if (deadline == null) {
            return DeadlineBucket.UNKNOWN;
        }
        long days = daysUntil(deadline, now);
        if (days < IMMEDIATE_DAYS) {
            return DeadlineBucket.IMMEDIATE;
        }
        if (days < NEAR_TERM_DAYS) {
            return DeadlineBucket.NEAR_TERM;
        }
        return DeadlineBucket.PLANNING;
    }

    public BudgetBucket budgetBucket(BigDecimal value) {
        if (value == null) {
            return BudgetBucket.UNKNOWN;
        }
        if (value.compareTo(MICRO_LIMIT) < 0) {
            return BudgetBucket.MICRO;
        }
        if (value.compareTo(SMALL_LIMIT) < 0) {
            return BudgetBucket.SMALL;
        }
        if (value.compareTo(MID_LIMIT) < 0) {
            return BudgetBucket.MID;
        }
        return BudgetBucket.ENTERPRISE;
    }

    static long daysUntil(LocalDate deadline, Instant now) {
        Instant deadlineStart = deadline.atStartOfDay(ZoneOffset.UTC).toInstant();
        long seconds = Duration.between(now, deadlineStart).getSeconds();
        return Math.floorDiv(seconds, SECONDS_PER_DAY);
    }

    private static LocalDate parseDate(String isoDate) {
        if (isoDate == null || isoDate.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(isoDate.substring(0, 10));
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}
