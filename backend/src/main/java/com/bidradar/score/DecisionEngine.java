package com.bidradar.score;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Fixed precedence table over the two buckets plus the derived summary line and tags.
 *
 * <ol>
 *   <li>{@code GO}: planning deadline with a mid or enterprise budget</li>
 *   <li>{@code MAYBE}: near-term or planning deadline with a small or mid budget</li>
 *   <li>{@code NO_GO}: everything else</li>
 * </ol>
 */
@Component
public class DecisionEngine {
    private static final Set<BudgetBucket> GO_BUDGETS = Set.of(BudgetBucket.MID, BudgetBucket.ENTERPRISE);
    private static final Set<DeadlineBucket> MAYBE_DEADLINES = Set.of(DeadlineBucket.NEAR_TERM, DeadlineBucket.PLANNING);
    private static final Set<BudgetBucket> MAYBE_BUDGETS = Set.of(BudgetBucket.SMALL, BudgetBucket.MID);
    private static final String UNKNOWN = "unknown";

    public Decision decide(DeadlineBucket deadlineBucket, BudgetBucket budgetBucket) {
        if (deadlineBucket == DeadlineBucket.PLANNING && GO_BUDGETS.contains(budgetBucket)) {
            return Decision.GO;
        }
        if (MAYBE_DEADLINES.contains(deadlineBucket) && MAYBE_BUDGETS.contains(budgetBucket)) {
            return Decision.MAYBE;
        }
        return Decision.NO_GO;
    }

    public String oneLiner(String buyerOrg, BudgetBucket budgetBucket, DeadlineBucket deadlineBucket) {
        return orDefault(buyerOrg, "Unknown")
            + " opportunity - "
            + bucketName(budgetBucket)
            + " budget, "
            + bucketName(deadlineBucket)
            + " deadline";
    }

    public List<String> tags(
        Decision decision,
        String buyerType,
        BudgetBucket budgetBucket,
        String region,
        DeadlineBucket deadlineBucket
    ) {
        return List.of(
            "decision_" + (decision == null ? Decision.NO_GO : decision).name(),
            "buyer_" + orDefault(buyerType, UNKNOWN),
            "budget_" + bucketName(budgetBucket),
            "region_" + orDefault(region, UNKNOWN),
            "deadline_" + bucketName(deadlineBucket)
        );
    }

    private static String bucketName(BudgetBucket bucket) {
        return (bucket == null ? BudgetBucket.UNKNOWN : bucket).wireName();
    }

    private static String bucketName(DeadlineBucket bucket) {
        return (bucket == null ? DeadlineBucket.UNKNOWN : bucket).wireName();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
