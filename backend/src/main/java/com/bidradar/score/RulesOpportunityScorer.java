package com.bidradar.score;

import com.bidradar.crawl.model.CandidateRecord;
import com.bidradar.crawl.model.ScoredRecord;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Deterministic scorer: deadline and budget buckets feed the {@link DecisionEngine} table.
 * The budget is read from the listing description.
 */
@Service
public class RulesOpportunityScorer implements OpportunityScorer {
    private final DeadlineNormalizer deadlineNormalizer;
    private final BudgetExtractor budgetExtractor;
    private final BucketClassifier bucketClassifier;
    private final DecisionEngine decisionEngine;
    private final Clock clock;

    public RulesOpportunityScorer(
        DeadlineNormalizer deadlineNormalizer,
        BudgetExtractor budgetExtractor,
        BucketClassifier bucketClassifier,
        DecisionEngine decisionEngine,
        Clock clock
    ) {
        this.deadlineNormalizer = deadlineNormalizer;
        this.budgetExtractor = budgetExtractor;
        this.bucketClassifier = bucketClassifier;
        this.decisionEngine = decisionEngine;
        this.clock = clock;
    }

    @Override
    public ScoredRecord score(CandidateRecord candidate) {
        Instant now = clock.instant();
        String deadline = deadlineNormalizer.normalize(candidate.rawDeadlineText());
        DeadlineBucket deadlineBucket = bucketClassifier.deadlineBucket(deadline, now);
        BigDecimal budgetValue = budgetExtractor.extract(candidate.description());
        BudgetBucket budgetBucket = bucketClassifier.budgetBucket(budgetValue);
        Decision decision = decisionEngine.decide(deadlineBucket, budgetBucket);

        return new ScoredRecord(
            candidate.id(),
            candidate.sourceId(),
            candidate.title(),
            candidate.canonicalUrl(),
            candidate.buyerOrg(),
            candidate.buyerType(),
            candidate.region(),
            candidate.pdfUrl(),
            candidate.rawDeadlineText(),
            candidate.description(),
            candidate.fetchedAt(),
            deadline,
            deadlineBucket,
            budgetValue,
            budgetBucket,
            decision,
            decisionEngine.oneLiner(candidate.buyerOrg(), budgetBucket, deadlineBucket),
            decisionEngine.tags(decision, candidate.buyerType(), budgetBucket, candidate.region(), deadlineBucket)
        );
    }
}
