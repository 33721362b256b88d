package com.bidradar.score;

import com.bidradar.crawl.model.CandidateRecord;
import com.bidradar.crawl.model.ScoredRecord;

/**
 * Turns a freshly discovered opportunity into its scored, history-ready form.
 */
public interface OpportunityScorer {
    ScoredRecord score(CandidateRecord candidate);
}
