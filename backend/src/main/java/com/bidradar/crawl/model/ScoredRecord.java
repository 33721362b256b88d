package com.bidradar.crawl.model;

import com.bidradar.score.BudgetBucket;
import com.bidradar.score.DeadlineBucket;
import com.bidradar.score.Decision;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A scored opportunity as written to the history log, one JSON object per line.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScoredRecord(
    String id,
    String sourceId,
    String title,
    String canonicalUrl,
    String buyerOrg,
    String buyerType,
    String region,
    String pdfUrl,
    String rawDeadlineText,
    String description,
    Instant fetchedAt,
    String deadline,
    DeadlineBucket deadlineBucket,
    BigDecimal budgetValue,
    BudgetBucket budgetBucket,
    Decision decision,
    String oneLiner,
    List<String> tags
) {
    public ScoredRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    @JsonProperty("tags_line")
    public String tagsLine() {
        return String.join(" ", tags);
    }
}
