package com.bidradar.crawl.model;

import java.util.List;

public record IngestionResult(
    List<ScoredRecord> newRecords,
    int sourcesAttempted,
    int candidatesSeen,
    int duplicatesSkipped,
    List<SourceFailure> failures
) {
    public IngestionResult {
        newRecords = List.copyOf(newRecords);
        failures = List.copyOf(failures);
    }
}
