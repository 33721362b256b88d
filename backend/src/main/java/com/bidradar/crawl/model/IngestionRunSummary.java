package com.bidradar.crawl.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestionRunSummary(
    Instant startedAt,
    Instant finishedAt,
    int sourcesAttempted,
    int candidatesSeen,
    int duplicatesSkipped,
    int newRecordsAppended,
    String historyFile,
    List<SourceFailure> failures
) {}
