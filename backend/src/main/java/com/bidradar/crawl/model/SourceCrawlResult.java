package com.bidradar.crawl.model;

import java.util.List;

public record SourceCrawlResult(String sourceId, List<CandidateRecord> records, List<DetailFetchError> detailErrors) {
    public SourceCrawlResult {
        records = List.copyOf(records);
        detailErrors = List.copyOf(detailErrors);
    }
}
