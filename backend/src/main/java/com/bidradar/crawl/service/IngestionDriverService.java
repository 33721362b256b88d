package com.bidradar.crawl.service;

import com.bidradar.config.CrawlerProperties;
import com.bidradar.crawl.model.CandidateRecord;
import com.bidradar.crawl.model.IngestionResult;
import com.bidradar.crawl.model.IngestionRunSummary;
import com.bidradar.crawl.model.ScoredRecord;
import com.bidradar.crawl.model.SourceConfig;
import com.bidradar.crawl.model.SourceFailure;
import com.bidradar.crawl.source.SourceCatalog;
import com.bidradar.crawl.source.SourcesConfigLoader;
import com.bidradar.crawl.util.OpportunityIdentity;
import com.bidradar.history.OpportunityHistoryStore;
import com.bidradar.history.SeenOpportunityIds;
import com.bidradar.score.OpportunityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * One ingestion pass: crawl every configured source, drop candidates already in the history log,
 * score the rest and append them as a single batch.
 */
@Service
public class IngestionDriverService {
    private static final Logger log = LoggerFactory.getLogger(IngestionDriverService.class);

    private final SourceCrawlerService sourceCrawlerService;
    private final OpportunityScorer scorer;
    private final OpportunityHistoryStore historyStore;
    private final SourcesConfigLoader sourcesConfigLoader;
    private final CrawlerProperties properties;
    private final ExecutorService crawlExecutor;
    private final Clock clock;

    public IngestionDriverService(
        SourceCrawlerService sourceCrawlerService,
        OpportunityScorer scorer,
        OpportunityHistoryStore historyStore,
        SourcesConfigLoader sourcesConfigLoader,
        CrawlerProperties properties,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor,
        Clock clock
    ) {
        this.sourceCrawlerService = sourceCrawlerService;
        this.scorer = scorer;
        this.historyStore = historyStore;
        this.sourcesConfigLoader = sourcesConfigLoader;
        this.properties = properties;
        this.crawlExecutor = crawlExecutor;
        this.clock = clock;
    }

    /**
     * Loads sources and history, ingests, appends the new records and logs the run report.
     * Only an unreadable sources file or history file aborts the run.
     */
    public IngestionRunSummary runOnce() {
        Instant startedAt = clock.instant();
        SourceCatalog catalog = sourcesConfigLoader.load(Paths.get(properties.getData().getSourcesFile()));
        SeenOpportunityIds seen = historyStore.loadSeenIds();

        IngestionResult result = ingest(catalog, seen);
        historyStore.append(result.newRecords());

        IngestionRunSummary summary = new IngestionRunSummary(
            startedAt,
            clock.instant(),
            result.sourcesAttempted(),
            result.candidatesSeen(),
            result.duplicatesSkipped(),
            result.newRecords().size(),
            historyStore.historyFile().toString(),
            result.failures()
        );
        report(summary);
        return summary;
    }

    /**
     * Crawls and scores without touching the history log. {@code seen} is only read.
     * Records come back grouped by source in configured order, whether or not sources are crawled
     * concurrently. Candidates that repeat within this pass are not collapsed.
     */
    public IngestionResult ingest(SourceCatalog catalog, SeenOpportunityIds seen) {
        List<SourceFailure> failures = new ArrayList<>(catalog.rejected());
        List<SourceOutcome> outcomes = crawlAll(catalog.sources());

        List<ScoredRecord> newRecords = new ArrayList<>();
        int candidatesSeen = 0;
        int duplicatesSkipped = 0;
        for (SourceOutcome outcome : outcomes) {
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
                continue;
            }
            try {
                Instant fetchedAt = clock.instant();
                for (CandidateRecord crawled : outcome.candidates()) {
                    candidatesSeen++;
                    CandidateRecord candidate = crawled.withIdentity(OpportunityIdentity.stableId(crawled), fetchedAt);
                    if (seen.contains(candidate.id())) {
                        duplicatesSkipped++;
                        continue;
                    }
                    newRecords.add(scorer.score(candidate));
                }
            } catch (RuntimeException e) {
                log.warn("Source {} failed while scoring", outcome.sourceId(), e);
                failures.add(new SourceFailure(outcome.sourceId(), describe(e)));
            }
        }
        return new IngestionResult(
            newRecords,
            catalog.sources().size() + catalog.rejected().size(),
            candidatesSeen,
            duplicatesSkipped,
            failures
        );
    }

    private List<SourceOutcome> crawlAll(List<SourceConfig> sources) {
        if (properties.getSourceConcurrency() <= 1 || sources.size() <= 1) {
            List<SourceOutcome> outcomes = new ArrayList<>();
            for (SourceConfig source : sources) {
                outcomes.add(crawlOne(source));
            }
            return outcomes;
        }

        List<CompletableFuture<SourceOutcome>> futures = new ArrayList<>();
        for (SourceConfig source : sources) {
            futures.add(CompletableFuture.supplyAsync(() -> crawlOne(source), crawlExecutor));
        }
        List<SourceOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            SourceConfig source = sources.get(i);
            try {
                outcomes.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                outcomes.add(SourceOutcome.failed(source.id(), describe(cause)));
            }
        }
        return outcomes;
    }

    private SourceOutcome crawlOne(SourceConfig source) {
        try {
            List<CandidateRecord> candidates = sourceCrawlerService.crawl(source);
            return SourceOutcome.crawled(source.id(), candidates);
        } catch (SourceFetchException e) {
            log.warn("Source {} skipped: {}", source.id(), e.getMessage());
            return SourceOutcome.failed(source.id(), describe(e));
        } catch (RuntimeException e) {
            log.warn("Source {} failed", source.id(), e);
            return SourceOutcome.failed(source.id(), describe(e));
        }
    }

    private void report(IngestionRunSummary summary) {
        log.info(
            "Ingestion run complete: sources={}, candidates={}, duplicates={}, appended={}, history={}",
            summary.sourcesAttempted(),
            summary.candidatesSeen(),
            summary.duplicatesSkipped(),
            summary.newRecordsAppended(),
            summary.historyFile()
        );
        if (!summary.failures().isEmpty()) {
            log.warn("{} source failure(s) encountered", summary.failures().size());
            for (SourceFailure failure : summary.failures()) {
                log.warn("source_id={} error={}", failure.sourceId(), failure.error());
            }
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private record SourceOutcome(String sourceId, List<CandidateRecord> candidates, SourceFailure failure) {
        static SourceOutcome crawled(String sourceId, List<CandidateRecord> candidates) {
            return new SourceOutcome(sourceId, candidates, null);
        }

        static SourceOutcome failed(String sourceId, String error) {
            return new SourceOutcome(sourceId, List.of(), new SourceFailure(sourceId, error));
        }
    }
}
