package com.bidradar.crawl.service;

import com.bidradar.config.CrawlerProperties;
import com.bidradar.config.IngestConfig;
import com.bidradar.crawl.http.TransportException;
import com.bidradar.crawl.model.CandidateRecord;
import com.bidradar.crawl.model.IngestionResult;
import com.bidradar.crawl.model.IngestionRunSummary;
import com.bidradar.crawl.model.ScoredRecord;
import com.bidradar.crawl.model.SourceConfig;
import com.bidradar.crawl.model.SourceFailure;
import com.bidradar.crawl.select.SelectorChain;
import com.bidradar.crawl.source.SourceCatalog;
import com.bidradar.crawl.source.SourcesConfigLoader;
import com.bidradar.crawl.util.OpportunityIdentity;
import com.bidradar.history.OpportunityHistoryStore;
import com.bidradar.history.SeenOpportunityIds;
import com.bidradar.score.BucketClassifier;
import com.bidradar.score.BudgetExtractor;
import com.bidradar.score.DeadlineNormalizer;
import com.bidradar.score.Decision;
import com.bidradar.score.DecisionEngine;
import com.bidradar.score.RulesOpportunityScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionDriverServiceTest {
    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private SourceCrawlerService sourceCrawlerService;
    @Mock
    private SourcesConfigLoader sourcesConfigLoader;

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private CrawlerProperties properties;
    private ExecutorService executor;
    private OpportunityHistoryStore historyStore;
    private IngestionDriverService driver;

    private final SourceConfig cityA = source("city-a");
    private final SourceConfig cityB = source("city-b");
    private final SourceConfig cityC = source("city-c");

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        executor = Executors.newFixedThreadPool(3);
        historyStore = new OpportunityHistoryStore(tempDir.resolve("processed/opportunities.ndjson"), IngestConfig.jsonMapper());
        driver = newDriver();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void sourceFailureIsRecordedAndOtherSourcesContinue() {
        when(sourceCrawlerService.crawl(cityA)).thenThrow(new SourceFetchException(
            "city-a",
            new TransportException("https://city-a.example.gov/", 503, null, "GET failed after 3 attempt(s): http_503")
        ));
        when(sourceCrawlerService.crawl(cityB)).thenReturn(List.of(candidate("city-b", "/bids/1", "Roads")));
        when(sourceCrawlerService.crawl(cityC)).thenThrow(new IllegalStateException("parser exploded"));

        IngestionResult result = driver.ingest(SourceCatalog.of(List.of(cityA, cityB, cityC)), SeenOpportunityIds.empty());

        assertThat(result.newRecords()).extracting(ScoredRecord::sourceId).containsExactly("city-b");
        assertThat(result.failures()).extracting(SourceFailure::sourceId).containsExactly("city-a", "city-c");
        assertThat(result.failures().get(0).error()).contains("city-a").contains("http_503");
        assertThat(result.failures().get(1).error()).isEqualTo("parser exploded");
        assertThat(result.sourcesAttempted()).isEqualTo(3);
    }

    @Test
    void rejectedConfigEntriesAreReportedAsFailures() {
        when(sourceCrawlerService.crawl(cityA)).thenReturn(List.of());
        SourceCatalog catalog = new SourceCatalog(
            List.of(cityA),
            List.of(new SourceFailure("rss", "unsupported source type: rss_feed"))
        );

        IngestionResult result = driver.ingest(catalog, SeenOpportunityIds.empty());

        assertThat(result.failures()).containsExactly(new SourceFailure("rss", "unsupported source type: rss_feed"));
        assertThat(result.sourcesAttempted()).isEqualTo(2);
    }

    @Test
    void candidatesAlreadyInHistoryAreSkipped() {
        CandidateRecord known = candidate("city-a", "/bids/1", "Roads");
        CandidateRecord fresh = candidate("city-a", "/bids/2", "Bridges");
        when(sourceCrawlerService.crawl(cityA)).thenReturn(List.of(known, fresh));
        SeenOpportunityIds seen = SeenOpportunityIds.of(List.of(OpportunityIdentity.stableId(known)));

        IngestionResult result = driver.ingest(SourceCatalog.of(List.of(cityA)), seen);

        assertThat(result.newRecords()).extracting(ScoredRecord::title).containsExactly("Bridges");
        assertThat(result.candidatesSeen()).isEqualTo(2);
        assertThat(result.duplicatesSkipped()).isEqualTo(1);
    }

    @Test
    void identifierIsComputedFromRawDeadlineTextAndStampedWithFetchTime() {
        CandidateRecord crawled = candidate("city-a", "/bids/1", "Roads");
        when(sourceCrawlerService.crawl(cityA)).thenReturn(List.of(crawled));

        ScoredRecord scored = driver.ingest(SourceCatalog.of(List.of(cityA)), SeenOpportunityIds.empty())
            .newRecords().get(0);

        assertThat(scored.id()).isEqualTo(OpportunityIdentity.stableId(
            "city-a",
            "https://city-a.example.gov/bids/1",
            "Roads",
            "August 15, 2025"
        ));
        assertThat(scored.deadline()).isEqualTo("2025-08-15");
        assertThat(scored.fetchedAt()).isEqualTo(NOW);
        assertThat(scored.decision()).isEqualTo(Decision.GO);
    }

    @Test
    void duplicatesWithinOneRunAreBothKept() {
        CandidateRecord first = candidate("city-a", "/bids/1", "Roads");
        CandidateRecord twin = candidate("city-a", "/bids/1", "Roads");
        when(sourceCrawlerService.crawl(cityA)).thenReturn(List.of(first, twin));

        IngestionResult result = driver.ingest(SourceCatalog.of(List.of(cityA)), SeenOpportunityIds.empty());

        assertThat(result.newRecords()).hasSize(2);
        assertThat(result.newRecords().get(0).id()).isEqualTo(result.newRecords().get(1).id());
    }

    @Test
    void secondRunOverUnchangedSourcesAppendsNothing() throws Exception {
        when(sourcesConfigLoader.load(any(Path.class))).thenReturn(SourceCatalog.of(List.of(cityA, cityB)));
        when(sourceCrawlerService.crawl(cityA)).thenReturn(List.of(candidate("city-a", "/bids/1", "Roads")));
        when(sourceCrawlerService.crawl(cityB)).thenReturn(List.of(
            candidate("city-b", "/bids/7", "Parks"),
            candidate("city-b", "/bids/8", "Lighting")
        ));

        IngestionRunSummary first = driver.runOnce();
        IngestionRunSummary second = driver.runOnce();

        assertThat(first.newRecordsAppended()).isEqualTo(3);
        assertThat(second.newRecordsAppended()).isZero();
        assertThat(second.duplicatesSkipped()).isEqualTo(3);
        assertThat(Files.readAllLines(historyStore.historyFile())).hasSize(3);
    }

    @Test
    void concurrentCrawlKeepsConfiguredSourceOrder() {
        properties.setSourceConcurrency(3);
        driver = newDriver();
        when(sourceCrawlerService.crawl(cityA)).thenAnswer(invocation -> {
            Thread.sleep(50);
            return List.of(candidate("city-a", "/bids/1", "A1"));
        });
        when(sourceCrawlerService.crawl(cityB)).thenReturn(List.of(candidate("city-b", "/bids/1", "B1")));
        when(sourceCrawlerService.crawl(cityC)).thenReturn(List.of(candidate("city-c", "/bids/1", "C1")));

        IngestionResult result = driver.ingest(SourceCatalog.of(List.of(cityA, cityB, cityC)), SeenOpportunityIds.empty());

        assertThat(result.newRecords()).extracting(ScoredRecord::title).containsExactly("A1", "B1", "C1");
    }

    private IngestionDriverService newDriver() {
        RulesOpportunityScorer scorer = new RulesOpportunityScorer(
            new DeadlineNormalizer(),
            new BudgetExtractor(),
            new BucketClassifier(),
            new DecisionEngine(),
            clock
        );
        return new IngestionDriverService(
            sourceCrawlerService,
            scorer,
            historyStore,
            sourcesConfigLoader,
            properties,
            executor,
            clock
        );
    }

    private static SourceConfig source(String id) {
        return new SourceConfig(
            id,
            "https://" + id + ".example.gov/",
            SelectorChain.css("a"),
            SelectorChain.css("a[href$='.pdf']"),
            10,
            "City " + id,
            "municipal",
            "us_west",
            false
        );
    }

    private static CandidateRecord candidate(String sourceId, String path, String title) {
        return new CandidateRecord(
            null,
            sourceId,
            title,
            "https://" + sourceId + ".example.gov" + path,
            "City " + sourceId,
            "municipal",
            "us_west",
            null,
            "August 15, 2025",
            "Estimated budget $600,000",
            null
        );
    }
}
