package com.bidradar.crawl.service;

import com.bidradar.config.CrawlerProperties;
import com.bidradar.crawl.model.CandidateRecord;
import com.bidradar.crawl.model.CrawlOptions;
import com.bidradar.crawl.model.DetailFetchError;
import com.bidradar.crawl.model.SelectorTestReport;
import com.bidradar.crawl.model.SourceConfig;
import com.bidradar.crawl.model.SourceCrawlResult;
import com.bidradar.crawl.model.SourceFailure;
import com.bidradar.crawl.source.SourceCatalog;
import com.bidradar.crawl.source.SourcesConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs only the crawl stage for one source so a new selector configuration can be checked in
 * isolation. Nothing is scored and the history log is never touched.
 */
@Service
public class SelectorTestService {
    private static final Logger log = LoggerFactory.getLogger(SelectorTestService.class);
    static final String INDEX_FETCH_STAGE = "index_fetch";

    private final SourceCrawlerService sourceCrawlerService;
    private final SourcesConfigLoader sourcesConfigLoader;
    private final CrawlerProperties properties;

    public SelectorTestService(
        SourceCrawlerService sourceCrawlerService,
        SourcesConfigLoader sourcesConfigLoader,
        CrawlerProperties properties
    ) {
        this.sourceCrawlerService = sourceCrawlerService;
        this.sourcesConfigLoader = sourcesConfigLoader;
        this.properties = properties;
    }

    public SelectorTestReport test(String sourceId, int limit, boolean fetchDetails) {
        SourceCatalog catalog = sourcesConfigLoader.load(Paths.get(properties.getData().getSourcesFile()));
        Optional<SourceConfig> source = catalog.findById(sourceId);
        if (source.isPresent()) {
            return test(source.get(), limit, fetchDetails);
        }
        String sourcesFile = properties.getData().getSourcesFile();
        for (SourceFailure rejected : catalog.rejected()) {
            if (rejected.sourceId().equals(sourceId.trim())) {
                throw new IllegalArgumentException(
                    "Source '" + sourceId + "' is invalid in " + sourcesFile + ": " + rejected.error()
                );
            }
        }
        throw new IllegalArgumentException("Source '" + sourceId + "' not found in " + sourcesFile);
    }

    public SelectorTestReport test(SourceConfig source, int limit, boolean fetchDetails) {
        List<SelectorTestReport.Item> items = new ArrayList<>();
        List<SelectorTestReport.ErrorEntry> errors = new ArrayList<>();
        try {
            SourceCrawlResult result = sourceCrawlerService.crawl(source, new CrawlOptions(limit, fetchDetails));
            for (CandidateRecord record : result.records()) {
                items.add(new SelectorTestReport.Item(record.title(), record.canonicalUrl(), record.pdfUrl()));
            }
            for (DetailFetchError error : result.detailErrors()) {
                errors.add(SelectorTestReport.ErrorEntry.forUrl(error.url(), error.error()));
            }
        } catch (SourceFetchException e) {
            errors.add(SelectorTestReport.ErrorEntry.forStage(INDEX_FETCH_STAGE, e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Selector test for {} failed", source.id(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            errors.add(SelectorTestReport.ErrorEntry.forStage(INDEX_FETCH_STAGE, message));
        }
        log.info("Selector test for {}: {} item(s), {} error(s)", source.id(), items.size(), errors.size());
        return new SelectorTestReport(source.id(), source.indexUrl(), items.size(), items, errors);
    }
}
