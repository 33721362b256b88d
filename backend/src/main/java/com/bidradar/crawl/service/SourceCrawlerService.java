package com.bidradar.crawl.service;

import com.bidradar.crawl.detail.DetailPageExtractor;
import com.bidradar.crawl.http.PoliteHttpClient;
import com.bidradar.crawl.http.TransportException;
import com.bidradar.crawl.model.CandidateRecord;
import com.bidradar.crawl.model.CrawlOptions;
import com.bidradar.crawl.model.DetailFetchError;
import com.bidradar.crawl.model.DetailPageResult;
import com.bidradar.crawl.model.HttpFetchResult;
import com.bidradar.crawl.model.SourceConfig;
import com.bidradar.crawl.model.SourceCrawlResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Crawls one configured source: index page, listing links, then one detail page per listing.
 *
 * <p>Only an unreachable index page fails the source. A detail page that cannot be fetched leaves
 * that listing's document link, deadline and description empty and the crawl carries on.
 */
@Service
public class SourceCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(SourceCrawlerService.class);

    private final PoliteHttpClient httpClient;
    private final DetailPageExtractor detailPageExtractor;

    public SourceCrawlerService(PoliteHttpClient httpClient, DetailPageExtractor detailPageExtractor) {
        this.httpClient = httpClient;
        this.detailPageExtractor = detailPageExtractor;
    }

    public List<CandidateRecord> crawl(SourceConfig source) {
        return crawl(source, CrawlOptions.DEFAULT).records();
    }

    public SourceCrawlResult crawl(SourceConfig source, CrawlOptions options) {
        CrawlOptions effective = options == null ? CrawlOptions.DEFAULT : options;
        HttpFetchResult index = httpClient.get(source.indexUrl());
        if (!index.isSuccessful()) {
            throw new SourceFetchException(source.id(), TransportException.from(index));
        }

        String indexUrl = index.finalUrlOrRequested();
        Document indexDocument = Jsoup.parse(index.body() == null ? "" : index.body(), indexUrl);
        List<Element> listings = selectListings(indexDocument, source, effective.effectiveLimit(source.maxListings()));
        log.info("Source {}: {} listing link(s) selected from {}", source.id(), listings.size(), indexUrl);

        List<CandidateRecord> records = new ArrayList<>();
        List<DetailFetchError> detailErrors = new ArrayList<>();
        for (Element link : listings) {
            String href = link.attr("href");
            String canonicalUrl = resolve(link, href);
            String title = link.text().trim();

            DetailPageResult detail;
            if (source.directDocumentLinks() && looksLikeDocument(href)) {
                detail = DetailPageResult.directDocument(canonicalUrl);
            } else if (!effective.fetchDetails()) {
                detail = DetailPageResult.degraded();
            } else {
                detail = fetchDetail(source, canonicalUrl, detailErrors);
            }

            records.add(new CandidateRecord(
                null,
                source.id(),
                title,
                canonicalUrl,
                source.buyerOrg(),
                source.buyerType(),
                source.region(),
                detail.pdfUrl(),
                detail.rawDeadlineText(),
                detail.description(),
                null
            ));
        }
        return new SourceCrawlResult(source.id(), records, detailErrors);
    }

    /**
     * Union of every listing selector's matches, in selector order, without href-less anchors,
     * de-duplicated by raw href (first seen wins) and capped at {@code limit}.
     */
    List<Element> selectListings(Document indexDocument, SourceConfig source, int limit) {
        Set<String> seenHrefs = new LinkedHashSet<>();
        List<Element> unique = new ArrayList<>();
        for (Element element : source.listingSelectors().union(indexDocument)) {
            String href = element.attr("href");
            if (href.isEmpty()) {
                continue;
            }
            if (!seenHrefs.add(href)) {
                continue;
            }
            unique.add(element);
            if (unique.size() >= limit) {
                break;
            }
        }
        return unique;
    }

    private DetailPageResult fetchDetail(SourceConfig source, String detailUrl, List<DetailFetchError> detailErrors) {
        HttpFetchResult detail = httpClient.get(detailUrl);
        if (!detail.isSuccessful()) {
            String error = "Failed to fetch detail: " + TransportException.from(detail).getMessage();
            log.debug("Source {}: degraded listing {} ({})", source.id(), detailUrl, detail.describeFailure());
            detailErrors.add(new DetailFetchError(detailUrl, error));
            return DetailPageResult.degraded();
        }
        Document document = Jsoup.parse(detail.body() == null ? "" : detail.body(), detail.finalUrlOrRequested());
        return detailPageExtractor.extract(document, source.pdfSelectors());
    }

    private static String resolve(Element link, String href) {
        String absolute = link.absUrl("href");
        return absolute.isEmpty() ? href.trim() : absolute;
    }

    static boolean looksLikeDocument(String href) {
        String lower = href.toLowerCase(Locale.ROOT);
        return lower.endsWith(".pdf") || lower.contains(".pdf?");
    }
}
