package com.bidradar.crawl.select;

import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;

/**
 * One configured way of locating link elements in a fetched page.
 */
@FunctionalInterface
public interface LinkSelector {
    Elements match(Document document);
}
