package com.bidradar.crawl.select;

import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;
import org.jsoup.select.Evaluator;
import org.jsoup.select.QueryParser;

/**
 * CSS query compiled once at config-load time. Invalid queries fail in the constructor with
 * {@link org.jsoup.select.Selector.SelectorParseException}.
 */
public final class CssLinkSelector implements LinkSelector {
    private final String query;
    private final Evaluator evaluator;

    public CssLinkSelector(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("selector must not be blank");
        }
        this.query = query.trim();
        this.evaluator = QueryParser.parse(this.query);
    }

    @Override
    public Elements match(Document document) {
        if (document == null) {
            return new Elements();
        }
        return document.select(evaluator);
    }

    public String query() {
        return query;
    }

    @Override
    public String toString() {
        return query;
    }
}
