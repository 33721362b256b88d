package com.bidradar.crawl.select;

import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;

import java.util.List;

/**
 * Ordered list of selectors with the two evaluation rules used by the crawler: listing links are
 * the union of every selector's matches, document links come from the first selector that matches.
 */
public final class SelectorChain {
    private final List<LinkSelector> selectors;

    public SelectorChain(List<? extends LinkSelector> selectors) {
        if (selectors == null || selectors.isEmpty()) {
            throw new IllegalArgumentException("selector chain must not be empty");
        }
        this.selectors = List.copyOf(selectors);
    }

    public static SelectorChain css(List<String> queries) {
        return new SelectorChain(queries.stream().map(CssLinkSelector::new).toList());
    }

    public static SelectorChain css(String... queries) {
        return css(List.of(queries));
    }

    /** Matches of every selector, concatenated in selector order. Duplicates are kept. */
    public Elements union(Document document) {
        Elements out = new Elements();
        for (LinkSelector selector : selectors) {
            out.addAll(selector.match(document));
        }
        return out;
    }

    /** Matches of the first selector that yields anything, or an empty result. */
    public Elements firstMatch(Document document) {
        for (LinkSelector selector : selectors) {
            Elements matched = selector.match(document);
            if (!matched.isEmpty()) {
                return matched;
            }
        }
        return new Elements();
    }

    public List<LinkSelector> selectors() {
        return selectors;
    }

    @Override
    public String toString() {
        return selectors.toString();
    }
}
