package com.bidradar.crawl.select;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectorChainTest {
    private static final String HTML = """
        <ul class="open"><li><a href="/a">A</a></li><li><a href="/b">B</a></li></ul>
        <div class="archive"><a href="/c">C</a></div>
        """;

    private final Document document = Jsoup.parse(HTML, "https://portal.example.com/");

    @Test
    void unionKeepsEverySelectorsMatchesInOrder() {
        SelectorChain chain = SelectorChain.css("div.archive a", "ul.open a", "a[href=/a]");

        Elements matched = chain.union(document);

        assertThat(matched.eachAttr("href")).containsExactly("/c", "/a", "/b", "/a");
    }

    @Test
    void firstMatchSkipsSelectorsWithNoResults() {
        SelectorChain chain = SelectorChain.css("table.missing a", "div.archive a", "ul.open a");

        assertThat(chain.firstMatch(document).eachAttr("href")).containsExactly("/c");
    }

    @Test
    void firstMatchIsEmptyWhenNothingMatches() {
        assertThat(SelectorChain.css("table a", "form a").firstMatch(document)).isEmpty();
    }

    @Test
    void acceptsCustomSelectorCapabilities() {
        LinkSelector lastAnchor = doc -> new Elements(doc.select("a").last());
        SelectorChain chain = new SelectorChain(java.util.List.of(lastAnchor));

        assertThat(chain.union(document).eachAttr("href")).containsExactly("/c");
    }

    @Test
    void invalidCssIsRejectedWhenCompiled() {
        assertThatThrownBy(() -> new CssLinkSelector("a:bogus-pseudo"))
            .isInstanceOf(Selector.SelectorParseException.class);
        assertThatThrownBy(() -> new CssLinkSelector(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
