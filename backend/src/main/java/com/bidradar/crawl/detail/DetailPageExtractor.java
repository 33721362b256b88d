package com.bidradar.crawl.detail;

import com.bidradar.crawl.model.DetailPageResult;
import com.bidradar.crawl.select.SelectorChain;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the document link, raw deadline text and a short description out of a parsed detail page.
 */
@Component
public class DetailPageExtractor {
    public static final int DESCRIPTION_MAX_CHARS = 500;

    private static final String MONTH_DATE = "[A-Z][a-z]+\\s+\\d{1,2},\\s+\\d{4}";
    private static final String ISO_DATE = "\\d{4}-\\d{2}-\\d{2}";
    private static final String US_DATE = "\\d{1,2}/\\d{1,2}/\\d{4}";

    // Order matters: the first pattern that matches anywhere in the page wins.
    private static final List<Pattern> DEADLINE_PATTERNS = List.of(
        deadlinePattern("deadline[:\\s]+(" + MONTH_DATE + ")"),
        deadlinePattern("due\\s+date[:\\s]+(" + ISO_DATE + ")"),
        deadlinePattern("due[:\\s]+(" + US_DATE + ")"),
        deadlinePattern("closing\\s+date[:\\s]+(" + MONTH_DATE + "|" + ISO_DATE + "|" + US_DATE + ")"),
        deadlinePattern("deadline[:\\s]+(" + ISO_DATE + "|" + US_DATE + ")")
    );

    public DetailPageResult extract(Document document, SelectorChain pdfSelectors) {
        if (document == null) {
            return DetailPageResult.degraded();
        }
        return new DetailPageResult(
            extractPdfUrl(document, pdfSelectors),
            extractDeadlineText(document.text()),
            extractDescription(document)
        );
    }

    /** First element of the first selector with any match; its href resolved against the page. */
    String extractPdfUrl(Document document, SelectorChain pdfSelectors) {
        if (pdfSelectors == null) {
            return null;
        }
        Elements matched = pdfSelectors.firstMatch(document);
        if (matched.isEmpty()) {
            return null;
        }
        Element first = matched.first();
        String href = first.attr("href");
        if (href.isEmpty()) {
            return null;
        }
        String absolute = first.absUrl("href");
        return absolute.isEmpty() ? href.trim() : absolute;
    }

    public String extractDeadlineText(String pageText) {
        if (pageText == null || pageText.isBlank()) {
            return null;
        }
        for (Pattern pattern : DEADLINE_PATTERNS) {
            Matcher matcher = pattern.matcher(pageText);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    String extractDescription(Document document) {
        Element meta = document.selectFirst("meta[name=description]");
        if (meta != null) {
            String content = meta.attr("content").trim();
            if (!content.isEmpty()) {
                return truncate(content);
            }
        }
        Element paragraph = document.selectFirst("p");
        if (paragraph != null) {
            return truncate(paragraph.text().trim());
        }
        return "";
    }

    static String truncate(String value) {
        if (value.length() <= DESCRIPTION_MAX_CHARS) {
            return value;
        }
        return value.substring(0, DESCRIPTION_MAX_CHARS);
    }

    private static Pattern deadlinePattern(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
