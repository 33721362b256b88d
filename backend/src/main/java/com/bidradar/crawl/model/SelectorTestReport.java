package com.bidradar.crawl.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SelectorTestReport(
    String sourceId,
    String baseUrl,
    int count,
    List<Item> items,
    List<ErrorEntry> errors
) {
    public SelectorTestReport {
        items = List.copyOf(items);
        errors = List.copyOf(errors);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record Item(String title, String canonicalUrl, String pdfUrl) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorEntry(String url, String stage, String error) {
        public static ErrorEntry forUrl(String url, String error) {
            return new ErrorEntry(url, null, error);
        }

        public static ErrorEntry forStage(String stage, String error) {
            return new ErrorEntry(null, stage, error);
        }
    }
}
