package com.bidradar.crawl.source;

import com.bidradar.crawl.model.SourceConfig;
import com.bidradar.crawl.model.SourceFailure;
import com.bidradar.crawl.select.SelectorChain;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the sources document (YAML or JSON) and normalizes every entry into a {@link SourceConfig}.
 *
 * <p>Two layouts are accepted per entry. The nested layout keeps selectors under {@code crawl} and
 * buyer metadata under {@code normalize}; the older flat layout puts everything at the top level and
 * allows single-string selectors. Values in the nested blocks win when both are present.
 */
@Component
public class SourcesConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SourcesConfigLoader.class);

    static final String SUPPORTED_TYPE = "html_index";
    static final List<String> DEFAULT_LISTING_SELECTORS = List.of("a");
    static final List<String> DEFAULT_PDF_SELECTORS = List.of("a[href$='.pdf']");
    static final int DEFAULT_MAX_LISTINGS = 10;
    static final String DEFAULT_BUYER_ORG = "Unknown";
    static final String DEFAULT_BUYER_TYPE = "unknown";
    static final String DEFAULT_REGION = "unknown";

    private final ObjectMapper yamlMapper;

    public SourcesConfigLoader(@Qualifier("yamlMapper") ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    public SourceCatalog load(Path path) {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read sources file " + path.toAbsolutePath(), e);
        }
        SourceCatalog catalog = parse(content);
        log.info(
            "Loaded {} source(s) from {} ({} rejected)",
            catalog.sources().size(),
            path,
            catalog.rejected().size()
        );
        return catalog;
    }

    public SourceCatalog parse(String content) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(content == null ? "" : content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Sources file is not valid YAML/JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new SourceCatalog(List.of(), List.of());
        }
        if (!root.isObject()) {
            throw new IllegalStateException("Sources file must be a mapping with a 'sources' list");
        }
        JsonNode sourcesNode = root.path("sources");
        if (sourcesNode.isMissingNode() || sourcesNode.isNull()) {
            return new SourceCatalog(List.of(), List.of());
        }
        if (!sourcesNode.isArray()) {
            throw new IllegalStateException("'sources' must be a list");
        }

        List<SourceConfig> sources = new ArrayList<>();
        List<SourceFailure> rejected = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int index = 0;
        for (JsonNode node : sourcesNode) {
            String label = "sources[" + index + "]";
            index++;
            try {
                SourceConfig source = normalize(node, label);
                if (!seenIds.add(source.id())) {
                    throw new SourceConfigException(source.id(), "duplicate source id '" + source.id() + "'");
                }
                sources.add(source);
            } catch (SourceConfigException e) {
                log.warn("Rejected source {}: {}", e.getSourceId(), e.getMessage());
                rejected.add(new SourceFailure(e.getSourceId(), e.getMessage()));
            }
        }
        return new SourceCatalog(sources, rejected);
    }

    SourceConfig normalize(JsonNode node, String label) {
        if (node == null || !node.isObject()) {
            throw new SourceConfigException(label, "source entry must be a mapping");
        }
        String id = text(node, "id");
        if (id == null) {
            throw new SourceConfigException(label, "source entry is missing 'id'");
        }

        String type = text(node, "type");
        if (type != null && !SUPPORTED_TYPE.equals(type.toLowerCase(Locale.ROOT))) {
            throw new SourceConfigException(id, "unsupported source type: " + type);
        }

        String indexUrl = firstNonBlank(text(node, "base_url"), text(node, "url"));
        if (indexUrl == null) {
            throw new SourceConfigException(id, "source is missing 'base_url'/'url'");
        }
        String lowerUrl = indexUrl.toLowerCase(Locale.ROOT);
        if (!lowerUrl.startsWith("http://") && !lowerUrl.startsWith("https://")) {
            throw new SourceConfigException(id, "index url must be absolute http(s): " + indexUrl);
        }

        JsonNode crawl = block(node, "crawl", id);
        JsonNode normalize = block(node, "normalize", id);

        List<String> listingQueries = selectorList(crawl, node, "listing_link_selectors", DEFAULT_LISTING_SELECTORS, id);
        List<String> pdfQueries = selectorList(crawl, node, "pdf_link_selectors", DEFAULT_PDF_SELECTORS, id);
        int maxListings = maxListings(crawl, node, id);
        boolean directDocumentLinks = booleanValue(crawl, node, "direct_document_links", id);

        String buyerOrg = firstNonBlank(text(normalize, "buyer_org"), text(node, "buyer_org"), DEFAULT_BUYER_ORG);
        String buyerType = firstNonBlank(text(normalize, "buyer_type"), text(node, "buyer_type"), DEFAULT_BUYER_TYPE);
        String region = firstNonBlank(text(normalize, "region"), text(node, "region"), DEFAULT_REGION);

        return new SourceConfig(
            id,
            indexUrl,
            compile(listingQueries, "listing_link_selectors", id),
            compile(pdfQueries, "pdf_link_selectors", id),
            maxListings,
            buyerOrg,
            buyerType,
            region,
            directDocumentLinks
        );
    }

    private SelectorChain compile(List<String> queries, String field, String sourceId) {
        try {
            return SelectorChain.css(queries);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            throw new SourceConfigException(sourceId, "invalid " + field + ": " + e.getMessage(), e);
        }
    }

    private JsonNode block(JsonNode node, String field, String sourceId) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw new SourceConfigException(sourceId, "'" + field + "' must be a mapping");
        }
        return value;
    }

    private List<String> selectorList(
        JsonNode crawl,
        JsonNode flat,
        String field,
        List<String> defaults,
        String sourceId
    ) {
        JsonNode value = crawl != null && crawl.hasNonNull(field) ? crawl.get(field) : flat.get(field);
        if (value == null || value.isNull()) {
            return defaults;
        }
        List<String> out = new ArrayList<>();
        if (value.isTextual()) {
            addIfPresent(out, value.asText());
        } else if (value.isArray()) {
            for (JsonNode item : value) {
                if (!item.isTextual()) {
                    throw new SourceConfigException(sourceId, "'" + field + "' entries must be strings");
                }
                addIfPresent(out, item.asText());
            }
        } else {
            throw new SourceConfigException(sourceId, "'" + field + "' must be a string or a list of strings");
        }
        if (out.isEmpty()) {
            throw new SourceConfigException(sourceId, "'" + field + "' must not be empty");
        }
        return out;
    }

    private int maxListings(JsonNode crawl, JsonNode flat, String sourceId) {
        JsonNode value = crawl != null && crawl.hasNonNull("max_listings") ? crawl.get("max_listings") : flat.get("max_listings");
        if (value == null || value.isNull()) {
            return DEFAULT_MAX_LISTINGS;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new SourceConfigException(sourceId, "'max_listings' must be an integer");
        }
        int parsed = value.asInt();
        if (parsed < 1) {
            throw new SourceConfigException(sourceId, "'max_listings' must be >= 1, got " + parsed);
        }
        return parsed;
    }

    private boolean booleanValue(JsonNode crawl, JsonNode flat, String field, String sourceId) {
        JsonNode value = crawl != null && crawl.hasNonNull(field) ? crawl.get(field) : flat.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        if (!value.isBoolean()) {
            throw new SourceConfigException(sourceId, "'" + field + "' must be true or false");
        }
        return value.asBoolean();
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private void addIfPresent(List<String> list, String value) {
        if (value != null && !value.isBlank()) {
            list.add(value.trim());
        }
    }
}
