package com.bidradar.crawl.source;

import com.bidradar.crawl.model.SourceConfig;
import com.bidradar.crawl.model.SourceFailure;

import java.util.List;
import java.util.Optional;

/**
 * Sources loaded from one configuration file, in file order, plus the entries rejected while loading.
 */
public record SourceCatalog(List<SourceConfig> sources, List<SourceFailure> rejected) {
    public SourceCatalog {
        sources = List.copyOf(sources);
        rejected = List.copyOf(rejected);
    }

    public static SourceCatalog of(List<SourceConfig> sources) {
        return new SourceCatalog(sources, List.of());
    }

    public Optional<SourceConfig> findById(String sourceId) {
        if (sourceId == null) {
            return Optional.empty();
        }
        return sources.stream().filter(source -> source.id().equals(sourceId.trim())).findFirst();
    }
}
