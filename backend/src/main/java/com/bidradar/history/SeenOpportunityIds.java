package com.bidradar.history;

import java.util.Collection;
import java.util.Set;

/**
 * Ids already present in the history log when a run starts. Loaded once and never updated during
 * the run, so two identical candidates found in the same run are both kept.
 */
public final class SeenOpportunityIds {
    private static final SeenOpportunityIds EMPTY = new SeenOpportunityIds(Set.of());

    private final Set<String> ids;

    private SeenOpportunityIds(Set<String> ids) {
        this.ids = ids;
    }

    public static SeenOpportunityIds of(Collection<String> ids) {
        return ids == null || ids.isEmpty() ? EMPTY : new SeenOpportunityIds(Set.copyOf(ids));
    }

    public static SeenOpportunityIds empty() {
        return EMPTY;
    }

    public boolean contains(String id) {
        return id != null && ids.contains(id);
    }

    public int size() {
        return ids.size();
    }
}
