package com.di.adbatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The ads uploaded into each variant of a campaign set.
 *
 * <p>Instances handed to the orchestrator are never modified; the validation retry
 * loop derives filtered copies through {@link #without(Collection)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreativeSource {

    /** Name of the source the rows came from (e.g. the ad CSV file), for reports. */
    private String         reference;

    @Builder.Default
    private List<Creative> creatives = new ArrayList<>();

    /** Creative ids in row order, duplicates collapsed. */
    public Set<String> creativeIds() {
        return creatives.stream()
                .map(Creative::getCreativeId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int size() {
        return creatives.size();
    }

    public boolean hasCreatives() {
        return !creatives.isEmpty();
    }

    /**
     * Returns a copy with every row whose creative id is in {@code creativeIds} removed.
     */
    public CreativeSource without(Collection<String> creativeIds) {
        Set<String> drop = new LinkedHashSet<>(creativeIds);
        List<Creative> kept = creatives.stream()
                .filter(c -> !drop.contains(c.getCreativeId()))
                .collect(Collectors.toList());
        return new CreativeSource(reference, kept);
    }

    /** Deep-enough copy for per-task use: the row list is new, rows are shared. */
    public CreativeSource copy() {
        return new CreativeSource(reference, new ArrayList<>(creatives));
    }
}
