package com.claimrules.domain.extraction.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Which batches and claims a rule came from.
 */
public record RuleProvenance(Set<Integer> batchIds, Set<Integer> claimNumbers) {

    public RuleProvenance {
        batchIds = sortedCopy(batchIds);
        claimNumbers = sortedCopy(claimNumbers);
    }

    public static RuleProvenance empty() {
        return new RuleProvenance(Set.of(), Set.of());
    }

    public static RuleProvenance of(int batchId, Collection<Integer> claimNumbers) {
        return new RuleProvenance(Set.of(batchId), Set.copyOf(claimNumbers));
    }

    public RuleProvenance merge(RuleProvenance other) {
        if (other == null) {
            return this;
        }
        Set<Integer> batches = new TreeSet<>(batchIds);
        batches.addAll(other.batchIds());
        Set<Integer> claims = new TreeSet<>(claimNumbers);
        claims.addAll(other.claimNumbers());
        return new RuleProvenance(batches, claims);
    }

    private static Set<Integer> sortedCopy(Collection<Integer> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }
}
