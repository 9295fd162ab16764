package com.claimrules.domain.extraction.model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One legal claim with the structural features derived from its text.
 *
 * @param claimNumber        claim number, unique within a document
 * @param rawText            claim body without the leading number
 * @param claimKind          independent or dependent
 * @param dependencyRefs     claim numbers this claim refers to (sorted)
 * @param sequenceReferences sequence listing references in order of first appearance
 * @param mutationTokens     standardized mutation codes (sorted)
 * @param complexityScore    analysis complexity in [1.0, 10.0]
 */
public record ClaimSegment(
        int claimNumber,
        String rawText,
        ClaimKind claimKind,
        Set<Integer> dependencyRefs,
        List<SequenceReference> sequenceReferences,
        Set<String> mutationTokens,
        double complexityScore
) {

    public ClaimSegment {
        if (claimNumber <= 0) {
            throw new IllegalArgumentException("Claim number must be positive: " + claimNumber);
        }
        if (Double.isNaN(complexityScore)) {
            throw new IllegalArgumentException("Complexity score is NaN for claim " + claimNumber);
        }
        rawText = rawText == null ? "" : rawText;
        claimKind = claimKind == null ? ClaimKind.INDEPENDENT : claimKind;
        dependencyRefs = sortedCopy(dependencyRefs);
        sequenceReferences = sequenceReferences == null ? List.of() : List.copyOf(sequenceReferences);
        mutationTokens = sortedCopy(mutationTokens);
    }

    public boolean isDependent() {
        return claimKind == ClaimKind.DEPENDENT;
    }

    public int length() {
        return rawText.length();
    }

    public List<String> sequenceIdentifiers() {
        return sequenceReferences.stream()
                .map(SequenceReference::identifier)
                .distinct()
                .toList();
    }

    private static <T extends Comparable<T>> SortedSet<T> sortedCopy(Collection<T> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }
}
