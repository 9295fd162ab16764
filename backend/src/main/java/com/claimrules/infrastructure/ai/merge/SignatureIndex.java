package com.claimrules.infrastructure.ai.merge;

import com.claimrules.domain.extraction.model.RuleCandidate;
import com.claimrules.domain.extraction.model.RuleSignature;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exact-signature index for one merge run. First occurrence wins; later repeats only
 * contribute their provenance.
 */
final class SignatureIndex {

    private final Map<RuleSignature, RuleCandidate> entries = new LinkedHashMap<>();
    private int duplicatesRemoved;

    /**
     * @return true if the candidate was new, false if it folded into an earlier one
     */
    boolean add(RuleCandidate candidate) {
        RuleSignature signature = candidate.signature();
        RuleCandidate existing = entries.get(signature);
        if (existing == null) {
            entries.put(signature, candidate);
            return true;
        }
        entries.put(signature, existing.withProvenance(existing.provenance().merge(candidate.provenance())));
        duplicatesRemoved++;
        return false;
    }

    List<RuleCandidate> values() {
        return List.copyOf(entries.values());
    }

    int duplicatesRemoved() {
        return duplicatesRemoved;
    }

    static SignatureIndex of(List<RuleCandidate> candidates) {
        SignatureIndex index = new SignatureIndex();
        candidates.forEach(index::add);
        return index;
    }
}
