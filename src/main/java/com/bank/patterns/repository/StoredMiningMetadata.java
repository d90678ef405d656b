package com.bank.patterns.repository;

import com.bank.patterns.model.MiningMetadata;
import com.bank.patterns.model.PatternFamily;

import java.util.List;
import java.util.Map;

/**
 * Mining metadata as stored in the durable tier, with the pattern keys it was written with.
 */
public record StoredMiningMetadata(MiningMetadata metadata, Map<PatternFamily, List<String>> patternKeys) {

    public List<String> keys(PatternFamily family) {
        List<String> keys = patternKeys.get(family);
        return keys != null ? keys : List.of();
    }
}
