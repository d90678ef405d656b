package com.bank.patterns.engine;

import com.bank.patterns.model.PatternFamily;

import java.util.List;

/**
 * Builds pattern keys of the form {@code family|knownAccount|kw1-kw2-kw3->predicted}.
 * Reference keys omit the account segment. The part before the arrow is the context
 * that confidence is computed over.
 */
public final class PatternKeys {

    public static final String ARROW = "->";

    private PatternKeys() {}

    public static String contextKey(PatternFamily family, String knownAccount, List<String> keywords) {
        String joined = String.join("-", keywords);
        if (family.requiresBankLeg()) {
            return family.getKeyPrefix() + "|" + knownAccount + "|" + joined;
        }
        return family.getKeyPrefix() + "|" + joined;
    }

    public static String patternKey(String contextKey, String predictedValue) {
        return contextKey + ARROW + predictedValue;
    }
}
