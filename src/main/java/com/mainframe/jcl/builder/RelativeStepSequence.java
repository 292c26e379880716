package com.mainframe.jcl.builder;

import java.util.Locale;

/**
 * Generates relative step identifiers: a tier letter followed by a 7-digit counter,
 * e.g. {@code X0000001}. Strictly increasing within one sequence.
 */
public class RelativeStepSequence {

    public static final char DEFAULT_TIER = 'X';
    static final int MAX_COUNTER = 9_999_999;

    private final char tier;
    private int counter;

    public RelativeStepSequence() {
        this(DEFAULT_TIER);
    }

    public RelativeStepSequence(char tier) {
        char upper = Character.toUpperCase(tier);
        if (upper < 'A' || upper > 'Z') {
            throw new IllegalArgumentException("Tier must be a letter A-Z, got '" + tier + "'");
        }
        this.tier = upper;
    }

    public String next() {
        if (counter >= MAX_COUNTER) {
            throw new IllegalStateException("Relative step counter exhausted for tier " + tier);
        }
        counter++;
        return String.format(Locale.ROOT, "%c%07d", tier, counter);
    }

    public char getTier() {
        return tier;
    }

    public int getCounter() {
        return counter;
    }
}
