package com.skillbench.core.model;

/**
 * The six weighted rubric dimensions, in declaration order.
 * Declaration order is also the tie-break order when looking for the weakest dimension.
 */
public enum ScoreDimension {

    FUNCTIONAL_CORRECTNESS("functional_correctness", "Functional correctness", 30),
    ROBUSTNESS("robustness", "Robustness", 20),
    READABILITY("readability", "Readability", 15),
    CONCISENESS("conciseness", "Conciseness", 15),
    COMPLEXITY_CONTROL("complexity_control", "Complexity control", 10),
    FORMAT_COMPLIANCE("format_compliance", "Format compliance", 10);

    private final String key;
    private final String label;
    private final int max;

    ScoreDimension(String key, String label, int max) {
        this.key = key;
        this.label = label;
        this.max = max;
    }

    /** Wire name used in result documents and prompts. */
    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public int max() {
        return max;
    }

    public static ScoreDimension fromKey(String key) {
        for (ScoreDimension d : values()) {
            if (d.key.equals(key)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown score dimension: " + key);
    }
}
