package com.skillbench.core.model;

/**
 * Recompose strategies tried during beam exploration.
 */
public enum Strategy {
    /** Fold in the strongest segments, staying close to the current skill. */
    GREEDY,
    /** Push the weakest rubric dimension. */
    DIMENSION_FOCUS,
    /** Pull in advantage segments not used so far. */
    SEGMENT_EXPLORE,
    /** Ignore the previous structure and mix the best parts of all sources. */
    CROSS_POLLINATE,
    /** Recompose from a random subset of segments. */
    RANDOM_SUBSET
}
