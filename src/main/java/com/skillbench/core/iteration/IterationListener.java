package com.skillbench.core.iteration;

import com.skillbench.core.model.IterationReport;
import com.skillbench.core.model.Round;

/**
 * Callbacks for a running iteration. Both run on the iteration thread.
 */
public interface IterationListener {

    IterationListener NONE = new IterationListener() {
    };

    default void onRoundCompleted(Round round) {
    }

    default void onCompleted(IterationReport report) {
    }
}
