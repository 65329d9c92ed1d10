package com.skillbench.core.iteration;

import com.skillbench.core.model.Round;

import java.util.List;

/**
 * Maps the trailing run of low-improvement rounds to a plateau level from 0 (none) to 3 (severe).
 */
public final class PlateauDetector {

    private PlateauDetector() {
    }

    /**
     * @param rounds    completed rounds, oldest first
     * @param threshold |delta| below this counts as no improvement
     * @param limit     run length that escalates to level 2 (twice it escalates to 3)
     */
    public static int level(List<Round> rounds, double threshold, int limit) {
        if (rounds.size() < 2) {
            return 0;
        }
        int run = 0;
        for (int i = rounds.size() - 1; i >= 1; i--) {
            Double delta = rounds.get(i).scoreDelta();
            if (delta == null || Math.abs(delta) < threshold) {
                run++;
            } else {
                break;
            }
        }
        if (run == 0) {
            return 0;
        }
        if (run < limit) {
            return 1;
        }
        if (run < limit * 2) {
            return 2;
        }
        return 3;
    }
}
