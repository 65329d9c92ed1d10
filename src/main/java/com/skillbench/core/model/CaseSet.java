package com.skillbench.core.model;

import java.util.List;

/**
 * Document shape of a baseline's {@code cases.json}.
 */
public record CaseSet(List<TestCase> cases) {

    public CaseSet {
        cases = cases == null ? List.of() : List.copyOf(cases);
    }
}
