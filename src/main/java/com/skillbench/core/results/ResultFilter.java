package com.skillbench.core.results;

import com.skillbench.core.model.ResultRecord;
import com.skillbench.core.model.ResultStatus;

/**
 * Optional filters for result queries; null fields match everything.
 */
public record ResultFilter(String skillId, String caseId, ResultStatus status) {

    public static final ResultFilter ALL = new ResultFilter(null, null, null);

    public boolean matches(ResultRecord record) {
        return (skillId == null || skillId.equals(record.skillId()))
                && (caseId == null || caseId.equals(record.caseId()))
                && (status == null || status == record.status());
    }
}
