package com.skillbench.core.results;

import com.skillbench.core.model.ResultRecord;
import com.skillbench.core.model.Summary;

import java.util.List;

/**
 * One page of result records plus the current summary (null before the first completed run).
 */
public record ResultPage(
    List<ResultRecord> items,
    int total,
    int page,
    int pageSize,
    Summary summary
) {
}
