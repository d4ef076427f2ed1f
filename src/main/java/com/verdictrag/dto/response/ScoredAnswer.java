package com.verdictrag.dto.response;

import lombok.Builder;
import lombok.Value;

/**
 * Query outcome together with its quality report; the report is null when the query failed.
 */
@Value
@Builder
public class ScoredAnswer {

    QueryOutcome outcome;

    QualityReport report;

    public boolean isScored() {
        return report != null;
    }
}
