package com.eainde.forecast.synthesis;

import java.util.List;

/**
 * Outcome of validating an assembled forecast.
 *
 * @param issues    blocking problems; empty means the forecast may be returned
 * @param anomalies metric values flagged as out of bounds (not blocking)
 */
public record ValidationReport(List<String> issues, List<String> anomalies) {

    public ValidationReport {
        issues = List.copyOf(issues);
        anomalies = List.copyOf(anomalies);
    }

    public boolean isValid() {
        return issues.isEmpty();
    }
}
