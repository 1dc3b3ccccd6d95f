package net.seanstash.domain.ai;

import java.util.List;

/**
 * Usage totals for an owner plus the most recent analyses in the same window.
 */
public record UsageReport(UsagePeriod period, UsageSummary summary, List<AnalysisRecord> recentAnalyses) {

    public UsageReport {
        recentAnalyses = recentAnalyses == null ? List.of() : List.copyOf(recentAnalyses);
    }
}
