package com.example.smartbin.ai;

import java.util.List;

public record DelegatedAnalysis(
        List<DelegatedInsight> insights,
        List<DelegatedInsight> anomalies,
        String summary
) {

    public DelegatedAnalysis {
        insights = insights == null ? List.of() : List.copyOf(insights);
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }

    public static DelegatedAnalysis empty() {
        return new DelegatedAnalysis(List.of(), List.of(), null);
    }
}
