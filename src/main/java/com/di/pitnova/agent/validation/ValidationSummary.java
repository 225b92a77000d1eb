package com.di.pitnova.agent.validation;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate alignment metrics for a validation run. Percent and mean are rounded to two decimals;
 * {@code meanAbsLapDelta} is null when no decision produced a numeric delta.
 */
@Value
@Builder
@Jacksonized
public class ValidationSummary {

    public static final String TOTAL_DECISIONS = "total_decisions";
    public static final String COUNT_WITHIN_3 = "count_within_3";
    public static final String PCT_WITHIN_3 = "pct_within_3";
    public static final String MEAN_ABS_LAP_DELTA = "mean_abs_lap_delta";
    public static final String COUNT_ERRORS = "count_errors";

    int totalDecisions;
    int countWithin3;
    double pctWithin3;
    Double meanAbsLapDelta;
    int countErrors;

    public static ValidationSummary of(List<ValidationDecision> decisions) {
        int within = 0;
        int withAlignment = 0;
        int errors = 0;
        int deltas = 0;
        long absDeltaSum = 0;
        for (ValidationDecision d : decisions) {
            if (d.isError()) errors++;
            if (d.getAlignmentWithin3() != null) {
                withAlignment++;
                if (d.getAlignmentWithin3()) within++;
            }
            if (d.getLapDelta() != null) {
                deltas++;
                absDeltaSum += Math.abs(d.getLapDelta());
            }
        }
        return ValidationSummary.builder()
                .totalDecisions(decisions.size())
                .countWithin3(within)
                .pctWithin3(withAlignment == 0 ? 0.0 : round2(100.0 * within / withAlignment))
                .meanAbsLapDelta(deltas == 0 ? null : round2((double) absDeltaSum / deltas))
                .countErrors(errors)
                .build();
    }

    /** Ordered key/value view, as written to the summary file. */
    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(TOTAL_DECISIONS, totalDecisions);
        m.put(COUNT_WITHIN_3, countWithin3);
        m.put(PCT_WITHIN_3, pctWithin3);
        m.put(MEAN_ABS_LAP_DELTA, meanAbsLapDelta);
        m.put(COUNT_ERRORS, countErrors);
        return m;
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
