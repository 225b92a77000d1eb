package com.di.pitnova.agent.validation;

import lombok.Value;

import java.util.List;

/**
 * Decision rows plus their summary.
 */
@Value
public class ValidationReport {
    List<ValidationDecision> decisions;
    ValidationSummary summary;

    public static ValidationReport of(List<ValidationDecision> decisions) {
        return new ValidationReport(List.copyOf(decisions), ValidationSummary.of(decisions));
    }
}
