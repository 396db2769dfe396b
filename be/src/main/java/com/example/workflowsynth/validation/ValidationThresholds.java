package com.example.workflowsynth.validation;

/**
 * Limits for the anti-pattern and credential checks. A check fires when a count is strictly greater.
 */
public record ValidationThresholds(int highCostNodes, int credentialReuse, int largeGraphNodes, int decisionNodes) {

    public static final ValidationThresholds DEFAULTS = new ValidationThresholds(5, 3, 20, 3);

    public ValidationThresholds {
        if (highCostNodes < 0 || credentialReuse < 0 || largeGraphNodes < 0 || decisionNodes < 0) {
            throw new IllegalArgumentException("validation thresholds must be >= 0");
        }
    }
}
