package com.costsentinel.core.config;

import java.util.List;

/**
 * Parameters of the multi-detector merge.
 *
 * @since 1.0.0
 */
public class ConsolidationSettings {

    /** Confidence added for every additional detector agreeing on a date. */
    private double agreementBoost = 0.05;

    private double maxConfidence = 0.99;

    void validate(List<String> errors) {
        if (agreementBoost < 0) {
            errors.add("consolidation.agreementBoost must be >= 0");
        }
        Validation.requireUnit(errors, "consolidation.maxConfidence", maxConfidence);
    }

    public double getAgreementBoost() {
        return agreementBoost;
    }

    public void setAgreementBoost(double agreementBoost) {
        this.agreementBoost = agreementBoost;
    }

    public double getMaxConfidence() {
        return maxConfidence;
    }

    public void setMaxConfidence(double maxConfidence) {
        this.maxConfidence = maxConfidence;
    }
}
