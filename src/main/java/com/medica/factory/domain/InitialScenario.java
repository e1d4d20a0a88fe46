package com.medica.factory.domain;

public enum InitialScenario {
    /** Plant as observed on the first simulated day. */
    HISTORICAL,
    /** Leaner plant with outstanding debt, used in the business case. */
    BUSINESS_CASE
}
