package com.landdev.cashflow.domain.enums;

/**
 * Loan structure
 */
public enum StructureType {
    TERM,     // Funded once, interest-only then amortizing
    REVOLVER  // Draw-as-needed construction line repaid from lot releases
}
