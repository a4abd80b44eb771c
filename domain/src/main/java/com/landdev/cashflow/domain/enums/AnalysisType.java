package com.landdev.cashflow.domain.enums;

/**
 * Deal analysis type of a project
 */
public enum AnalysisType {
    LAND_DEVELOPMENT,
    INCOME_PROPERTY,
    MULTIFAMILY,
    LOTBANK;

    public static final AnalysisType DEFAULT = LAND_DEVELOPMENT;

    public boolean isLotbank() {
        return this == LOTBANK;
    }
}
