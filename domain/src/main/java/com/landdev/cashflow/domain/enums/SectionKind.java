package com.landdev.cashflow.domain.enums;

/**
 * Kind of a projection section, declared in display order.
 * Gross revenue and its deductions are informational only: the net revenue section already carries them.
 */
public enum SectionKind {
    COST(true),
    REVENUE_GROSS(false),
    REVENUE_DEDUCTION(false),
    REVENUE_NET(true),
    FINANCING(true),
    LOTBANK_OPTION_DEPOSIT(true),
    LOTBANK_DEPOSIT_CREDIT(true),
    LOTBANK_UNDERWRITING_FEE(true),
    LOTBANK_MANAGEMENT_FEE(true),
    LOTBANK_DEFAULT_PROVISION(true);

    private final boolean includedInNetCashFlow;

    SectionKind(boolean includedInNetCashFlow) {
        this.includedInNetCashFlow = includedInNetCashFlow;
    }

    public boolean isIncludedInNetCashFlow() {
        return includedInNetCashFlow;
    }

    public boolean isLotbank() {
        return name().startsWith("LOTBANK_");
    }
}
