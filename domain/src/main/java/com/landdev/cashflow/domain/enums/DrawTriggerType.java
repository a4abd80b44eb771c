package com.landdev.cashflow.domain.enums;

/**
 * What drives revolver draws. Only COST_INCURRED is modelled by the debt engine.
 */
public enum DrawTriggerType {
    COST_INCURRED,
    PERCENT_COMPLETE,
    MILESTONE,
    MANUAL
}
