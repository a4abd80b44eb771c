package com.landdev.cashflow.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Display category of a cost line, declared in display order
 */
public enum CostCategory {
    LAND_ACQUISITION("Land Acquisition"),
    PLANNING_ENGINEERING("Planning & Engineering"),
    DEVELOPMENT("Development Costs"),
    IMPROVEMENT("Improvement Costs"),
    OPERATING("Operating Costs"),
    FINANCING("Financing Costs"),
    DISPOSITION("Disposition Costs"),
    CONTINGENCY("Contingency"),
    OTHER("Other Costs");

    private final String displayName;

    CostCategory(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static CostCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (CostCategory category : values()) {
            if (category.displayName.equalsIgnoreCase(value.trim()) || category.name().equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown cost category: " + value);
    }

    /**
     * Resolve the display category of a budget item.
     * An explicit category wins, then a "contingency" description, then the activity mapping.
     */
    public static CostCategory resolve(CostCategory explicit, String activity, String description) {
        if (explicit != null) {
            return explicit;
        }
        if (description != null && description.toLowerCase(Locale.ROOT).contains("contingency")) {
            return CONTINGENCY;
        }
        if (activity == null || activity.isBlank()) {
            return OTHER;
        }
        switch (activity.trim().toLowerCase(Locale.ROOT)) {
            case "acquisition":
            case "land acquisition":
                return LAND_ACQUISITION;
            case "planning":
            case "engineering":
            case "planning & engineering":
                return PLANNING_ENGINEERING;
            case "improvement":
            case "improvements":
            case "development":
                return DEVELOPMENT;
            case "operations":
            case "operating":
                return OPERATING;
            case "financing":
            case "finance":
                return FINANCING;
            case "disposition":
            case "sales":
                return DISPOSITION;
            default:
                return DEVELOPMENT;
        }
    }
}
