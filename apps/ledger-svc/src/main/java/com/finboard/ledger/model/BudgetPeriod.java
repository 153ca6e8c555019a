package com.finboard.ledger.model;

import java.util.Locale;

/**
 * Window a budget's spend is measured over. The tag stored on a budget is free text; anything that
 * is not {@code monthly} or {@code yearly} is measured over the trailing 30 days.
 */
public enum BudgetPeriod {
    MONTHLY,
    YEARLY,
    ROLLING_30_DAYS;

    public static final String DEFAULT_TAG = "monthly";

    public static BudgetPeriod fromTag(String tag) {
        if (tag == null) {
            return ROLLING_30_DAYS;
        }
        return switch (tag.trim().toLowerCase(Locale.ROOT)) {
            case "monthly" -> MONTHLY;
            case "yearly" -> YEARLY;
            default -> ROLLING_30_DAYS;
        };
    }
}
