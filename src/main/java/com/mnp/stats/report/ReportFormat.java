package com.mnp.stats.report;

import java.util.Locale;

import lombok.experimental.UtilityClass;

/**
 * Number formatting shared by the report templates.
 */
@UtilityClass
public class ReportFormat {

    public static final String INFINITE_RATIO = "∞ (all home)";

    /** {@code 1234567} as {@code 1,234,567}. */
    public static String score(long score) {
        return String.format(Locale.US, "%,d", score);
    }

    /** Rounded to a whole number with grouping. */
    public static String score(double value) {
        return String.format(Locale.US, "%,.0f", value);
    }

    public static String points(double points) {
        return String.format(Locale.US, "%.1f", points);
    }

    public static String percent(double percent) {
        return String.format(Locale.US, "%.1f%%", percent);
    }

    public static String ratio(double ratio) {
        if (Double.isInfinite(ratio)) {
            return INFINITE_RATIO;
        }
        return String.format(Locale.US, "%.2f", ratio);
    }
}
