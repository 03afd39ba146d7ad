package com.kpiforecast.ml.anomaly;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Templated business wording for a flagged day, keyed by anomaly type, weekend flag and whether
 * the severity is urgent (high or critical).
 */
public final class AnomalyRules {

    private static final String WEEKEND_SPIKE = "Unusual weekend spike on %s. Possible promotion effect or special event.";
    private static final String WEEKDAY_SPIKE = "Unexpected high %s on %s. Review for campaign impact.";
    private static final String WEEKEND_DROP = "Weekend drop on %s below normal patterns. Check for site issues.";
    private static final String WEEKDAY_DROP = "Weekday underperformance on %s. Investigate operational issues.";

    static final String ACTION_URGENT_DROP = "URGENT: Check website uptime, payment systems, and inventory availability.";
    static final String ACTION_REVIEW_SPIKE = "Review: Identify cause of spike for replication or concern.";
    static final String ACTION_MONITOR = "Monitor: Track if pattern continues over next few days.";

    private AnomalyRules() {
    }

    public static String interpretation(AnomalyType type, boolean weekend, DayOfWeek day, String metric) {
        String dayName = day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
        if (type == AnomalyType.SPIKE) {
            return weekend
                ? String.format(WEEKEND_SPIKE, dayName)
                : String.format(WEEKDAY_SPIKE, metricLabel(metric), dayName);
        }
        return weekend
            ? String.format(WEEKEND_DROP, dayName)
            : String.format(WEEKDAY_DROP, dayName);
    }

    public static String recommendedAction(AnomalyType type, Severity severity) {
        if (!severity.isUrgent()) {
            return ACTION_MONITOR;
        }
        return type == AnomalyType.DROP ? ACTION_URGENT_DROP : ACTION_REVIEW_SPIKE;
    }

    static String metricLabel(String metric) {
        return metric == null ? "value" : metric.replace('_', ' ');
    }
}
