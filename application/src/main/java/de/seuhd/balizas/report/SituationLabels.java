package de.seuhd.balizas.report;

import de.seuhd.balizas.domain.model.CategoryCount;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Human-readable labels and colours for the raw DATEX2 enumeration values.
 * Values without a label are shown verbatim.
 */
public final class SituationLabels {
    static final String UNSPECIFIED_LABEL = "Unspecified";
    static final String DEFAULT_COLOR = "blue";

    private static final Map<String, String> SEVERITIES = Map.of(
            "low", "Low",
            "medium", "Medium",
            "high", "High",
            "highest", "Highest"
    );

    private static final Map<String, String> SEVERITY_COLORS = Map.of(
            "low", "green",
            "medium", "orange",
            "high", "red",
            "highest", "darkred"
    );

    private static final Map<String, String> MANAGEMENT_TYPES = Map.of(
            "laneClosures", "Lane closure",
            "roadClosed", "Road closed",
            "singleAlternateLineTraffic", "Alternate one-way traffic",
            "other", "Other"
    );

    private static final Map<String, String> CAUSE_TYPES = Map.of(
            "roadMaintenance", "Road maintenance",
            "roadOrCarriagewayOrLaneManagement", "Traffic management"
    );

    private SituationLabels() {
    }

    public static @NonNull String severity(@Nullable String severity) {
        return label(SEVERITIES, severity);
    }

    public static @NonNull String managementType(@Nullable String managementType) {
        return label(MANAGEMENT_TYPES, managementType);
    }

    public static @NonNull String causeType(@Nullable String causeType) {
        return label(CAUSE_TYPES, causeType);
    }

    /**
     * Label of a province, municipality or autonomous community, which are shown verbatim.
     */
    public static @NonNull String place(@Nullable String place) {
        return label(Map.of(), place);
    }

    /**
     * Marker colour of a severity, blue if the severity is missing or unknown.
     */
    public static @NonNull String severityColor(@Nullable String severity) {
        return severity == null ? DEFAULT_COLOR : SEVERITY_COLORS.getOrDefault(severity, DEFAULT_COLOR);
    }

    private static @NonNull String label(@NonNull Map<String, String> labels, @Nullable String value) {
        if (value == null || CategoryCount.UNSPECIFIED.equals(value)) {
            return UNSPECIFIED_LABEL;
        }
        return labels.getOrDefault(value, value);
    }
}
