package de.seuhd.balizas.domain.model;

import org.jspecify.annotations.NonNull;

/**
 * One row of a grouping over situations.
 *
 * @param category The grouped value, or {@link #UNSPECIFIED} for situations without one.
 * @param total Number of situations in this category.
 * @param percentage Share of all situations in percent, rounded to one decimal.
 * @param distinct Number of distinct values of the secondary attribute (0 if the grouping has none).
 */
public record CategoryCount(
        @NonNull String category,
        int total,
        double percentage,
        int distinct
) {
    public static final String UNSPECIFIED = "unspecified";
}
