package de.seuhd.balizas.report;

import de.seuhd.balizas.domain.model.CategoryCount;
import org.jspecify.annotations.NonNull;

import java.util.Locale;
import java.util.function.Function;

/**
 * A {@link CategoryCount} prepared for display.
 *
 * @param category The raw category value.
 * @param label The display label of the category.
 * @param total Number of situations.
 * @param percentage Share of all situations, formatted with one decimal.
 * @param distinct Number of distinct values of the secondary attribute.
 */
public record ReportRow(
        @NonNull String category,
        @NonNull String label,
        int total,
        @NonNull String percentage,
        int distinct
) {
    static @NonNull ReportRow of(@NonNull CategoryCount count, @NonNull Function<String, String> labels) {
        return new ReportRow(
                count.category(),
                labels.apply(count.category()),
                count.total(),
                String.format(Locale.ROOT, "%.1f", count.percentage()),
                count.distinct());
    }
}
