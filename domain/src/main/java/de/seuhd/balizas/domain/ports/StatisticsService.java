package de.seuhd.balizas.domain.ports;

import de.seuhd.balizas.domain.model.CategoryCount;
import de.seuhd.balizas.domain.model.Situation;
import de.seuhd.balizas.domain.model.SituationSummary;
import org.jspecify.annotations.NonNull;

import java.util.List;

/**
 * Service interface for aggregating situations.
 * All groupings are sorted by total (descending), ties by category.
 */
public interface StatisticsService {
    @NonNull SituationSummary summary(@NonNull List<Situation> situations);

    /**
     * Counts situations per province; {@link CategoryCount#distinct()} is the number of municipalities.
     */
    @NonNull List<CategoryCount> byProvince(@NonNull List<Situation> situations);

    /**
     * Counts situations per autonomous community; {@link CategoryCount#distinct()} is the number of provinces.
     */
    @NonNull List<CategoryCount> byAutonomousCommunity(@NonNull List<Situation> situations);

    @NonNull List<CategoryCount> bySeverity(@NonNull List<Situation> situations);

    @NonNull List<CategoryCount> byManagementType(@NonNull List<Situation> situations);
}
