package de.seuhd.balizas.domain.impl;

import de.seuhd.balizas.domain.model.CategoryCount;
import de.seuhd.balizas.domain.model.Situation;
import de.seuhd.balizas.domain.model.SituationSummary;
import de.seuhd.balizas.domain.ports.StatisticsService;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Implementation of the statistics service. Missing values are grouped under {@link CategoryCount#UNSPECIFIED}.
 */
@Slf4j
@Service
public class StatisticsServiceImpl implements StatisticsService {
    private static final Comparator<CategoryCount> BY_TOTAL_DESC = Comparator
            .comparingInt(CategoryCount::total).reversed()
            .thenComparing(CategoryCount::category);

    @Override
    public @NonNull SituationSummary summary(@NonNull List<Situation> situations) {
        return new SituationSummary(
                situations.size(),
                countDistinct(situations, Situation::province),
                countDistinct(situations, Situation::autonomousCommunity),
                countDistinct(situations, Situation::municipality)
        );
    }

    @Override
    public @NonNull List<CategoryCount> byProvince(@NonNull List<Situation> situations) {
        return group(situations, Situation::province, Situation::municipality);
    }

    @Override
    public @NonNull List<CategoryCount> byAutonomousCommunity(@NonNull List<Situation> situations) {
        return group(situations, Situation::autonomousCommunity, Situation::province);
    }

    @Override
    public @NonNull List<CategoryCount> bySeverity(@NonNull List<Situation> situations) {
        return group(situations, Situation::severity, null);
    }

    @Override
    public @NonNull List<CategoryCount> byManagementType(@NonNull List<Situation> situations) {
        return group(situations, Situation::managementType, null);
    }

    private @NonNull List<CategoryCount> group(
            @NonNull List<Situation> situations,
            @NonNull Function<Situation, @Nullable String> category,
            @Nullable Function<Situation, @Nullable String> secondary) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        Map<String, Set<String>> secondaryValues = new LinkedHashMap<>();
        for (Situation situation : situations) {
            String key = orUnspecified(category.apply(situation));
            totals.merge(key, 1, Integer::sum);
            if (secondary != null) {
                secondaryValues.computeIfAbsent(key, k -> new HashSet<>())
                        .add(orUnspecified(secondary.apply(situation)));
            }
        }
        log.debug("Grouped {} situations into {} categories", situations.size(), totals.size());

        return totals.entrySet().stream()
                .map(entry -> new CategoryCount(
                        entry.getKey(),
                        entry.getValue(),
                        percentage(entry.getValue(), situations.size()),
                        secondaryValues.getOrDefault(entry.getKey(), Set.of()).size()))
                .sorted(BY_TOTAL_DESC)
                .toList();
    }

    private int countDistinct(@NonNull List<Situation> situations, @NonNull Function<Situation, @Nullable String> attribute) {
        Set<String> values = new HashSet<>();
        for (Situation situation : situations) {
            values.add(orUnspecified(attribute.apply(situation)));
        }
        return values.size();
    }

    private static double percentage(int part, int total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(part * 100.0 / total)
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private static @NonNull String orUnspecified(@Nullable String value) {
        return value != null ? value : CategoryCount.UNSPECIFIED;
    }
}
