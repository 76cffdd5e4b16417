package de.seuhd.balizas.domain.impl;

import de.seuhd.balizas.domain.model.CategoryCount;
import de.seuhd.balizas.domain.model.Situation;
import de.seuhd.balizas.domain.model.SituationSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class StatisticsServiceImplTest {
    private final StatisticsServiceImpl statisticsService = new StatisticsServiceImpl();

    private static Situation situation(String severity, String community, String province, String municipality,
                                       String managementType) {
        return Situation.builder()
                .id("S")
                .severity(severity)
                .latitude(40.0)
                .longitude(-3.5)
                .autonomousCommunity(community)
                .province(province)
                .municipality(municipality)
                .managementType(managementType)
                .build();
    }

    private final List<Situation> situations = List.of(
            situation("high", "Comunidad de Madrid", "Madrid", "Madrid", "laneClosures"),
            situation("high", "Comunidad de Madrid", "Madrid", "Getafe", "laneClosures"),
            situation("low", "Comunidad de Madrid", "Madrid", "Madrid", "roadClosed"),
            situation("medium", "Cataluña", "Barcelona", "Barcelona", "laneClosures"),
            situation(null, "Cataluña", "Girona", null, null),
            situation("high", null, null, null, "other")
    );

    @Test
    void summaryCountsDistinctValuesIncludingUnspecified() {
        SituationSummary summary = statisticsService.summary(situations);

        assertThat(summary).isEqualTo(new SituationSummary(6, 4, 3, 4));
    }

    @Test
    void summaryOfNoSituationsIsZero() {
        assertThat(statisticsService.summary(List.of())).isEqualTo(new SituationSummary(0, 0, 0, 0));
    }

    @Test
    void byProvinceCountsMunicipalities() {
        assertThat(statisticsService.byProvince(situations)).containsExactly(
                new CategoryCount("Madrid", 3, 50.0, 2),
                new CategoryCount("Barcelona", 1, 16.7, 1),
                new CategoryCount("Girona", 1, 16.7, 1),
                new CategoryCount(CategoryCount.UNSPECIFIED, 1, 16.7, 1));
    }

    @Test
    void byAutonomousCommunityCountsProvinces() {
        assertThat(statisticsService.byAutonomousCommunity(situations)).containsExactly(
                new CategoryCount("Comunidad de Madrid", 3, 50.0, 1),
                new CategoryCount("Cataluña", 2, 33.3, 2),
                new CategoryCount(CategoryCount.UNSPECIFIED, 1, 16.7, 1));
    }

    @Test
    void bySeveritySortsByTotalThenCategory() {
        assertThat(statisticsService.bySeverity(situations)).containsExactly(
                new CategoryCount("high", 3, 50.0, 0),
                new CategoryCount("low", 1, 16.7, 0),
                new CategoryCount("medium", 1, 16.7, 0),
                new CategoryCount(CategoryCount.UNSPECIFIED, 1, 16.7, 0));
    }

    @Test
    void byManagementTypeComputesPercentages() {
        assertThat(statisticsService.byManagementType(situations))
                .extracting(CategoryCount::category, CategoryCount::percentage)
                .containsExactly(
                        tuple("laneClosures", 50.0),
                        tuple("other", 16.7),
                        tuple("roadClosed", 16.7),
                        tuple(CategoryCount.UNSPECIFIED, 16.7));
    }

    @Test
    void groupingsOfNoSituationsAreEmpty() {
        assertThat(statisticsService.byProvince(List.of())).isEmpty();
        assertThat(statisticsService.bySeverity(List.of())).isEmpty();
    }
}
