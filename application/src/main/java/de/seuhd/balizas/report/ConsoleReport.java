package de.seuhd.balizas.report;

import de.seuhd.balizas.domain.model.CategoryCount;
import de.seuhd.balizas.domain.model.Situation;
import de.seuhd.balizas.domain.model.SituationSummary;
import de.seuhd.balizas.domain.ports.StatisticsService;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Renders situation statistics as a plain text report.
 */
@Slf4j
@Component
public class ConsoleReport {
    static final int TOP_PROVINCES = 10;

    private static final String RULE = "=".repeat(60);

    private final StatisticsService statisticsService;
    private final PrintStream out;

    @Autowired
    public ConsoleReport(StatisticsService statisticsService) {
        this(statisticsService, System.out);
    }

    ConsoleReport(StatisticsService statisticsService, PrintStream out) {
        this.statisticsService = statisticsService;
        this.out = out;
    }

    public void print(@NonNull List<Situation> situations) {
        log.debug("Rendering report for {} situations", situations.size());

        out.println();
        out.println(RULE);
        out.println("TRAFFIC INCIDENT REPORT - V16 BEACONS");
        out.println(RULE);

        SituationSummary summary = statisticsService.summary(situations);
        out.println();
        out.println("SUMMARY");
        out.println("   - Total incidents: " + summary.total());
        out.println("   - Provinces affected: " + summary.provincesAffected());
        out.println("   - Autonomous communities affected: " + summary.communitiesAffected());
        out.println("   - Municipalities affected: " + summary.municipalitiesAffected());

        out.println();
        out.println("SEVERITY DISTRIBUTION");
        for (CategoryCount row : statisticsService.bySeverity(situations)) {
            out.println("   - " + SituationLabels.severity(row.category()) + ": " + row.total()
                    + " (" + formatPercentage(row.percentage()) + ")");
        }

        out.println();
        out.println("TOP " + TOP_PROVINCES + " PROVINCES");
        List<CategoryCount> provinces = statisticsService.byProvince(situations);
        for (int i = 0; i < Math.min(TOP_PROVINCES, provinces.size()); i++) {
            CategoryCount row = provinces.get(i);
            out.println(String.format(Locale.ROOT, "   %2d. %s: %d incidents (%d municipalities)",
                    i + 1, row.category(), row.total(), row.distinct()));
        }

        out.println();
        out.println("INCIDENT TYPES");
        for (CategoryCount row : statisticsService.byManagementType(situations)) {
            out.println("   - " + SituationLabels.managementType(row.category()) + ": " + row.total()
                    + " (" + formatPercentage(row.percentage()) + ")");
        }

        out.println();
        out.println(RULE);
        out.flush();
    }

    private static @NonNull String formatPercentage(double percentage) {
        return String.format(Locale.ROOT, "%.1f%%", percentage);
    }
}
