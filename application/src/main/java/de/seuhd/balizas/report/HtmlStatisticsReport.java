package de.seuhd.balizas.report;

import de.seuhd.balizas.domain.model.Situation;
import de.seuhd.balizas.domain.ports.StatisticsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Renders situation statistics as a standalone HTML page: summary, provinces, severities and autonomous
 * communities.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HtmlStatisticsReport {
    static final String TEMPLATE = "statistics";
    static final int TOP_PROVINCES = 15;

    private final StatisticsService statisticsService;
    private final TemplateEngine reportTemplateEngine;

    public @NonNull String render(@NonNull List<Situation> situations) {
        Context context = new Context(Locale.ROOT);
        context.setVariable("summary", statisticsService.summary(situations));
        context.setVariable("provinces", statisticsService.byProvince(situations).stream()
                .limit(TOP_PROVINCES)
                .map(count -> ReportRow.of(count, SituationLabels::place))
                .toList());
        context.setVariable("severities", statisticsService.bySeverity(situations).stream()
                .map(count -> ReportRow.of(count, SituationLabels::severity))
                .toList());
        context.setVariable("communities", statisticsService.byAutonomousCommunity(situations).stream()
                .map(count -> ReportRow.of(count, SituationLabels::place))
                .toList());
        return reportTemplateEngine.process(TEMPLATE, context);
    }

    public void write(@NonNull List<Situation> situations, @NonNull Path file) throws IOException {
        log.debug("Writing HTML statistics for {} situations to {}", situations.size(), file);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, render(situations), StandardCharsets.UTF_8);
    }
}
