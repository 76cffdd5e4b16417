package de.seuhd.balizas.report;

import de.seuhd.balizas.domain.model.Situation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
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
 * Renders situations as an interactive Leaflet map: one clustered marker per situation, coloured by severity,
 * with a popup listing the record's fields.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SituationMap {
    static final String TEMPLATE = "map";
    static final String NOT_AVAILABLE = "N/A";

    private final TemplateEngine reportTemplateEngine;

    /**
     * One map marker.
     *
     * @param latitude Latitude of the situation.
     * @param longitude Longitude of the situation.
     * @param color Marker colour derived from the severity.
     * @param tooltip Road and severity shown on hover.
     * @param roadName Road name, or a placeholder if it is missing.
     * @param location Municipality and province.
     * @param community Autonomous community.
     * @param severity Severity label.
     * @param managementType Management type label.
     * @param causeType Cause label.
     * @param kmPoint Kilometer marker.
     * @param id Situation identifier.
     */
    public record Marker(
            double latitude,
            double longitude,
            @NonNull String color,
            @NonNull String tooltip,
            @NonNull String roadName,
            @NonNull String location,
            @NonNull String community,
            @NonNull String severity,
            @NonNull String managementType,
            @NonNull String causeType,
            @NonNull String kmPoint,
            @NonNull String id
    ) {
        static @NonNull Marker of(@NonNull Situation situation) {
            String roadName = situation.roadName() != null ? situation.roadName() : "Unnamed road";
            return new Marker(
                    situation.latitude(),
                    situation.longitude(),
                    SituationLabels.severityColor(situation.severity()),
                    roadName + " - " + SituationLabels.severity(situation.severity()),
                    roadName,
                    orNotAvailable(situation.municipality()) + ", " + orNotAvailable(situation.province()),
                    orNotAvailable(situation.autonomousCommunity()),
                    SituationLabels.severity(situation.severity()),
                    situation.managementType() != null ? SituationLabels.managementType(situation.managementType()) : NOT_AVAILABLE,
                    situation.causeType() != null ? SituationLabels.causeType(situation.causeType()) : NOT_AVAILABLE,
                    situation.kmPoint() != null ? String.format(Locale.ROOT, "%.1f", situation.kmPoint()) : NOT_AVAILABLE,
                    situation.id());
        }

        private static @NonNull String orNotAvailable(@Nullable String value) {
            return value != null ? value : NOT_AVAILABLE;
        }
    }

    public @NonNull String render(@NonNull List<Situation> situations) {
        Context context = new Context(Locale.ROOT);
        context.setVariable("markers", situations.stream().map(Marker::of).toList());
        return reportTemplateEngine.process(TEMPLATE, context);
    }

    public void write(@NonNull List<Situation> situations, @NonNull Path file) throws IOException {
        log.debug("Writing map with {} situations to {}", situations.size(), file);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, render(situations), StandardCharsets.UTF_8);
    }
}
