package de.seuhd.balizas.report;

import org.jspecify.annotations.NonNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Output files of the HTML reports.
 *
 * @param mapFile File the situation map is written to unless {@code --output} is given.
 * @param statisticsFile File the HTML statistics report is written to unless {@code --stats-html=<file>} is given.
 */
@ConfigurationProperties(prefix = "balizas.report")
public record ReportProperties(
        @DefaultValue("mapa_v16.html") @NonNull String mapFile,
        @DefaultValue("estadisticas_v16.html") @NonNull String statisticsFile
) {
}
