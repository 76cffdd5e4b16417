package de.seuhd.balizas;

import de.seuhd.balizas.data.config.Datex2Properties;
import de.seuhd.balizas.domain.model.Situation;
import de.seuhd.balizas.domain.ports.SituationService;
import de.seuhd.balizas.report.ConsoleReport;
import de.seuhd.balizas.report.HtmlStatisticsReport;
import de.seuhd.balizas.report.ReportProperties;
import de.seuhd.balizas.report.SituationMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point.
 * <ul>
 *     <li>{@code --local} reads the configured local file, {@code --local=<file>} reads the given file,
 *     otherwise the publication is downloaded</li>
 *     <li>{@code --no-stats} skips the console report and the HTML statistics</li>
 *     <li>{@code --stats-html} or {@code --stats-html=<file>} also writes the statistics as an HTML page</li>
 *     <li>{@code --output=<file>} sets the file of the situation map</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class V16Runner implements ApplicationRunner {
    static final String LOCAL_OPTION = "local";
    static final String NO_STATS_OPTION = "no-stats";
    static final String STATS_HTML_OPTION = "stats-html";
    static final String OUTPUT_OPTION = "output";

    private final SituationService situationService;
    private final ConsoleReport consoleReport;
    private final HtmlStatisticsReport htmlStatisticsReport;
    private final SituationMap situationMap;
    private final Datex2Properties properties;
    private final ReportProperties reportProperties;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<Situation> situations = loadSituations(args);
        log.info("Found {} situations", situations.size());

        if (situations.isEmpty()) {
            log.warn("No situations found, nothing to report");
            return;
        }

        if (!args.containsOption(NO_STATS_OPTION)) {
            consoleReport.print(situations);

            if (args.containsOption(STATS_HTML_OPTION)) {
                Path statisticsFile = optionPath(args, STATS_HTML_OPTION, reportProperties.statisticsFile());
                htmlStatisticsReport.write(situations, statisticsFile);
                log.info("HTML statistics written to {}", statisticsFile);
            }
        }

        Path mapFile = optionPath(args, OUTPUT_OPTION, reportProperties.mapFile());
        situationMap.write(situations, mapFile);
        log.info("Map written to {}", mapFile);
    }

    private @NonNull List<Situation> loadSituations(@NonNull ApplicationArguments args) {
        try {
            if (args.containsOption(LOCAL_OPTION)) {
                return situationService.loadSituations(optionPath(args, LOCAL_OPTION, properties.localFile()));
            }
            return situationService.fetchSituations();
        } catch (RuntimeException e) {
            log.error("Error loading situations: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Resolves the file given as option value, falling back to the default if the option has no value.
     */
    private @NonNull Path optionPath(@NonNull ApplicationArguments args, @NonNull String option, @NonNull String defaultFile) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return Path.of(defaultFile);
        }
        return Path.of(values.get(0));
    }
}
