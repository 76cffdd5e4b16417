package de.seuhd.balizas.domain.impl;

import de.seuhd.balizas.domain.model.Situation;
import de.seuhd.balizas.domain.ports.Datex2DataService;
import de.seuhd.balizas.domain.ports.SituationParser;
import de.seuhd.balizas.domain.ports.SituationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Implementation of the situation service that combines payload retrieval and extraction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SituationServiceImpl implements SituationService {
    private final Datex2DataService datex2DataService;
    private final SituationParser situationParser;

    @Override
    public @NonNull List<Situation> fetchSituations() {
        log.info("Fetching situations from DATEX2 endpoint...");
        return extract(datex2DataService.fetch(), "endpoint");
    }

    @Override
    public @NonNull List<Situation> loadSituations(@NonNull Path file) {
        log.info("Loading situations from file {}...", file);
        return extract(datex2DataService.load(file), file.toString());
    }

    private @NonNull List<Situation> extract(byte @NonNull [] content, @NonNull String source) {
        log.debug("Parsing {} bytes from {}", content.length, source);
        List<Situation> situations = situationParser.parse(content);
        log.info("Extracted {} situations from {}", situations.size(), source);
        return situations;
    }
}
