package de.seuhd.balizas.domain.ports;

import de.seuhd.balizas.domain.model.Situation;
import org.jspecify.annotations.NonNull;

import java.nio.file.Path;
import java.util.List;

/**
 * Service interface for obtaining traffic situations.
 */
public interface SituationService {
    @NonNull List<Situation> fetchSituations();

    @NonNull List<Situation> loadSituations(@NonNull Path file);
}
