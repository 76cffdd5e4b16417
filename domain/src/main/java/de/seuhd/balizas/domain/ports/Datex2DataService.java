package de.seuhd.balizas.domain.ports;

import de.seuhd.balizas.domain.exceptions.Datex2FetchException;
import org.jspecify.annotations.NonNull;

import java.nio.file.Path;

/**
 * Port for retrieving raw DATEX2 payloads.
 * This is a port in the hexagonal architecture pattern, implemented by the data layer.
 */
public interface Datex2DataService {
    /**
     * Downloads the current publication from the configured endpoint.
     *
     * @return the complete payload
     * @throws Datex2FetchException if the endpoint cannot be reached or returns no payload
     */
    byte @NonNull [] fetch() throws Datex2FetchException;

    /**
     * Reads a publication from a local file.
     *
     * @param file the file to read
     * @return the complete payload
     * @throws Datex2FetchException if the file cannot be read
     */
    byte @NonNull [] load(@NonNull Path file) throws Datex2FetchException;
}
