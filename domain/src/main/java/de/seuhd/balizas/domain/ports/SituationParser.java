package de.seuhd.balizas.domain.ports;

import de.seuhd.balizas.domain.exceptions.MalformedDocumentException;
import de.seuhd.balizas.domain.exceptions.NoContentException;
import de.seuhd.balizas.domain.model.Situation;
import org.jspecify.annotations.NonNull;

import java.util.List;

/**
 * Port for turning a raw DATEX2 payload into situations.
 */
public interface SituationParser {
    /**
     * Parses the payload and extracts every geolocated situation record in document order.
     *
     * @param content the raw XML payload
     * @return the extracted situations
     * @throws NoContentException if the payload is missing or empty
     * @throws MalformedDocumentException if the payload is not well-formed XML
     */
    @NonNull List<Situation> parse(byte @NonNull [] content) throws NoContentException, MalformedDocumentException;
}
