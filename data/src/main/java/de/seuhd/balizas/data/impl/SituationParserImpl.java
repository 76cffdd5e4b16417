package de.seuhd.balizas.data.impl;

import de.seuhd.balizas.data.datex2.Datex2DocumentLoader;
import de.seuhd.balizas.data.datex2.SituationExtractor;
import de.seuhd.balizas.domain.exceptions.MalformedDocumentException;
import de.seuhd.balizas.domain.exceptions.NoContentException;
import de.seuhd.balizas.domain.model.Situation;
import de.seuhd.balizas.domain.ports.SituationParser;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NonNull;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;

import java.util.List;

/**
 * Parses DATEX2 payloads into situations. The parsed document is discarded after extraction.
 */
@Service
@RequiredArgsConstructor
class SituationParserImpl implements SituationParser {
    private final Datex2DocumentLoader documentLoader;
    private final SituationExtractor situationExtractor;

    @Override
    public @NonNull List<Situation> parse(byte @NonNull [] content) throws NoContentException, MalformedDocumentException {
        Document document = documentLoader.parse(content);
        return situationExtractor.extract(document);
    }
}
