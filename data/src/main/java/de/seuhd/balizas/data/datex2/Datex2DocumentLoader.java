package de.seuhd.balizas.data.datex2;

import de.seuhd.balizas.domain.exceptions.MalformedDocumentException;
import de.seuhd.balizas.domain.exceptions.NoContentException;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Parses raw DATEX2 payloads into namespace-aware DOM documents.
 * The payload is only checked for well-formedness, not validated against the DATEX2 schema.
 */
@Component
@Slf4j
public class Datex2DocumentLoader {
    private final DocumentBuilderFactory factory = createFactory();

    private static DocumentBuilderFactory createFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setValidating(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
        return factory;
    }

    /**
     * Parses a complete DATEX2 payload.
     *
     * @param content the raw XML bytes
     * @return the parsed document
     * @throws NoContentException if the content is null or empty
     * @throws MalformedDocumentException if the content is not well-formed XML
     */
    public @NonNull Document parse(byte @Nullable [] content) throws NoContentException, MalformedDocumentException {
        if (content == null || content.length == 0) {
            throw new NoContentException("No XML content to parse");
        }

        DocumentBuilder builder;
        synchronized (factory) {
            try {
                builder = factory.newDocumentBuilder();
            } catch (ParserConfigurationException e) {
                throw new IllegalStateException("Could not create XML parser", e);
            }
        }
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                log.warn("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
            }

            @Override
            public void error(SAXParseException e) throws SAXException {
                throw e;
            }

            @Override
            public void fatalError(SAXParseException e) throws SAXException {
                throw e;
            }
        });

        try {
            Document document = builder.parse(new ByteArrayInputStream(content));
            log.debug("Parsed DATEX2 document with root element {}", document.getDocumentElement().getLocalName());
            return document;
        } catch (SAXException | IOException e) {
            log.error("Error parsing DATEX2 payload of {} bytes: {}", content.length, e.getMessage());
            throw new MalformedDocumentException(e.getMessage(), e);
        }
    }
}
