package de.seuhd.balizas.domain.exceptions;

/**
 * Thrown if a DATEX2 payload is not well-formed XML.
 */
public class MalformedDocumentException extends RuntimeException {
    public MalformedDocumentException(String message, Throwable cause) {
        super("DATEX2 payload is not well-formed XML: " + message, cause);
    }
}
