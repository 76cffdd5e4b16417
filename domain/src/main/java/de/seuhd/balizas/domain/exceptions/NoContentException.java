package de.seuhd.balizas.domain.exceptions;

/**
 * Thrown if there is no payload to parse, or if situations are extracted before a document was parsed.
 */
public class NoContentException extends RuntimeException {
    public NoContentException(String message) {
        super(message);
    }
}
