package de.seuhd.balizas.domain.exceptions;

/**
 * Thrown if a DATEX2 payload cannot be retrieved from its source.
 */
public class Datex2FetchException extends RuntimeException {
    public Datex2FetchException(String source, String reason) {
        super("Could not retrieve DATEX2 payload from " + source + ": " + reason);
    }

    public Datex2FetchException(String source, Throwable cause) {
        super("Could not retrieve DATEX2 payload from " + source + ": " + cause.getMessage(), cause);
    }
}
