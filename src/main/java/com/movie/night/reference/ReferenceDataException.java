package com.movie.night.reference;

/**
 * Runtime exception thrown when a bundled reference resource is missing or malformed.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message) {
        super(message);
    }

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
