package org.example.travel.exception;

/** A country code or name does not resolve to any known country. */
public class DestinationNotFoundException extends RuntimeException {

    public DestinationNotFoundException(String message) {
        super(message);
    }
}
