package org.example.travel.exception;

/** A required request field is missing or malformed. */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
