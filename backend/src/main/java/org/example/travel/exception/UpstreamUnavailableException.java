package org.example.travel.exception;

/**
 * One of the upstream APIs failed (transport error, timeout, non-2xx answer) or
 * returned nothing the pipeline can continue with. The message carries the
 * upstream detail as-is.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
