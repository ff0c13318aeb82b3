package com.callplatform.guardsvc.infrastructure.geo;

/**
 * The geo reputation provider could not answer (timeout, transport error, open breaker, bad payload).
 */
public class GeoLookupException extends RuntimeException {

    public GeoLookupException(String message) {
        super(message);
    }

    public GeoLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
