package com.farm.anomaly.service;

/**
 * A reading that cannot enter the detection pipeline: undecodable, or missing
 * a required field. Carries the offending field for the error response.
 */
public class MalformedReadingException extends RuntimeException {

    private final String field;

    public MalformedReadingException(String field, String message) {
        super(message);
        this.field = field;
    }

    public MalformedReadingException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
