package com.tracelens.query;

/**
 * Thrown when a span or metrics request cannot be compiled into SQL.
 * The request itself is at fault; retrying it unchanged will fail again.
 */
public class InvalidQueryParameterException extends RuntimeException {

    public InvalidQueryParameterException(String message) {
        super(message);
    }

    public InvalidQueryParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
