package com.phillippitts.estatesearch.exception;

/**
 * Base exception for all estate-search application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class EstateSearchException extends RuntimeException {

    public EstateSearchException(String message) {
        super(message);
    }

    public EstateSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
