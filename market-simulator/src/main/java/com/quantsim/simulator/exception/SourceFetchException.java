package com.quantsim.simulator.exception;

/**
 * A price provider could not deliver data and no usable cache exists.
 * Fatal for the run that needed the asset.
 */
public class SourceFetchException extends RuntimeException {

    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
