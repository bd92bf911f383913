package com.quantsim.simulator.exception;

/**
 * A persisted cache unit exists but cannot be read back.
 */
public class CacheCorruptedException extends RuntimeException {

    public CacheCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
