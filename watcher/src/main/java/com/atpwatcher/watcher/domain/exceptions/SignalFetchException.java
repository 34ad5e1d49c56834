package com.atpwatcher.watcher.domain.exceptions;

/**
 * A signal could not be read right now. Callers treat it as transient.
 */
public class SignalFetchException extends RuntimeException {

    private SignalFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public static SignalFetchException of(String message) {
        return new SignalFetchException(message, null);
    }

    public static SignalFetchException of(String message, Throwable cause) {
        return new SignalFetchException(message, cause);
    }
}
