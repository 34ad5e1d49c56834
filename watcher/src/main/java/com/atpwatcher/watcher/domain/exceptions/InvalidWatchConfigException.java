package com.atpwatcher.watcher.domain.exceptions;

public class InvalidWatchConfigException extends RuntimeException {

    private InvalidWatchConfigException(String message) {
        super(message);
    }

    public static InvalidWatchConfigException of(String message) {
        return new InvalidWatchConfigException(message);
    }

    public static InvalidWatchConfigException missing(String field) {
        return new InvalidWatchConfigException(field + " is required");
    }
}
