package com.atpwatcher.watcher.domain.exceptions;

public class WatchTargetNotFoundException extends RuntimeException {

    private WatchTargetNotFoundException(String message) {
        super(message);
    }

    public static WatchTargetNotFoundException of(String targetId) {
        return new WatchTargetNotFoundException("Watch target not found: " + targetId);
    }
}
