package com.atpwatcher.watcher.domain.store;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class PreferenceKeys {

    public static final String TOKEN_MINOR_THRESHOLD = "token_minor_threshold";
    public static final String TOKEN_MAJOR_THRESHOLD = "token_major_threshold";
    public static final String TOKEN_CRITICAL_THRESHOLD = "token_critical_threshold";
    public static final String TOKEN_CHECK_INTERVAL = "token_check_interval";
}
