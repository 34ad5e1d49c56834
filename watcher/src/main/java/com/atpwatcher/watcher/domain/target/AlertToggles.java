package com.atpwatcher.watcher.domain.target;

import com.atpwatcher.watcher.domain.classification.Tier;

public record AlertToggles(boolean minor, boolean major, boolean critical) {

    public static final AlertToggles ALL_ENABLED = new AlertToggles(true, true, true);

    public boolean isEnabled(Tier tier) {
        return switch (tier) {
            case MINOR -> minor;
            case MAJOR -> major;
            case CRITICAL -> critical;
            case NONE -> false;
        };
    }
}
