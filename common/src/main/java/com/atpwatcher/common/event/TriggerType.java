package com.atpwatcher.common.event;

public enum TriggerType {
    /** Relative move between two consecutive samples met a tier threshold. */
    PERCENT_CHANGE,
    /** Value crossed an absolute milestone from below. */
    MILESTONE_REACHED
}
