package com.atpwatcher.watcher.domain.monitor;

import com.atpwatcher.watcher.domain.alert.AlertRecord;
import java.math.BigDecimal;
import java.util.List;

public record CycleOutcome(Status status, BigDecimal value, List<AlertRecord> alerts) {

    public enum Status {
        SAMPLED,
        /** Loop not running or target inactive when the tick fired. */
        SKIPPED,
        FETCH_FAILED,
        /** Value arrived after the loop was stopped; nothing applied. */
        DISCARDED,
        FAILED
    }

    static CycleOutcome sampled(BigDecimal value, List<AlertRecord> alerts) {
        return new CycleOutcome(Status.SAMPLED, value, List.copyOf(alerts));
    }

    static CycleOutcome of(Status status) {
        return new CycleOutcome(status, null, List.of());
    }
}
