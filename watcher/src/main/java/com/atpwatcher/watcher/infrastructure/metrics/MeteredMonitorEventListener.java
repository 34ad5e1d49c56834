package com.atpwatcher.watcher.infrastructure.metrics;

import com.atpwatcher.watcher.domain.alert.AlertRecord;
import com.atpwatcher.watcher.domain.exceptions.SignalFetchException;
import com.atpwatcher.watcher.domain.monitor.MonitorEventListener;
import com.atpwatcher.watcher.domain.target.WatchTarget;
import io.micrometer.core.instrument.Counter;
import java.math.BigDecimal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MeteredMonitorEventListener implements MonitorEventListener {

    private final Counter samplesCounter;
    private final Counter fetchFailuresCounter;
    private final Counter alertsEmittedCounter;
    private final Counter persistenceFailuresCounter;

    @Override
    public void onSample(WatchTarget target, BigDecimal value) {
        samplesCounter.increment();
    }

    @Override
    public void onFetchFailure(WatchTarget target, SignalFetchException error) {
        fetchFailuresCounter.increment();
    }

    @Override
    public void onAlert(AlertRecord alert) {
        alertsEmittedCounter.increment();
    }

    @Override
    public void onPersistenceFailure(WatchTarget target, String operation, RuntimeException error) {
        persistenceFailuresCounter.increment();
    }
}
