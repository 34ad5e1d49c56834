package com.atpwatcher.watcher.domain.monitor;

import com.atpwatcher.watcher.domain.alert.AlertMessageFormatter;
import com.atpwatcher.watcher.domain.alert.AlertSink;
import com.atpwatcher.watcher.domain.classification.ThresholdClassifier;
import com.atpwatcher.watcher.domain.signal.SignalSource;
import com.atpwatcher.watcher.domain.store.StateStore;
import com.atpwatcher.watcher.domain.suppression.SuppressionPolicy;
import java.time.Clock;
import lombok.Builder;

/**
 * Services shared by every {@link MonitorLoop}.
 */
@Builder
public record MonitorCollaborators(
        SignalSource signalSource,
        StateStore stateStore,
        AlertSink alertSink,
        ThresholdClassifier classifier,
        SuppressionPolicy suppressionPolicy,
        AlertMessageFormatter messageFormatter,
        MonitorEventListener eventListener,
        Clock clock
) {
}
