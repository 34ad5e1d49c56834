package com.atpwatcher.watcher.infrastructure.metrics;

import static com.atpwatcher.watcher.test.fixtures.WatchTargetFixtures.tokenTarget;
import static org.assertj.core.api.Assertions.assertThat;

import com.atpwatcher.watcher.domain.alert.AlertRecord;
import com.atpwatcher.watcher.domain.exceptions.SignalFetchException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class MeteredMonitorEventListenerTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final Counter samples = meterRegistry.counter("watcher.samples");
    private final Counter fetchFailures = meterRegistry.counter("watcher.fetch.failures");
    private final Counter alerts = meterRegistry.counter("watcher.alerts.emitted");
    private final Counter persistenceFailures = meterRegistry.counter("watcher.persistence.failures");

    private final MeteredMonitorEventListener listener =
            new MeteredMonitorEventListener(samples, fetchFailures, alerts, persistenceFailures);

    @Test
    void shouldCountEachCycleOutcome() {
        // given
        var target = tokenTarget().build();

        // when
        listener.onSample(target, BigDecimal.ONE);
        listener.onSample(target, BigDecimal.TEN);
        listener.onFetchFailure(target, SignalFetchException.of("timeout"));
        listener.onAlert(AlertRecord.builder().id("a1").build());
        listener.onPersistenceFailure(target, "alert", new DataAccessResourceFailureException("locked"));

        // then
        assertThat(samples.count()).isEqualTo(2.0);
        assertThat(fetchFailures.count()).isEqualTo(1.0);
        assertThat(alerts.count()).isEqualTo(1.0);
        assertThat(persistenceFailures.count()).isEqualTo(1.0);
    }
}
