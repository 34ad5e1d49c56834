package com.atpwatcher.watcher.infrastructure.sink;

import com.atpwatcher.watcher.domain.alert.AlertRecord;
import com.atpwatcher.watcher.domain.alert.AlertSink;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Hands every alert to all enabled channels. A failing channel is logged and
 * skipped; the others still receive the alert.
 */
@Slf4j
@Component
public class BroadcastAlertSink implements AlertSink {

    private final List<AlertChannel> channels;

    public BroadcastAlertSink(List<AlertChannel> channels) {
        this.channels = List.copyOf(channels);
        log.info("Alert channels enabled: {}", this.channels.stream().map(AlertChannel::name).toList());
    }

    @Override
    public void deliver(AlertRecord alert) {
        for (var channel : channels) {
            try {
                channel.publish(alert);
            } catch (RuntimeException e) {
                log.error("Channel {} failed for alert {}: {}", channel.name(), alert.id(), e.getMessage());
            }
        }
    }
}
