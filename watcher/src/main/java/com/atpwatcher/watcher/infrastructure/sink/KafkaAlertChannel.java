package com.atpwatcher.watcher.infrastructure.sink;

import com.atpwatcher.common.event.WatchAlertEvent;
import com.atpwatcher.watcher.application.config.WatcherProperties;
import com.atpwatcher.watcher.domain.alert.AlertDeliveryTracker;
import com.atpwatcher.watcher.domain.alert.AlertRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes alerts as {@link WatchAlertEvent} JSON, keyed by target id so all
 * alerts of one target land on the same partition.
 *
 * <p>Sends run on {@code alertPublishExecutor}: {@link KafkaTemplate#send} can block
 * on broker metadata, and the caller is the watcher loop thread.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "watcher.sink", name = "kafka-enabled", havingValue = "true")
public class KafkaAlertChannel implements AlertChannel {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final WatcherProperties properties;
    private final AlertDeliveryTracker deliveryTracker;
    private final TaskExecutor alertPublishExecutor;

    @Override
    public String name() {
        return "kafka";
    }

    @Override
    public void publish(AlertRecord alert) {
        try {
            alertPublishExecutor.execute(() -> send(alert));
        } catch (TaskRejectedException e) {
            log.error("Publish queue full, dropping Kafka delivery of alert {}", alert.id());
        }
    }

    private void send(AlertRecord alert) {
        var event = WatchAlertEvent.builder()
                .alertId(alert.id())
                .category(alert.category())
                .triggerType(alert.triggerType())
                .severity(alert.severity())
                .targetId(alert.targetId())
                .displayName(alert.displayName())
                .previousValue(alert.previousValue())
                .currentValue(alert.currentValue())
                .deltaPct(alert.deltaPct())
                .threshold(alert.threshold())
                .message(alert.message())
                .triggeredAt(alert.timestamp())
                .build();

        kafkaTemplate.send(properties.sink().topic(), alert.targetId(), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish alert {}: {}", alert.id(), ex.getMessage());
                        return;
                    }
                    log.debug("Published alert {} to partition {}",
                            alert.id(), result.getRecordMetadata().partition());
                    deliveryTracker.confirm(alert.id());
                });
    }
}
