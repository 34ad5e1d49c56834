package com.atpwatcher.watcher.infrastructure.sink;

import com.atpwatcher.watcher.domain.alert.AlertDeliveryTracker;
import com.atpwatcher.watcher.domain.alert.AlertRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingAlertChannel implements AlertChannel {

    private final AlertDeliveryTracker deliveryTracker;

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void publish(AlertRecord alert) {
        log.info("ALERT {} {} {}\n{}", alert.category(), alert.severity(), alert.targetId(), alert.message());
        deliveryTracker.confirm(alert.id());
    }
}
