package com.atpwatcher.watcher.domain.alert;

import com.atpwatcher.watcher.domain.monitor.MonitorScheduler;
import com.atpwatcher.watcher.domain.store.StateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

/**
 * Flips the delivered flag once a sink channel confirms an alert.
 *
 * <p>Confirmations are queued on the execution context, so they run after the
 * cycle that emitted the alert has written it.
 */
@Slf4j
@RequiredArgsConstructor
public class AlertDeliveryTracker {

    private final MonitorScheduler scheduler;
    private final StateStore stateStore;

    public void confirm(String alertId) {
        scheduler.execute(() -> markDelivered(alertId));
    }

    private void markDelivered(String alertId) {
        try {
            stateStore.markAlertDelivered(alertId);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to mark alert {} delivered: {}", alertId, e.getMessage());
        }
    }
}
