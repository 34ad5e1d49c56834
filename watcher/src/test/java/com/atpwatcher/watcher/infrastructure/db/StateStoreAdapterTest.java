package com.atpwatcher.watcher.infrastructure.db;

import static com.atpwatcher.watcher.test.fixtures.WatchTargetFixtures.NOW;
import static com.atpwatcher.watcher.test.fixtures.WatchTargetFixtures.portfolioTarget;
import static com.atpwatcher.watcher.test.fixtures.WatchTargetFixtures.tokenTarget;
import static org.assertj.core.api.Assertions.assertThat;

import com.atpwatcher.common.event.AlertCategory;
import com.atpwatcher.common.event.Severity;
import com.atpwatcher.common.event.TriggerType;
import com.atpwatcher.watcher.WatcherIntegrationBaseTest;
import com.atpwatcher.watcher.domain.alert.AlertRecord;
import com.atpwatcher.watcher.domain.store.PriceHistoryPoint;
import com.atpwatcher.watcher.domain.store.StateStore;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class StateStoreAdapterTest extends WatcherIntegrationBaseTest {

    @Autowired
    private StateStore stateStore;

    @Test
    void shouldRoundTripTargetConfigurationAndState() {
        // given
        var target = portfolioTarget().thresholdLatched(true).build();

        // when
        stateStore.saveTarget(target);

        // then
        assertThat(stateStore.findTarget(target.id())).hasValueSatisfying(stored -> assertThat(stored)
                .usingRecursiveComparison()
                .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                .isEqualTo(target));
    }

    @Test
    void shouldUpdateSampleStateAndDeactivate() {
        // given
        var target = tokenTarget().build();
        stateStore.saveTarget(target);

        // when
        stateStore.updateSampleState(target.id(), new BigDecimal("0.00042"), NOW, false);
        stateStore.deactivateTarget(target.id(), NOW);

        // then
        var stored = stateStore.findTarget(target.id()).orElseThrow();
        assertThat(stored.lastObservedValue()).isEqualByComparingTo("0.00042");
        assertThat(stored.lastSampleTime()).isEqualTo(NOW);
        assertThat(stored.active()).isFalse();
        assertThat(stateStore.findActiveTargets()).isEmpty();
    }

    @Test
    void shouldKeepOnlyNewestHistoryPerTarget() {
        // given
        for (int i = 0; i < 5; i++) {
            stateStore.appendPriceHistory(new PriceHistoryPoint("a", "A", BigDecimal.valueOf(i), NOW.plusSeconds(i)));
            stateStore.appendPriceHistory(new PriceHistoryPoint("b", "B", BigDecimal.valueOf(i), NOW.plusSeconds(i)));
        }

        // when
        var removed = stateStore.pruneHistory(2);

        // then
        assertThat(removed).isEqualTo(6);
        assertThat(stateStore.findPriceHistory("a", 10))
                .extracting(PriceHistoryPoint::value)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("4"), new BigDecimal("3"));
        assertThat(stateStore.stats().historyPoints()).isEqualTo(4);
    }

    @Test
    void shouldMarkAlertDelivered() {
        // given
        stateStore.appendAlert(AlertRecord.builder()
                .id("01JNB4X9W0AAAAAAAAAAAAAAAA")
                .category(AlertCategory.HOLDINGS)
                .triggerType(TriggerType.MILESTONE_REACHED)
                .severity(Severity.INFO)
                .targetId("0xabc")
                .message("Portfolio milestone reached")
                .currentValue(new BigDecimal("1200"))
                .threshold(new BigDecimal("1000"))
                .timestamp(NOW)
                .build());

        // when
        stateStore.markAlertDelivered("01JNB4X9W0AAAAAAAAAAAAAAAA");

        // then
        assertThat(stateStore.findRecentAlerts(5)).singleElement().satisfies(alert -> {
            assertThat(alert.delivered()).isTrue();
            assertThat(alert.triggerType()).isEqualTo(TriggerType.MILESTONE_REACHED);
        });
        assertThat(stateStore.stats().undeliveredAlerts()).isZero();
    }

    @Test
    void shouldOverwritePreference() {
        // when
        stateStore.setPreference("token_check_interval", "60");
        stateStore.setPreference("token_check_interval", "120");

        // then
        assertThat(stateStore.getPreference("token_check_interval")).contains("120");
        assertThat(stateStore.getPreference("missing")).isEmpty();
    }
}
