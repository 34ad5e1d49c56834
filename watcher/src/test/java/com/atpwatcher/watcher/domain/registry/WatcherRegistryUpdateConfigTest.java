package com.atpwatcher.watcher.domain.registry;

import static com.atpwatcher.watcher.test.fixtures.WatchTargetFixtures.TOKEN_ID;
import static com.atpwatcher.watcher.test.fixtures.WatchTargetFixtures.tokenConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

import com.atpwatcher.watcher.domain.classification.TierConfig;
import com.atpwatcher.watcher.domain.exceptions.InvalidWatchConfigException;
import com.atpwatcher.watcher.domain.exceptions.WatchTargetNotFoundException;
import com.atpwatcher.watcher.domain.monitor.LoopState;
import com.atpwatcher.watcher.domain.store.PreferenceKeys;
import com.atpwatcher.watcher.domain.target.WatchTargetUpdate;
import com.atpwatcher.watcher.domain.target.WatcherDefaults;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WatcherRegistryUpdateConfigTest extends WatcherRegistryBaseTest {

    @BeforeEach
    void addToken() {
        registry.start();
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willReturn(new BigDecimal("100"));
        registry.addTarget(tokenConfig().build());
    }

    @Test
    void shouldApplyNewTiersToNextCycle() {
        // given
        registry.updateConfig(TOKEN_ID, WatchTargetUpdate.builder()
                .minorThreshold(new BigDecimal("5"))
                .majorThreshold(new BigDecimal("8"))
                .criticalThreshold(new BigDecimal("12"))
                .build());
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willReturn(new BigDecimal("103"));

        // when
        scheduler.tick(TOKEN_ID);

        // then
        assertThat(stateStore.alerts()).isEmpty();
        assertThat(stateStore.findTarget(TOKEN_ID).orElseThrow().tierConfig())
                .isEqualTo(new TierConfig(new BigDecimal("5"), new BigDecimal("8"), new BigDecimal("12")));
    }

    @Test
    void shouldRescheduleOnIntervalChange() {
        // when
        registry.updateConfig(TOKEN_ID, WatchTargetUpdate.builder().sampleIntervalSeconds(300).build());

        // then
        assertThat(scheduler.timer(TOKEN_ID).interval()).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    void shouldLeaveTargetUnchangedWhenUpdateInvalid() {
        // given
        var before = registry.find(TOKEN_ID).orElseThrow().target();

        // when / then
        assertThatThrownBy(() -> registry.updateConfig(TOKEN_ID,
                WatchTargetUpdate.builder().minorThreshold(new BigDecimal("50")).build()))
                .isInstanceOf(InvalidWatchConfigException.class);
        assertThat(registry.find(TOKEN_ID).orElseThrow().target()).isEqualTo(before);
        assertThat(stateStore.findTarget(TOKEN_ID)).contains(before);
    }

    @Test
    void shouldFailForUnknownTarget() {
        assertThatThrownBy(() -> registry.updateConfig("0xmissing", WatchTargetUpdate.builder().build()))
                .isInstanceOf(WatchTargetNotFoundException.class);
    }

    @Test
    void shouldStopAndRestartSingleLoop() {
        // when
        var stopped = registry.stopLoop(TOKEN_ID);

        // then
        assertThat(stopped.state()).isEqualTo(LoopState.STOPPED);
        assertThat(scheduler.isScheduled(TOKEN_ID)).isFalse();

        // when
        var started = registry.startLoop(TOKEN_ID);

        // then
        assertThat(started.state()).isEqualTo(LoopState.RUNNING);
        assertThat(scheduler.timer(TOKEN_ID).initialDelay()).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldPersistUpdatedDefaults() {
        // given
        var updated = new WatcherDefaults(
                new TierConfig(new BigDecimal("1.5"), new BigDecimal("4"), new BigDecimal("9")), 120);

        // when
        registry.updateDefaults(updated);

        // then
        assertThat(registry.defaults()).isEqualTo(updated);
        assertThat(stateStore.getPreference(PreferenceKeys.TOKEN_MINOR_THRESHOLD)).contains("1.5");
        assertThat(stateStore.getPreference(PreferenceKeys.TOKEN_CHECK_INTERVAL)).contains("120");
    }
}
