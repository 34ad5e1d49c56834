package com.atpwatcher.watcher.domain.registry;

import static com.atpwatcher.watcher.test.fixtures.WatchTargetFixtures.NOW;
import static com.atpwatcher.watcher.test.fixtures.WatchTargetFixtures.TOKEN_ID;
import static com.atpwatcher.watcher.test.fixtures.WatchTargetFixtures.tokenConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.times;

import com.atpwatcher.watcher.domain.classification.TierConfig;
import com.atpwatcher.watcher.domain.exceptions.InvalidWatchConfigException;
import com.atpwatcher.watcher.domain.exceptions.SignalFetchException;
import com.atpwatcher.watcher.domain.monitor.LoopState;
import com.atpwatcher.watcher.domain.target.WatchKind;
import com.atpwatcher.watcher.domain.target.WatchTarget;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class WatcherRegistryAddRemoveTest extends WatcherRegistryBaseTest {

    @Test
    void shouldAddTokenWithDefaultsAndBaseline() {
        // given
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willReturn(new BigDecimal("0.0125"));

        // when
        var added = registry.addTarget(tokenConfig().build());

        // then
        assertThat(added.tierConfig()).isEqualTo(TierConfig.scaledFrom(new BigDecimal("2")));
        assertThat(added.sampleIntervalSeconds()).isEqualTo(60);
        assertThat(added.lastObservedValue()).isEqualByComparingTo("0.0125");
        assertThat(added.lastSampleTime()).isEqualTo(NOW);
        assertThat(added.active()).isTrue();
        assertThat(stateStore.findTarget(TOKEN_ID)).contains(added);
        assertThat(registry.activeCount()).isEqualTo(1);
    }

    @Test
    void shouldArmTimerAfterOneIntervalWhenRegistryRunning() {
        // given
        registry.start();
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willReturn(new BigDecimal("1"));

        // when
        registry.addTarget(tokenConfig().sampleIntervalSeconds(45).build());

        // then
        var timer = scheduler.timer(TOKEN_ID);
        assertThat(timer.initialDelay()).isEqualTo(Duration.ofSeconds(45));
        assertThat(timer.interval()).isEqualTo(Duration.ofSeconds(45));
        assertThat(registry.find(TOKEN_ID)).hasValueSatisfying(status ->
                assertThat(status.state()).isEqualTo(LoopState.RUNNING));
    }

    @Test
    void shouldIgnoreDuplicateAdd() {
        // given
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willReturn(new BigDecimal("1"));
        var first = registry.addTarget(tokenConfig().build());

        // when
        var second = registry.addTarget(tokenConfig().displayName("Renamed").sampleIntervalSeconds(90).build());

        // then
        assertThat(second).isEqualTo(first);
        assertThat(registry.list()).hasSize(1);
        then(signalSource).should(times(1)).fetchTokenPrice(TOKEN_ID);
    }

    @Test
    void shouldNotifyCreationOnlyForNewTarget() {
        // given
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willReturn(new BigDecimal("1"));
        List<WatchTarget> created = new ArrayList<>();

        // when
        registry.addTarget(tokenConfig().build(), created::add);
        registry.addTarget(tokenConfig().build(), created::add);

        // then
        assertThat(created).extracting(WatchTarget::id).containsExactly(TOKEN_ID);
    }

    @Test
    void shouldNotRegisterTargetWhenBaselineFetchFails() {
        // given
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willThrow(SignalFetchException.of("timeout"));

        // when / then
        assertThatThrownBy(() -> registry.addTarget(tokenConfig().build())).isInstanceOf(SignalFetchException.class);
        assertThat(registry.list()).isEmpty();
        assertThat(stateStore.findTarget(TOKEN_ID)).isEmpty();
    }

    @Test
    void shouldRejectInvalidIntervalBeforeFetching() {
        // when / then
        assertThatThrownBy(() -> registry.addTarget(tokenConfig().sampleIntervalSeconds(10).build()))
                .isInstanceOf(InvalidWatchConfigException.class);
        then(signalSource).shouldHaveNoInteractions();
    }

    @Test
    void shouldReactivateRemovedTargetOnReAdd() {
        // given
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willReturn(new BigDecimal("1"), new BigDecimal("2"));
        registry.addTarget(tokenConfig().build());
        registry.removeTarget(TOKEN_ID);

        // when
        var readded = registry.addTarget(tokenConfig().build());

        // then
        assertThat(readded.active()).isTrue();
        assertThat(readded.lastObservedValue()).isEqualByComparingTo("2");
        assertThat(registry.activeCount()).isEqualTo(1);
    }

    @Test
    void shouldCancelTimerAndDeactivateOnRemove() {
        // given
        registry.start();
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willReturn(new BigDecimal("1"));
        registry.addTarget(tokenConfig().build());

        // when
        var removed = registry.removeTarget(TOKEN_ID);

        // then
        assertThat(removed).isTrue();
        assertThat(scheduler.isScheduled(TOKEN_ID)).isFalse();
        assertThat(stateStore.findTarget(TOKEN_ID)).hasValueSatisfying(target ->
                assertThat(target.active()).isFalse());
        assertThat(registry.find(TOKEN_ID)).isEmpty();
        assertThat(registry.activeCount()).isZero();
    }

    @Test
    void shouldTreatRemovalOfUnknownIdAsNoOp() {
        // when
        var removed = registry.removeTarget("0xunknown");

        // then
        assertThat(removed).isFalse();
    }

    @Test
    void shouldRegisterFixedTargetWithoutBaselineFetch() {
        // given
        registry.start();

        // when
        var target = registry.ensureTarget(tokenConfig()
                .id("IQ_TOKEN")
                .kind(WatchKind.BASE_TOKEN)
                .displayName("IQ (Everipedia)")
                .build());

        // then
        assertThat(target.lastObservedValue()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(scheduler.timer("IQ_TOKEN").initialDelay()).isEqualTo(Duration.ZERO);
        then(signalSource).shouldHaveNoInteractions();
    }
}
