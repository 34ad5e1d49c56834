package com.atpwatcher.watcher.application.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.atpwatcher.common.kafka.KafkaTopics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class WatcherPropertiesTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = "  ")
    void shouldDefaultSinkTopicWhenUnset(String topic) {
        // when
        var sink = new WatcherProperties.Sink(true, topic);

        // then
        assertThat(sink.topic()).isEqualTo(KafkaTopics.WATCH_ALERTS);
    }

    @Test
    void shouldKeepConfiguredSinkTopic() {
        // when
        var sink = new WatcherProperties.Sink(true, "alerts.custom");

        // then
        assertThat(sink.topic()).isEqualTo("alerts.custom");
    }
}
