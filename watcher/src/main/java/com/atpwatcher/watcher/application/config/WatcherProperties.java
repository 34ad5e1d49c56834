package com.atpwatcher.watcher.application.config;

import com.atpwatcher.common.kafka.KafkaTopics;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "watcher")
public record WatcherProperties(
        boolean autostart,
        @NotNull @Valid Api api,
        @NotNull @Valid Portfolio portfolio,
        @NotNull @Valid BaseToken baseToken,
        @NotNull @Valid TokenDefaults tokenDefaults,
        @NotNull @Valid History history,
        @NotNull @Valid Sink sink) {

    public record Api(@NotBlank String baseUrl, @NotNull Duration timeout, @NotNull @Valid Retry retry) {}

    public record Retry(@Min(0) int maxRetries, @Min(1) long initialDelayMs, @Min(1) long maxDelayMs, @Min(1) long multiplier) {}

    public record Portfolio(
            boolean enabled,
            @Pattern(regexp = "^$|^0x[a-fA-F0-9]{40}$", message = "must be a 0x-prefixed 40 hex character address")
                    String walletAddress,
            @NotBlank String displayName,
            @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal changeThreshold,
            @Min(30) @Max(3600) int intervalSeconds,
            @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal milestoneUsd) {}

    public record BaseToken(
            boolean enabled,
            @NotBlank String id,
            @NotBlank String displayName,
            @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal minorThreshold,
            @NotNull BigDecimal majorThreshold,
            @NotNull BigDecimal criticalThreshold,
            @Min(30) @Max(3600) int intervalSeconds) {}

    public record TokenDefaults(
            @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal changeThreshold,
            @Min(30) @Max(3600) int intervalSeconds) {}

    public record History(@Min(1) int retentionPerTarget, @NotBlank String pruneCron) {}

    public record Sink(boolean kafkaEnabled, @NotBlank String topic) {

        public Sink {
            if (topic == null || topic.isBlank()) {
                topic = KafkaTopics.WATCH_ALERTS;
            }
        }
    }
}
