package com.atpwatcher.watcher.application.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.atpwatcher.watcher.domain.exceptions.SignalFetchException;
import io.micrometer.core.instrument.Counter;
import java.math.BigDecimal;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

class AddWatchControllerTest extends WatchControllerBaseTest {

    @Autowired
    private Counter watchesAddedCounter;

    @SneakyThrows
    @Test
    void shouldCountDuplicateAddOnlyOnce() {
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willReturn(new BigDecimal("1"));
        var before = watchesAddedCounter.count();
        var body = """
                {"tokenId": "%s"}
                """.formatted(TOKEN_ID);

        mockMvc.perform(post(WATCHES_PATH).contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated());
        mockMvc.perform(post(WATCHES_PATH).contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().is2xxSuccessful());

        assertThat(watchesAddedCounter.count()).isEqualTo(before + 1);
    }

    @SneakyThrows
    @Test
    void shouldAddTokenWatchWithDerivedTiers() {
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willReturn(new BigDecimal("0.0125"));

        mockMvc.perform(post(WATCHES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tokenId": "%s", "displayName": "Sophia", "changeThreshold": 4, "sampleIntervalSeconds": 120}
                                """.formatted(TOKEN_ID)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", is(TOKEN_ID)))
                .andExpect(jsonPath("$.kind", is("TOKEN")))
                .andExpect(jsonPath("$.state", is("STOPPED")))
                .andExpect(jsonPath("$.minorThreshold").value(4))
                .andExpect(jsonPath("$.majorThreshold").value(12))
                .andExpect(jsonPath("$.criticalThreshold").value(20))
                .andExpect(jsonPath("$.sampleIntervalSeconds", is(120)))
                .andExpect(jsonPath("$.lastObservedValue").value(0.0125));
    }

    @SneakyThrows
    @Test
    void shouldApplyDefaultsWhenNoThresholdGiven() {
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willReturn(new BigDecimal("1"));

        mockMvc.perform(post(WATCHES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tokenId": "%s"}
                                """.formatted(TOKEN_ID)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.displayName", is(TOKEN_ID)))
                .andExpect(jsonPath("$.minorThreshold").value(2))
                .andExpect(jsonPath("$.sampleIntervalSeconds", is(60)));
    }

    @SneakyThrows
    @Test
    void shouldRejectIntervalBelowMinimum() {
        mockMvc.perform(post(WATCHES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tokenId": "%s", "sampleIntervalSeconds": 5}
                                """.formatted(TOKEN_ID)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("VALIDATION_ERROR")))
                .andExpect(jsonPath("$.errors", hasItem(startsWith("sampleIntervalSeconds"))));
    }

    @SneakyThrows
    @Test
    void shouldRejectNonIncreasingTiers() {
        mockMvc.perform(post(WATCHES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tokenId": "%s", "minorThreshold": 5, "majorThreshold": 3, "criticalThreshold": 10}
                                """.formatted(TOKEN_ID)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("VALIDATION_ERROR")));
    }

    @SneakyThrows
    @Test
    void shouldRejectChangeThresholdTogetherWithTiers() {
        mockMvc.perform(post(WATCHES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tokenId": "%s", "changeThreshold": 2, "minorThreshold": 1, "majorThreshold": 3, "criticalThreshold": 10}
                                """.formatted(TOKEN_ID)))
                .andExpect(status().isBadRequest());
    }

    @SneakyThrows
    @Test
    void shouldReturn503WhenBaselineFetchFails() {
        given(signalSource.fetchTokenPrice(TOKEN_ID)).willThrow(SignalFetchException.of("IQ API unreachable"));

        mockMvc.perform(post(WATCHES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tokenId": "%s"}
                                """.formatted(TOKEN_ID)))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code", is("SIGNAL_UNAVAILABLE")));
    }

    @SneakyThrows
    @Test
    void shouldRejectMalformedBody() {
        mockMvc.perform(post(WATCHES_PATH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tokenId\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("VALIDATION_ERROR")));
    }
}
