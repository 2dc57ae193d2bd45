package com.feetrail.ingestion.adapter;

import com.feetrail.common.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcEndpointFailoverTest {

    @Test
    void current_staysOnPrimaryUntilItFails() {
        RpcEndpointFailover endpoints = new RpcEndpointFailover(
                "https://mainnet.base.org", List.of("https://fallback.rpc"), RetryPolicy.defaultPolicy());

        assertThat(endpoints.current()).isEqualTo("https://mainnet.base.org");
        assertThat(endpoints.current()).isEqualTo("https://mainnet.base.org");
    }

    @Test
    void markFailed_movesToFallbackThenWrapsToPrimary() {
        RpcEndpointFailover endpoints = new RpcEndpointFailover(
                "https://primary.rpc", List.of("https://fallback.rpc"), null);

        endpoints.markFailed("https://primary.rpc");
        assertThat(endpoints.current()).isEqualTo("https://fallback.rpc");

        endpoints.markFailed("https://fallback.rpc");
        assertThat(endpoints.current()).isEqualTo("https://primary.rpc");
    }

    @Test
    @DisplayName("a late failure report for an endpoint that is no longer active does not advance again")
    void markFailed_staleEndpoint_ignored() {
        RpcEndpointFailover endpoints = new RpcEndpointFailover(
                "https://primary.rpc", List.of("https://f1.rpc", "https://f2.rpc"), null);

        endpoints.markFailed("https://primary.rpc");
        endpoints.markFailed("https://primary.rpc");

        assertThat(endpoints.current()).isEqualTo("https://f1.rpc");
    }

    @Test
    void constructor_dropsBlankAndDuplicateUrls() {
        RpcEndpointFailover endpoints = new RpcEndpointFailover(
                " https://primary.rpc ", List.of("", "https://primary.rpc", "https://fallback.rpc"), null);

        endpoints.markFailed("https://primary.rpc");

        assertThat(endpoints.current()).isEqualTo("https://fallback.rpc");
    }

    @Test
    void constructor_onlyFallbacks_usesFirstFallback() {
        RpcEndpointFailover endpoints = new RpcEndpointFailover(null, List.of("https://fallback.rpc"), null);

        assertThat(endpoints.current()).isEqualTo("https://fallback.rpc");
    }

    @Test
    void constructor_noUrls_throws() {
        assertThatThrownBy(() -> new RpcEndpointFailover(" ", List.of(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("RPC URL is required");
    }

    @Test
    void retrySettings_comeFromPolicy() {
        RpcEndpointFailover endpoints = new RpcEndpointFailover("https://a.rpc", null, new RetryPolicy(100L, 0, 3));

        assertThat(endpoints.retryDelayMs(0)).isEqualTo(100L);
        assertThat(endpoints.retryDelayMs(1)).isEqualTo(200L);
        assertThat(endpoints.getMaxAttempts()).isEqualTo(3);
    }
}
