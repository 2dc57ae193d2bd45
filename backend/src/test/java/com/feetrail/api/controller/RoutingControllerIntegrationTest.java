package com.feetrail.api.controller;

import com.feetrail.routing.DevRoutingReconciler;
import com.feetrail.routing.EscrowAction;
import com.feetrail.routing.RoutingException;
import com.feetrail.routing.RoutingOutcome;
import com.feetrail.routing.RoutingRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = {
        "feetrail.indexer.enabled=false",
        "feetrail.routing.startup-sweep-enabled=false"
})
@AutoConfigureWebTestClient
@Testcontainers
class RoutingControllerIntegrationTest {

    private static final String POOL_ID = "0x" + "aa".repeat(32);
    private static final String DEV = "0x" + "11".repeat(20);

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    DevRoutingReconciler reconciler;

    @Test
    @DisplayName("POST /routing returns the reconciliation outcome")
    void postRouting_returnsOutcome() {
        when(reconciler.reconcile(any())).thenReturn(new RoutingOutcome(true, false, false, EscrowAction.ASSIGNED));

        webTestClient.post().uri("/api/v1/fees/routing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body(POOL_ID, " " + DEV + " "))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.hookRoutingUpdated").isEqualTo(true)
                .jsonPath("$.hookRoutingBlockedByPoolAssigned").isEqualTo(false)
                .jsonPath("$.lockerRoutingUpdated").isEqualTo(false)
                .jsonPath("$.escrowAction").isEqualTo("assigned");

        verify(reconciler).reconcile(new RoutingRequest(POOL_ID, DEV, "proj-1", null));
    }

    @Test
    void postRouting_malformedPoolId_400() {
        webTestClient.post().uri("/api/v1/fees/routing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body("0x1234", DEV))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ROUTING_INPUT");

        verifyNoInteractions(reconciler);
    }

    @Test
    void postRouting_zeroAddress_400() {
        webTestClient.post().uri("/api/v1/fees/routing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body(POOL_ID, "0x0000000000000000000000000000000000000000"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ROUTING_INPUT");
    }

    @Test
    void postRouting_malformedJson_400() {
        webTestClient.post().uri("/api/v1/fees/routing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"poolId\":")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }

    @Test
    @DisplayName("unexpected on-chain failure maps to 502 with a retry message")
    void postRouting_routingFailure_502() {
        when(reconciler.reconcile(any())).thenThrow(new RoutingException("assignDev failed: nonce too low", null));

        webTestClient.post().uri("/api/v1/fees/routing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body(POOL_ID, DEV))
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.BAD_GATEWAY)
                .expectBody()
                .jsonPath("$.error").isEqualTo("FEE_CLAIM_FAILED")
                .jsonPath("$.message").isEqualTo(RoutingController.FEE_CLAIM_FAILED_MESSAGE);
    }

    @Test
    void postRouting_rejectedByReconciler_400() {
        when(reconciler.reconcile(any())).thenThrow(new IllegalArgumentException("dev address must be non-zero"));

        webTestClient.post().uri("/api/v1/fees/routing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body(POOL_ID, DEV))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ROUTING_INPUT");
    }

    private static String body(String poolId, String wallet) {
        return """
                {"poolId":"%s","walletAddress":"%s","projectId":"proj-1"}
                """.formatted(poolId, wallet);
    }
}
