package com.feetrail.api.controller;

import com.feetrail.api.dto.ErrorBody;
import com.feetrail.api.dto.RoutingRequestBody;
import com.feetrail.routing.DevRoutingReconciler;
import com.feetrail.routing.RoutingException;
import com.feetrail.routing.RoutingRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /api/v1/fees/routing: reconcile dev routing for a newly verified developer.
 * Waits for transaction confirmations, so the work runs on the bounded elastic scheduler.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/fees")
@RequiredArgsConstructor
public class RoutingController {

    static final String FEE_CLAIM_FAILED_MESSAGE = "Fee claim failed, please retry later";

    private final DevRoutingReconciler reconciler;

    @PostMapping("/routing")
    public Mono<ResponseEntity<?>> route(@Valid @RequestBody RoutingRequestBody body) {
        RoutingRequest request = new RoutingRequest(body.poolId().trim(), body.walletAddress().trim(),
                body.projectId(), body.poolTokenAddress() != null && !body.poolTokenAddress().isBlank()
                        ? body.poolTokenAddress().trim() : null);
        return Mono.fromCallable(() -> reconciler.reconcile(request))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity.badRequest()
                        .body(ErrorBody.of("INVALID_ROUTING_INPUT", e.getMessage()))))
                .onErrorResume(RoutingException.class, e -> {
                    log.error("Fee routing failed for pool {} project {}: {}",
                            request.poolId(), request.projectId(), e.getMessage(), e);
                    return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                            .body(ErrorBody.of("FEE_CLAIM_FAILED", FEE_CLAIM_FAILED_MESSAGE)));
                });
    }
}
