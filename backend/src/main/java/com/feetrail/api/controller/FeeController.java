package com.feetrail.api.controller;

import com.feetrail.api.dto.BackfillRequest;
import com.feetrail.api.dto.BackfillResponse;
import com.feetrail.api.dto.DistributionPageResponse;
import com.feetrail.api.dto.ErrorBody;
import com.feetrail.api.dto.FeeDistributionResponse;
import com.feetrail.api.dto.IndexerHealthResponse;
import com.feetrail.common.EvmHex;
import com.feetrail.domain.FeeEventType;
import com.feetrail.ingestion.config.ContractProperties;
import com.feetrail.ingestion.job.FeeIndexerPoller;
import com.feetrail.ingestion.job.IndexerStatus;
import com.feetrail.ingestion.query.DistributionFilter;
import com.feetrail.ingestion.query.FeeQueryService;
import com.feetrail.ingestion.query.FeeTotals;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Read API over the fee audit trail plus indexer status, health and manual backfill.
 */
@RestController
@RequestMapping("/api/v1/fees")
@RequiredArgsConstructor
public class FeeController {

    private static final Pattern TX_HASH = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private final FeeQueryService feeQueryService;
    private final FeeIndexerPoller feeIndexerPoller;
    private final ContractProperties contractProperties;

    @GetMapping("/distributions")
    public ResponseEntity<?> getDistributions(
            @RequestParam(required = false) String eventType,
            @RequestParam(required = false) String poolId,
            @RequestParam(required = false) String devAddress,
            @RequestParam(required = false) String tokenAddress,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset
    ) {
        FeeEventType type = null;
        if (eventType != null && !eventType.isBlank()) {
            Optional<FeeEventType> parsed = FeeEventType.fromWireName(eventType.trim());
            if (parsed.isEmpty()) {
                return badRequest("INVALID_EVENT_TYPE", "Unknown event type: " + eventType);
            }
            type = parsed.get();
        }
        if (poolId != null && !EvmHex.isBytes32(poolId.trim())) {
            return badRequest("INVALID_POOL_ID", "Invalid pool id");
        }
        if (devAddress != null && !EvmHex.isAddress(devAddress.trim())) {
            return badRequest("INVALID_ADDRESS", "Invalid dev address");
        }
        if (tokenAddress != null && !EvmHex.isAddress(tokenAddress.trim())) {
            return badRequest("INVALID_ADDRESS", "Invalid token address");
        }
        DistributionFilter filter = new DistributionFilter(type, poolId, devAddress, tokenAddress, null);
        return ResponseEntity.ok(DistributionPageResponse.from(feeQueryService.find(filter, limit, offset)));
    }

    @GetMapping("/pool/{poolId}")
    public ResponseEntity<?> getByPool(@PathVariable String poolId,
                                       @RequestParam(required = false) Integer limit,
                                       @RequestParam(required = false) Integer offset) {
        if (!EvmHex.isBytes32(poolId.trim())) {
            return badRequest("INVALID_POOL_ID", "Invalid pool id");
        }
        return ResponseEntity.ok(DistributionPageResponse.from(
                feeQueryService.find(DistributionFilter.byPool(poolId), limit, offset)));
    }

    @GetMapping("/dev/{address}")
    public ResponseEntity<?> getByDev(@PathVariable String address,
                                      @RequestParam(required = false) Integer limit,
                                      @RequestParam(required = false) Integer offset) {
        if (!EvmHex.isAddress(address.trim())) {
            return badRequest("INVALID_ADDRESS", "Invalid dev address");
        }
        return ResponseEntity.ok(DistributionPageResponse.from(
                feeQueryService.find(DistributionFilter.byDev(address), limit, offset)));
    }

    @GetMapping("/project/{projectId}")
    public ResponseEntity<?> getByProject(@PathVariable String projectId,
                                          @RequestParam(required = false) Integer limit,
                                          @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(DistributionPageResponse.from(
                feeQueryService.find(DistributionFilter.byProject(projectId), limit, offset)));
    }

    @GetMapping("/tx/{txHash}")
    public ResponseEntity<?> getByTx(@PathVariable String txHash) {
        if (!TX_HASH.matcher(txHash.trim()).matches()) {
            return badRequest("INVALID_TX_HASH", "Invalid transaction hash");
        }
        List<FeeDistributionResponse> items = feeQueryService.findByTxHash(txHash.trim()).stream()
                .map(FeeDistributionResponse::from)
                .toList();
        return ResponseEntity.ok(items);
    }

    @GetMapping("/totals")
    public ResponseEntity<FeeTotals> getTotals() {
        return ResponseEntity.ok(feeQueryService.totals());
    }

    /** Reads the chain head, so it runs off the event loop. */
    @GetMapping("/indexer/status")
    public Mono<IndexerStatus> getIndexerStatus() {
        return Mono.fromCallable(feeIndexerPoller::getStatus)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/health")
    public IndexerHealthResponse getHealth() {
        String status;
        if (!feeIndexerPoller.isRunning()) {
            status = "stopped";
        } else if (feeIndexerPoller.getLastError() != null) {
            status = "degraded";
        } else {
            status = "ok";
        }
        return new IndexerHealthResponse(contractProperties.hasVault(), status);
    }

    @PostMapping("/indexer/backfill")
    public ResponseEntity<?> backfill(@Valid @RequestBody BackfillRequest request) {
        if (!contractProperties.hasVault()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ErrorBody.of("INDEXER_NOT_CONFIGURED", "No fee vault address configured"));
        }
        feeIndexerPoller.backfillAsync(request.fromBlock());
        return ResponseEntity.accepted().body(new BackfillResponse(request.fromBlock(), "Backfill started"));
    }

    private static ResponseEntity<ErrorBody> badRequest(String error, String message) {
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }
}
