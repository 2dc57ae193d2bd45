package com.feetrail.ingestion.job;

import com.feetrail.common.BackoffCounter;
import com.feetrail.config.AsyncConfig;
import com.feetrail.config.SchedulerConfig;
import com.feetrail.domain.FeeDistribution;
import com.feetrail.ingestion.adapter.RpcException;
import com.feetrail.ingestion.adapter.evm.EvmBlockHeightResolver;
import com.feetrail.ingestion.config.ContractProperties;
import com.feetrail.ingestion.config.IndexerProperties;
import com.feetrail.ingestion.project.ProjectIdentityCache;
import com.feetrail.ingestion.store.FeeDistributionStore;
import com.feetrail.ingestion.store.IndexerCursorStore;
import com.feetrail.ingestion.vault.FeeVaultScanner;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fee-vault indexer: catch up from the persisted cursor to the chain head, then poll at a fixed delay.
 * One scheduled task, so cycles never overlap. The cursor is persisted after every sub-batch.
 *
 * <p>Cycle errors are recorded in {@code lastError} and double a diagnostic retry delay (reported in status);
 * the poll cadence itself stays fixed.
 */
@Slf4j
@Component
public class FeeIndexerPoller {

    private final EvmBlockHeightResolver blockHeightResolver;
    private final FeeVaultScanner vaultScanner;
    private final FeeDistributionStore distributionStore;
    private final IndexerCursorStore cursorStore;
    private final ProjectIdentityCache projectIdentityCache;
    private final ContractProperties contractProperties;
    private final IndexerProperties indexerProperties;
    private final TaskScheduler scheduler;
    private final Executor backfillExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong eventsIndexed = new AtomicLong();
    private final BackoffCounter retryDelay;
    private final Object scanLock = new Object();

    private volatile ScheduledFuture<?> scheduledCycle;
    private volatile Long lastProcessedBlock;
    private volatile Long currentBlock;
    private volatile String lastError;
    private volatile Instant startedAt;

    public FeeIndexerPoller(EvmBlockHeightResolver blockHeightResolver,
                            FeeVaultScanner vaultScanner,
                            FeeDistributionStore distributionStore,
                            IndexerCursorStore cursorStore,
                            ProjectIdentityCache projectIdentityCache,
                            ContractProperties contractProperties,
                            IndexerProperties indexerProperties,
                            @Qualifier(SchedulerConfig.FEE_INDEXER_SCHEDULER) TaskScheduler scheduler,
                            @Qualifier(AsyncConfig.INDEXER_BACKFILL_EXECUTOR) Executor backfillExecutor) {
        this.blockHeightResolver = blockHeightResolver;
        this.vaultScanner = vaultScanner;
        this.distributionStore = distributionStore;
        this.cursorStore = cursorStore;
        this.projectIdentityCache = projectIdentityCache;
        this.contractProperties = contractProperties;
        this.indexerProperties = indexerProperties;
        this.scheduler = scheduler;
        this.backfillExecutor = backfillExecutor;
        this.retryDelay = new BackoffCounter(indexerProperties.getInitialRetryDelayMs(), indexerProperties.getMaxRetryDelayMs());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!indexerProperties.isEnabled()) {
            log.info("Fee indexer disabled (feetrail.indexer.enabled=false)");
            return;
        }
        start();
    }

    /**
     * @return true if polling was started by this call
     */
    public boolean start() {
        if (!contractProperties.hasVault()) {
            log.info("Fee indexer not started: no vault address configured");
            return false;
        }
        if (!running.compareAndSet(false, true)) {
            log.info("Fee indexer already running");
            return false;
        }
        startedAt = Instant.now();
        scheduledCycle = scheduler.scheduleWithFixedDelay(this::runCycle,
                Duration.ofMillis(Math.max(1L, indexerProperties.getPollIntervalMs())));
        log.info("Fee indexer started: vaults={} interval={}ms batch={} blocks",
                contractProperties.normalizedVaultAddresses(), indexerProperties.getPollIntervalMs(),
                indexerProperties.getBatchBlocks());
        return true;
    }

    /**
     * Cancels future cycles. A cycle already in progress runs to completion.
     */
    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledFuture<?> cycle = scheduledCycle;
        if (cycle != null) {
            cycle.cancel(false);
        }
        scheduledCycle = null;
        log.info("Fee indexer stopped at block {}", lastProcessedBlock);
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getLastError() {
        return lastError;
    }

    void runCycle() {
        try {
            catchUp();
            retryDelay.onSuccess();
            lastError = null;
        } catch (RpcException | DataAccessException e) {
            lastError = e.getMessage();
            long delay = retryDelay.onFailure();
            log.error("Fee indexer cycle failed (retry delay {} ms): {}", delay, e.getMessage());
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            long delay = retryDelay.onFailure();
            log.error("Fee indexer cycle failed unexpectedly (retry delay {} ms)", delay, e);
        }
    }

    /**
     * One poll cycle: head, project cache refresh + repair, cursor seed or scan of [cursor+1, head].
     *
     * @return number of new records stored
     */
    public long catchUp() {
        synchronized (scanLock) {
            long head = blockHeightResolver.getCurrentBlock();
            currentBlock = head;

            projectIdentityCache.refresh();
            projectIdentityCache.repairUnattributed();

            OptionalLong cursor = cursorStore.getCursor();
            if (cursor.isEmpty()) {
                long seed = indexerProperties.getStartBlock() > 0 ? indexerProperties.getStartBlock() - 1 : head - 1;
                cursorStore.setCursor(seed);
                lastProcessedBlock = seed;
                log.info("Fee indexer cursor seeded at block {} (head {})", seed, head);
                return 0;
            }
            lastProcessedBlock = cursor.getAsLong();
            if (cursor.getAsLong() >= head) {
                return 0;
            }
            return scanRange(cursor.getAsLong() + 1, head);
        }
    }

    /**
     * Re-scans [fromBlock, head]. Already stored records are skipped; the cursor only moves forward.
     *
     * @return number of new records stored
     */
    public long backfill(long fromBlock) {
        requireVault();
        synchronized (scanLock) {
            long head = blockHeightResolver.getCurrentBlock();
            currentBlock = head;
            projectIdentityCache.refresh();
            long from = Math.max(0L, fromBlock);
            log.info("Manual backfill {}-{}", from, head);
            long stored = scanRange(from, head);
            log.info("Manual backfill {}-{} done: {} new records", from, head, stored);
            return stored;
        }
    }

    /**
     * Runs {@link #backfill(long)} on the backfill executor. Fails fast when no vault is configured.
     */
    public CompletableFuture<Long> backfillAsync(long fromBlock) {
        requireVault();
        return CompletableFuture.supplyAsync(() -> backfill(fromBlock), backfillExecutor)
                .whenComplete((stored, e) -> {
                    if (e != null) {
                        log.error("Manual backfill from {} failed: {}", fromBlock, e.getMessage());
                    }
                });
    }

    private long scanRange(long from, long to) {
        List<String> vaults = contractProperties.normalizedVaultAddresses();
        long batch = Math.max(1L, indexerProperties.getBatchBlocks());
        long stored = 0;
        for (long start = from; start <= to; start += batch) {
            long end = Math.min(start + batch - 1, to);
            stored += storeAll(vaultScanner.scan(vaults, start, end));
            cursorStore.setCursor(end);
            Long previous = lastProcessedBlock;
            lastProcessedBlock = previous == null ? end : Math.max(previous, end);
            log.debug("Indexed blocks {}-{}", start, end);
        }
        if (stored > 0) {
            log.info("Indexed {} new fee events in blocks {}-{}", stored, from, to);
        }
        return stored;
    }

    private long storeAll(List<FeeDistribution> records) {
        long created = 0;
        for (FeeDistribution record : records) {
            record.setProjectId(projectIdentityCache.resolve(record.getPoolId()).orElse(null));
            if (distributionStore.insertIfAbsent(record)) {
                created++;
                eventsIndexed.incrementAndGet();
            }
        }
        return created;
    }

    private void requireVault() {
        if (!contractProperties.hasVault()) {
            throw new IllegalStateException("No fee vault address configured");
        }
    }

    /**
     * Status snapshot. Refreshes the chain head; keeps the last known head if that read fails.
     */
    public IndexerStatus getStatus() {
        try {
            currentBlock = blockHeightResolver.getCurrentBlock();
        } catch (RpcException e) {
            log.debug("Status head refresh failed: {}", e.getMessage());
        }
        Long processed = lastProcessedBlock;
        if (processed == null) {
            try {
                OptionalLong cursor = cursorStore.getCursor();
                processed = cursor.isPresent() ? cursor.getAsLong() : null;
            } catch (DataAccessException e) {
                log.debug("Status cursor read failed: {}", e.getMessage());
            }
        }
        Long head = currentBlock;
        Long lag = head != null && processed != null ? Math.max(0L, head - processed) : null;
        return new IndexerStatus(running.get(), processed, head, lag, lastError,
                eventsIndexed.get(), startedAt, retryDelay.currentDelayMs());
    }
}
