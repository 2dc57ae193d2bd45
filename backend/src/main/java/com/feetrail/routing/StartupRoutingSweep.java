package com.feetrail.routing;

import com.feetrail.common.EvmHex;
import com.feetrail.config.AsyncConfig;
import com.feetrail.domain.Project;
import com.feetrail.domain.ProjectRepository;
import com.feetrail.routing.config.RoutingProperties;
import com.feetrail.routing.contract.FeeRoutingContracts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * One-shot pass at boot: reconcile routing for every project with a pool and a verified owner.
 * Runs on its own executor; a failing project is logged and the sweep moves on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupRoutingSweep {

    public record SweepSummary(int assigned, int noop, int failed) {}

    private final ProjectRepository projectRepository;
    private final DevRoutingReconciler reconciler;
    private final FeeRoutingContracts contracts;
    private final RoutingProperties routingProperties;
    @Qualifier(AsyncConfig.ROUTING_SWEEP_EXECUTOR)
    private final Executor sweepExecutor;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!routingProperties.isStartupSweepEnabled()) {
            return;
        }
        if (!contracts.canSign()) {
            log.info("Startup routing sweep skipped: no administrative key configured");
            return;
        }
        sweepExecutor.execute(this::sweep);
    }

    public SweepSummary sweep() {
        List<Project> projects;
        try {
            projects = projectRepository.findByPoolIdIsNotNullAndOwnerWalletIsNotNull();
        } catch (DataAccessException e) {
            log.debug("Startup routing sweep skipped, store unavailable: {}", e.getMessage());
            return new SweepSummary(0, 0, 0);
        }
        log.info("Startup routing sweep: {} verified projects", projects.size());
        int assigned = 0;
        int noop = 0;
        int failed = 0;
        for (int i = 0; i < projects.size(); i++) {
            Project project = projects.get(i);
            if (i > 0 && !pause()) {
                log.info("Startup routing sweep interrupted after {} projects", i);
                break;
            }
            try {
                RoutingOutcome outcome = reconciler.reconcile(new RoutingRequest(
                        project.getPoolId(), project.getOwnerWallet(), project.getId(), project.getPoolTokenAddress()));
                if (outcome.escrowAction() == EscrowAction.NOOP) {
                    noop++;
                } else {
                    assigned++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Startup routing failed for project {} pool {}: {}",
                        project.getId(), EvmHex.abbreviate(project.getPoolId()), e.getMessage());
            }
        }
        log.info("Startup routing sweep done: {} assigned/reassigned, {} noop, {} failed", assigned, noop, failed);
        return new SweepSummary(assigned, noop, failed);
    }

    private boolean pause() {
        long delay = routingProperties.getSweepDelayMs();
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
