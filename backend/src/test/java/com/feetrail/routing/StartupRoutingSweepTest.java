package com.feetrail.routing;

import com.feetrail.domain.Project;
import com.feetrail.domain.ProjectRepository;
import com.feetrail.routing.config.RoutingProperties;
import com.feetrail.routing.contract.FeeRoutingContracts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StartupRoutingSweepTest {

    @Mock
    private ProjectRepository projectRepository;
    @Mock
    private DevRoutingReconciler reconciler;
    @Mock
    private FeeRoutingContracts contracts;

    private RoutingProperties routingProperties;
    private StartupRoutingSweep sweep;

    @BeforeEach
    void setUp() {
        routingProperties = new RoutingProperties();
        routingProperties.setSweepDelayMs(0);
        sweep = new StartupRoutingSweep(projectRepository, reconciler, contracts, routingProperties, Runnable::run);
    }

    @Test
    void sweep_countsOutcomes_andContinuesPastFailures() {
        Project a = project("a", "0x" + "0a".repeat(32));
        Project b = project("b", "0x" + "0b".repeat(32));
        Project c = project("c", "0x" + "0c".repeat(32));
        when(projectRepository.findByPoolIdIsNotNullAndOwnerWalletIsNotNull()).thenReturn(List.of(a, b, c));
        when(reconciler.reconcile(new RoutingRequest(a.getPoolId(), a.getOwnerWallet(), "a", null)))
                .thenReturn(new RoutingOutcome(false, false, false, EscrowAction.ASSIGNED));
        when(reconciler.reconcile(new RoutingRequest(b.getPoolId(), b.getOwnerWallet(), "b", null)))
                .thenThrow(new RoutingException("assignDev failed", null));
        when(reconciler.reconcile(new RoutingRequest(c.getPoolId(), c.getOwnerWallet(), "c", null)))
                .thenReturn(RoutingOutcome.noop());

        StartupRoutingSweep.SweepSummary summary = sweep.sweep();

        assertThat(summary).isEqualTo(new StartupRoutingSweep.SweepSummary(1, 1, 1));
    }

    @Test
    void sweep_storeUnavailable_returnsEmptySummary() {
        when(projectRepository.findByPoolIdIsNotNullAndOwnerWalletIsNotNull())
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThat(sweep.sweep()).isEqualTo(new StartupRoutingSweep.SweepSummary(0, 0, 0));
        verifyNoInteractions(reconciler);
    }

    @Test
    void onApplicationReady_withoutKey_skipsSweep() {
        when(contracts.canSign()).thenReturn(false);

        sweep.onApplicationReady();

        verifyNoInteractions(projectRepository);
    }

    @Test
    void onApplicationReady_disabled_skipsSweep() {
        routingProperties.setStartupSweepEnabled(false);

        sweep.onApplicationReady();

        verifyNoInteractions(projectRepository, contracts);
    }

    @Test
    void onApplicationReady_runsSweepOnExecutor() {
        when(contracts.canSign()).thenReturn(true);
        when(projectRepository.findByPoolIdIsNotNullAndOwnerWalletIsNotNull()).thenReturn(List.of());

        sweep.onApplicationReady();

        verify(projectRepository).findByPoolIdIsNotNullAndOwnerWalletIsNotNull();
        verify(reconciler, never()).reconcile(any());
    }

    private static Project project(String id, String poolId) {
        Project project = new Project();
        project.setId(id);
        project.setPoolId(poolId);
        project.setOwnerWallet("0x" + "11".repeat(20));
        return project;
    }
}
