package com.feetrail.ingestion.project;

import com.feetrail.common.EvmHex;
import com.feetrail.domain.Project;
import com.feetrail.domain.ProjectRepository;
import com.feetrail.ingestion.store.FeeDistributionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * poolId to projectId mapping, rebuilt wholesale from the project registry each poll cycle.
 * Readers always see one complete map; a failed rebuild keeps the previous one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProjectIdentityCache {

    private final ProjectRepository projectRepository;
    private final FeeDistributionStore distributionStore;
    private final AtomicReference<Map<String, String>> poolToProject = new AtomicReference<>(Map.of());

    public void refresh() {
        try {
            Map<String, String> next = new HashMap<>();
            for (Project project : projectRepository.findByPoolIdIsNotNull()) {
                if (project.getPoolId() != null && !project.getPoolId().isBlank()) {
                    next.put(key(project.getPoolId()), project.getId());
                }
            }
            poolToProject.set(Map.copyOf(next));
            log.debug("Project identity cache refreshed: {} pools", next.size());
        } catch (DataAccessException e) {
            log.warn("Project registry unavailable, keeping {} cached pools: {}", poolToProject.get().size(), e.getMessage());
        }
    }

    public Optional<String> resolve(String poolId) {
        if (poolId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(poolToProject.get().get(key(poolId)));
    }

    public int size() {
        return poolToProject.get().size();
    }

    /**
     * Fills projectId on stored records whose pool became known after they were indexed.
     * Failures are logged per pool and never propagate.
     */
    public long repairUnattributed() {
        long repaired = 0;
        for (Map.Entry<String, String> entry : poolToProject.get().entrySet()) {
            try {
                repaired += distributionStore.updateProjectIdForPoolId(entry.getKey(), entry.getValue());
            } catch (DataAccessException e) {
                log.warn("projectId repair failed for pool {}: {}", EvmHex.abbreviate(entry.getKey()), e.getMessage());
            }
        }
        if (repaired > 0) {
            log.info("Attributed {} distribution records to projects", repaired);
        }
        return repaired;
    }

    private static String key(String poolId) {
        return poolId.toLowerCase(Locale.ROOT);
    }
}
