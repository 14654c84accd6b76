package com.company.podwatch.lifecycle;

import com.company.podwatch.cache.SnapshotStore;
import com.company.podwatch.domain.ResourceSnapshot;
import com.company.podwatch.exception.InventoryException;
import com.company.podwatch.inventory.InventoryClient;
import com.company.podwatch.service.HistoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Restores the baseline from persisted current state, so a restart does not report every resource as new,
 * and optionally refuses to start without a reachable cluster.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StartupRunner implements ApplicationRunner {

    private final HistoryStore historyStore;
    private final SnapshotStore snapshotStore;
    private final InventoryClient inventoryClient;

    @Value("${podwatch.startup.verify-inventory:false}")
    private boolean verifyInventory;

    @Override
    public void run(ApplicationArguments args) {
        List<ResourceSnapshot> persisted = historyStore.loadCurrentState();
        snapshotStore.seed(persisted);

        if (verifyInventory) {
            try {
                log.info("Connected to cluster version {}", inventoryClient.verifyConnectivity());
            } catch (InventoryException e) {
                throw new IllegalStateException("Cluster inventory unreachable at startup", e);
            }
        }
    }
}
