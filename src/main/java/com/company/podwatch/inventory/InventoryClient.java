package com.company.podwatch.inventory;

import com.company.podwatch.domain.NodeStats;
import com.company.podwatch.domain.ResourceKey;
import com.company.podwatch.domain.ResourceSnapshot;
import com.company.podwatch.domain.enums.ResourceKind;
import com.company.podwatch.exception.InventoryException;

import java.util.List;
import java.util.Set;

/**
 * Read (and minimal write) access to the cluster. Every method raises {@link InventoryException}
 * when the cluster cannot be reached or rejects the call.
 */
public interface InventoryClient {

    /**
     * Observes all resources of the given kinds. Pods are restricted to {@code namespaces}; nodes are
     * cluster scoped.
     */
    List<ResourceSnapshot> listResources(Set<ResourceKind> kinds, List<String> namespaces);

    /**
     * Allocatable and capacity figures plus pod counts for every node
     */
    List<NodeStats> collectNodeStats();

    /**
     * Deletes a pod so its controller recreates it
     *
     * @return false when the resource did not exist
     */
    boolean deleteResource(ResourceKey key);

    /**
     * Fails fast when the cluster API is unreachable
     *
     * @return server version
     */
    String verifyConnectivity();
}
