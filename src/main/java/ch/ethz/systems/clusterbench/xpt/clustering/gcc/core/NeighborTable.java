package ch.ethz.systems.clusterbench.xpt.clustering.gcc.core;

import ch.ethz.systems.clusterbench.core.network.NetworkAddress;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-node table of 1-hop neighbors, keyed by neighbor identifier.
 *
 * Iteration is always in ascending neighbor identifier order, so every
 * "smallest id" scan over the table is reproducible.
 */
public class NeighborTable {

    private final TreeMap<Integer, NeighborRecord> neighbors;

    public NeighborTable() {
        this.neighbors = new TreeMap<>();
    }

    /**
     * Insert or overwrite the record of a neighbor with the freshest observation.
     *
     * @param record    Neighbor record
     */
    public void upsert(NeighborRecord record) {
        neighbors.put(record.getNeighborId(), record);
    }

    /**
     * Remove every neighbor which has not been heard for more than the timeout.
     *
     * @param nowNs         Current virtual time
     * @param timeoutNs     Staleness threshold
     *
     * @return True iff at least one neighbor was removed
     */
    public boolean pruneStale(long nowNs, long timeoutNs) {
        return !removeStale(nowNs, timeoutNs).isEmpty();
    }

    /**
     * Remove every neighbor which has not been heard for more than the timeout.
     *
     * @param nowNs         Current virtual time
     * @param timeoutNs     Staleness threshold
     *
     * @return Identifiers of the removed neighbors, ascending
     */
    public List<Integer> removeStale(long nowNs, long timeoutNs) {
        List<Integer> removed = new ArrayList<>();
        Iterator<Map.Entry<Integer, NeighborRecord>> it = neighbors.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Integer, NeighborRecord> entry = it.next();
            if (entry.getValue().isStale(nowNs, timeoutNs)) {
                removed.add(entry.getKey());
                it.remove();
            }
        }
        return removed;
    }

    public NeighborRecord get(int neighborId) {
        return neighbors.get(neighborId);
    }

    public boolean contains(int neighborId) {
        return neighbors.containsKey(neighborId);
    }

    /**
     * Find the neighbor which owns a transport address.
     *
     * @param address   Transport address
     *
     * @return Neighbor record, or null if no known neighbor has that address
     */
    public NeighborRecord findByAddress(NetworkAddress address) {
        for (NeighborRecord record : neighbors.values()) {
            if (record.getAddress() != null && record.getAddress().equals(address)) {
                return record;
            }
        }
        return null;
    }

    /**
     * @param neighborId    Neighbor identifier
     *
     * @return True iff the neighbor is known and currently advertises the role Gateway
     */
    public boolean isGateway(int neighborId) {
        NeighborRecord record = neighbors.get(neighborId);
        return record != null && record.getRole() == Role.GATEWAY;
    }

    /**
     * @return Identifiers of all neighbors advertising the role Gateway, ascending
     */
    public List<Integer> getGatewayIds() {
        List<Integer> gateways = new ArrayList<>();
        for (NeighborRecord record : neighbors.values()) {
            if (record.getRole() == Role.GATEWAY) {
                gateways.add(record.getNeighborId());
            }
        }
        return gateways;
    }

    /**
     * @return Read-only view of all records in ascending identifier order
     */
    public Collection<NeighborRecord> snapshot() {
        return Collections.unmodifiableCollection(neighbors.values());
    }

    public int size() {
        return neighbors.size();
    }

    public boolean isEmpty() {
        return neighbors.isEmpty();
    }

    @Override
    public String toString() {
        return "NeighborTable" + neighbors.values();
    }

}
