package ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing;

import java.util.EnumMap;
import java.util.Map;

/**
 * Data plane counters of one node.
 */
public class DataPlaneStatistics {

    private long originated;
    private long delivered;
    private long totalDeliveryLatencyNs;
    private long forwardedTransmissions;
    private long readmittedEchoes;
    private long routesLearned;
    private long staleRoutesEvicted;
    private final Map<DropReason, Long> drops;

    public DataPlaneStatistics() {
        this.drops = new EnumMap<>(DropReason.class);
    }

    void recordOriginated() {
        originated++;
    }

    void recordDelivered(long latencyNs) {
        delivered++;
        totalDeliveryLatencyNs += latencyNs;
    }

    void recordForwarded(int transmissions) {
        forwardedTransmissions += transmissions;
    }

    void recordReadmittedEcho() {
        readmittedEchoes++;
    }

    void recordRouteLearned() {
        routesLearned++;
    }

    void recordStaleRouteEvicted() {
        staleRoutesEvicted++;
    }

    /**
     * Count a dropped unit.
     *
     * @param reason    Drop reason
     */
    public void recordDrop(DropReason reason) {
        drops.merge(reason, 1L, Long::sum);
    }

    public long getOriginated() {
        return originated;
    }

    public long getDelivered() {
        return delivered;
    }

    /**
     * @return Mean latency from creation to delivery, or 0 if nothing was delivered
     */
    public double getMeanDeliveryLatencyNs() {
        return delivered == 0 ? 0.0 : (double) totalDeliveryLatencyNs / delivered;
    }

    public long getForwardedTransmissions() {
        return forwardedTransmissions;
    }

    public long getReadmittedEchoes() {
        return readmittedEchoes;
    }

    public long getRoutesLearned() {
        return routesLearned;
    }

    public long getStaleRoutesEvicted() {
        return staleRoutesEvicted;
    }

    public long getDrops(DropReason reason) {
        return drops.getOrDefault(reason, 0L);
    }

    public long getTotalDrops() {
        long total = 0;
        for (long count : drops.values()) {
            total += count;
        }
        return total;
    }

    @Override
    public String toString() {
        return "DataPlaneStatistics{originated=" + originated + ", delivered=" + delivered
                + ", forwarded=" + forwardedTransmissions + ", readmitted=" + readmittedEchoes
                + ", routesLearned=" + routesLearned + ", staleRoutesEvicted=" + staleRoutesEvicted
                + ", drops=" + drops + "}";
    }

}
