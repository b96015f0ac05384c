package ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing;

import ch.ethz.systems.clusterbench.core.log.SimulationLogger;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.NeighborRecord;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.NeighborTable;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.NodeState;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.Role;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.packet.DataUnitPacket;

import java.util.ArrayList;
import java.util.List;

/**
 * Data plane of a node: decides for every originated or received data unit
 * whether it is delivered locally, relayed along the role hierarchy, or dropped.
 *
 * Paths:
 * - Uplink: Members and Gateways send their own units to their Cluster Head.
 * - Backbone: a Cluster Head reaches a remote destination through a cached
 *   Gateway or by flooding copies to all of its Gateways; an outbound Gateway
 *   bridges to neighbors of foreign clusters, an inbound Gateway hands over
 *   to its own Cluster Head.
 * - Downlink: a Cluster Head unicasts directly to a destination in its 1-hop view.
 *
 * The router only decides; it never draws random numbers and never touches
 * the transport. The owning node executes the returned {@link RoutingDecision}.
 * Every relayed copy carries a time-to-live exactly one below the received one.
 */
public class DataPlaneRouter {

    /**
     * Sender identifier used when the transmitting address is not a known neighbor.
     */
    public static final int UNKNOWN_SENDER = -1;

    private final NodeState state;
    private final NeighborTable neighborTable;
    private final RouteCache routeCache;
    private final DedupSet dedupSet;
    private final DataPlaneStatistics statistics;

    public DataPlaneRouter(NodeState state, NeighborTable neighborTable, RouteCache routeCache,
                           DedupSet dedupSet, DataPlaneStatistics statistics) {
        this.state = state;
        this.neighborTable = neighborTable;
        this.routeCache = routeCache;
        this.dedupSet = dedupSet;
        this.statistics = statistics;
    }

    // =========================================================================
    // RECEIVE SIDE
    // =========================================================================

    /**
     * Decide what to do with a data unit that arrived from the medium.
     *
     * @param unit              Received data unit
     * @param senderNeighborId  Identifier of the transmitting neighbor, or {@link #UNKNOWN_SENDER}
     * @param nowNs             Current virtual time
     *
     * @return Routing decision
     */
    public RoutingDecision onReceive(DataUnitPacket unit, int senderNeighborId, long nowNs) {

        // 1. Route learning (Cluster Head overhears a unit relayed by one of its Gateways)
        if (state.getRole() == Role.CLUSTER_HEAD
                && senderNeighborId != UNKNOWN_SENDER
                && neighborTable.isGateway(senderNeighborId)) {
            routeCache.learn(unit.getSourceId(), senderNeighborId);
            statistics.recordRouteLearned();
        }

        // 2. Addressing filter
        if (unit.hasExplicitNextHop() && unit.getExplicitNextHopId() != state.getId()) {
            return drop(unit, DropReason.ADDRESSING_MISS);
        }

        // 3. Duplicate filter
        if (dedupSet.contains(unit.getSourceId(), unit.getSequenceNumber())) {
            if (!isOwnUnitBackFromClusterHead(unit, senderNeighborId)) {
                return drop(unit, DropReason.DUPLICATE);
            }
            statistics.recordReadmittedEcho();
        } else {
            dedupSet.add(unit.getSourceId(), unit.getSequenceNumber());
        }

        // 4. Delivery
        if (unit.getDestinationId() == state.getId()) {
            statistics.recordDelivered(nowNs - unit.getCreationTimeNs());
            return RoutingDecision.deliver(unit);
        }

        // 5. Members (and Undecided nodes) never relay
        if (state.getRole() == Role.MEMBER || state.getRole() == Role.UNDECIDED) {
            return drop(unit, DropReason.NOT_A_FORWARDER);
        }

        // 6. Hop budget
        if (unit.getTimeToLive() <= 0) {
            return drop(unit, DropReason.TTL_EXPIRED);
        }

        // 7. Role-dependent forwarding
        DataUnitPacket relayed = unit.forwardCopy();
        if (state.getRole() == Role.CLUSTER_HEAD) {
            return routeFromClusterHead(relayed);
        } else {
            return relayFromGateway(relayed, senderNeighborId);
        }

    }

    /**
     * The single re-admission case of the duplicate filter: a Gateway's own unit
     * coming back from its own Cluster Head must be bridged outward.
     */
    private boolean isOwnUnitBackFromClusterHead(DataUnitPacket unit, int senderNeighborId) {
        return unit.getSourceId() == state.getId()
                && state.getRole() == Role.GATEWAY
                && senderNeighborId != UNKNOWN_SENDER
                && senderNeighborId == state.getClusterId();
    }

    // =========================================================================
    // SEND SIDE
    // =========================================================================

    /**
     * Decide how to send a data unit this node originates.
     *
     * @param unit      Freshly created data unit (explicit next hop unset)
     * @param nowNs     Current virtual time
     *
     * @return Routing decision
     */
    public RoutingDecision onOriginate(DataUnitPacket unit, long nowNs) {
        statistics.recordOriginated();
        dedupSet.add(unit.getSourceId(), unit.getSequenceNumber());

        if (unit.getDestinationId() == state.getId()) {
            statistics.recordDelivered(nowNs - unit.getCreationTimeNs());
            return RoutingDecision.deliver(unit);
        }

        switch (state.getRole()) {
            case CLUSTER_HEAD:
                return routeFromClusterHead(unit);
            case MEMBER:
            case GATEWAY:
                return uplink(unit);
            case UNDECIDED:
            default:
                return drop(unit, DropReason.ORPHANED);
        }
    }

    // =========================================================================
    // ROLE-DEPENDENT FORWARDING
    // =========================================================================

    private RoutingDecision uplink(DataUnitPacket unit) {
        int clusterHeadId = state.getClusterId();
        if (!neighborTable.contains(clusterHeadId)) {
            return drop(unit, DropReason.ORPHANED);
        }
        return forward(unit, single(clusterHeadId, Transmission.Delivery.IMMEDIATE_UNICAST));
    }

    private RoutingDecision routeFromClusterHead(DataUnitPacket unit) {
        int destinationId = unit.getDestinationId();

        // Downlink to a 1-hop neighbor
        if (neighborTable.contains(destinationId)) {
            return forward(unit, single(destinationId, Transmission.Delivery.IMMEDIATE_UNICAST));
        }

        // Cached backbone hint
        if (routeCache.contains(destinationId)) {
            int gatewayId = routeCache.lookupValidGateway(destinationId, neighborTable);
            if (gatewayId != RouteCache.NO_ROUTE) {
                return forward(unit, single(gatewayId, Transmission.Delivery.DEFERRED_UNICAST));
            }
            statistics.recordStaleRouteEvicted();
            SimulationLogger.logWarning("GCC_STALE_ROUTE_EVICTED",
                    "Node=" + state.getId() + ",Destination=" + destinationId);
        }

        // Flood to every Gateway
        List<Transmission> transmissions = new ArrayList<>();
        for (int gatewayId : neighborTable.getGatewayIds()) {
            transmissions.add(new Transmission(gatewayId, Transmission.Delivery.DEFERRED_MULTICAST));
        }
        if (transmissions.isEmpty()) {
            return drop(unit, DropReason.NO_ROUTE);
        }
        return forward(unit, transmissions);
    }

    private RoutingDecision relayFromGateway(DataUnitPacket unit, int senderNeighborId) {
        int clusterHeadId = state.getClusterId();

        if (senderNeighborId != UNKNOWN_SENDER && senderNeighborId == clusterHeadId) {

            // Outbound: bridge to the backbone of every foreign cluster in range.
            // Unicast, so that the own Cluster Head never overhears the copies.
            List<Transmission> transmissions = new ArrayList<>();
            for (NeighborRecord record : neighborTable.snapshot()) {
                if (record.getClusterId() != NodeState.NO_CLUSTER
                        && record.getClusterId() != clusterHeadId
                        && record.getRole().isBackbone()) {
                    transmissions.add(new Transmission(record.getNeighborId(),
                            Transmission.Delivery.DEFERRED_UNICAST));
                }
            }
            if (transmissions.isEmpty()) {
                return drop(unit, DropReason.NO_ROUTE);
            }
            return forward(unit, transmissions);

        } else {

            // Inbound: hand over to the own Cluster Head
            if (!neighborTable.contains(clusterHeadId)) {
                return drop(unit, DropReason.ORPHANED);
            }
            return forward(unit, single(clusterHeadId, Transmission.Delivery.IMMEDIATE_UNICAST));

        }
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private RoutingDecision forward(DataUnitPacket unit, List<Transmission> transmissions) {
        statistics.recordForwarded(transmissions.size());
        return RoutingDecision.forward(unit, transmissions);
    }

    private RoutingDecision drop(DataUnitPacket unit, DropReason reason) {
        statistics.recordDrop(reason);
        return RoutingDecision.drop(unit, reason);
    }

    private static List<Transmission> single(int targetNeighborId, Transmission.Delivery delivery) {
        List<Transmission> transmissions = new ArrayList<>(1);
        transmissions.add(new Transmission(targetNeighborId, delivery));
        return transmissions;
    }

    public RouteCache getRouteCache() {
        return routeCache;
    }

    public DedupSet getDedupSet() {
        return dedupSet;
    }

    public DataPlaneStatistics getStatistics() {
        return statistics;
    }

}
