package ch.ethz.systems.clusterbench.xpt.clustering.gcc.node;

import ch.ethz.systems.clusterbench.core.log.SimulationLogger;
import ch.ethz.systems.clusterbench.core.network.NetworkAddress;
import ch.ethz.systems.clusterbench.core.network.Packet;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.ColoringEngine;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.NeighborRecord;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.NeighborTable;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.NodeState;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.Role;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.RoleAssignment;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.RoleResolver;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.IDestinationSelector;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.IPacketReceiver;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.IScheduler;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.ITransport;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.packet.AdvertisementPacket;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.packet.DataUnitPacket;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.packet.GccPacket;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing.DataPlaneRouter;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing.DataPlaneStatistics;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing.DedupSet;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing.DropReason;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing.RouteCache;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing.RoutingDecision;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing.Transmission;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * A node running graph-coloring clustering.
 *
 * The node is a single-threaded reactive actor: the scheduler calls
 * {@link #onTimer(TimerKind)} and the transport calls
 * {@link #onMessage(Packet, NetworkAddress)}, one at a time. It never blocks;
 * every delay (periodic timers, jittered sends) is an event registered with
 * the scheduler. All protocol state is owned by this node alone.
 *
 * Activities:
 * - Advertisement: multicast own color, role and cluster to all neighbors.
 * - Maintenance: evict stale neighbors, recolor, resolve the role.
 * - Data generation: originate a data unit towards a selected destination.
 * - Reception: advertisements update the neighbor table and the role,
 *   data units go through the {@link DataPlaneRouter}.
 *
 * Randomness is only used for scheduling jitter.
 */
public class GraphColoringNode implements IPacketReceiver {

    // =========================================================================
    // COLLABORATORS
    // =========================================================================

    private final GccParameters parameters;
    private final IScheduler scheduler;
    private final ITransport transport;
    private final Random random;
    private final IDestinationSelector destinationSelector;

    // =========================================================================
    // PROTOCOL STATE
    // =========================================================================

    private final NodeState state;
    private final NeighborTable neighborTable;
    private final ColoringEngine coloringEngine;
    private final RoleResolver roleResolver;
    private final DataPlaneRouter router;
    private final DataPlaneStatistics statistics;

    /** Events registered by this node which have not fired yet */
    private final Set<NodeEvent> pendingEvents;

    private boolean running;
    private long demotions;

    /**
     * Create a node. It does nothing until {@link #start()} is called.
     *
     * @param nodeId                Stable node identifier
     * @param parameters            Validated protocol parameters
     * @param scheduler             Clock and timer service
     * @param transport             Packet delivery service
     * @param random                Source of scheduling jitter
     * @param destinationSelector   Destination chooser for synthetic data (null: no data generation)
     */
    public GraphColoringNode(int nodeId, GccParameters parameters, IScheduler scheduler, ITransport transport,
                             Random random, IDestinationSelector destinationSelector) {
        this.parameters = parameters;
        this.scheduler = scheduler;
        this.transport = transport;
        this.random = random;
        this.destinationSelector = destinationSelector;

        this.state = new NodeState(nodeId);
        this.neighborTable = new NeighborTable();
        this.coloringEngine = new ColoringEngine();
        this.roleResolver = new RoleResolver();
        this.statistics = new DataPlaneStatistics();
        this.router = new DataPlaneRouter(state, neighborTable, new RouteCache(),
                new DedupSet(parameters.getDedupCapacity()), statistics);

        this.pendingEvents = new LinkedHashSet<>();
        this.running = false;
        this.demotions = 0;
    }

    // =========================================================================
    // LIFECYCLE
    // =========================================================================

    /**
     * Attach to the transport and schedule the first firing of every timer.
     */
    public void start() {
        if (running) {
            throw new IllegalStateException("Node " + state.getId() + " is already running");
        }
        running = true;
        transport.setReceiver(this);

        if (parameters.getHelloIntervalNs() > 0) {
            scheduleTimer(TimerKind.ADVERTISEMENT, uniform(parameters.getHelloJitterNs()));
        }
        scheduleTimer(TimerKind.INITIAL_COLORING,
                parameters.getColoringIntervalNs() + uniform(parameters.getColoringJitterNs()));
        scheduleTimer(TimerKind.MAINTENANCE, parameters.getMaintenanceIntervalNs());
        if (parameters.getDataIntervalNs() > 0 && destinationSelector != null) {
            scheduleTimer(TimerKind.DATA_GENERATION,
                    parameters.getDataIntervalNs() + uniform(parameters.getDataJitterNs()));
        }

        SimulationLogger.logInfo("GCC_NODE_STARTED",
                "Node=" + state.getId() + ",Address=" + transport.getLocalAddress() + ",Time=" + scheduler.now());
    }

    /**
     * Cancel every pending timer and deferred send, and detach from the transport.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        for (NodeEvent event : pendingEvents) {
            event.cancel();
        }
        int cancelled = pendingEvents.size();
        pendingEvents.clear();
        transport.close();

        SimulationLogger.logInfo("GCC_NODE_STOPPED",
                "Node=" + state.getId() + ",CancelledEvents=" + cancelled + ",Time=" + scheduler.now());
    }

    // =========================================================================
    // TIMERS
    // =========================================================================

    /**
     * Handle the firing of a self-timer. Periodic timers reschedule themselves.
     *
     * @param kind  Timer kind
     */
    public void onTimer(TimerKind kind) {
        if (!running) {
            return;
        }
        switch (kind) {
            case ADVERTISEMENT:
                handleAdvertisementTimer();
                break;
            case INITIAL_COLORING:
                recolor();
                resolveRole();
                break;
            case MAINTENANCE:
                handleMaintenanceTimer();
                break;
            case DATA_GENERATION:
                handleDataGenerationTimer();
                break;
            default:
                throw new IllegalArgumentException("Unknown timer kind: " + kind);
        }
    }

    private void handleAdvertisementTimer() {
        AdvertisementPacket advertisement = new AdvertisementPacket(
                state.getId(), state.getColor(), state.getRole(), state.getClusterId());
        transport.sendMulticast(advertisement, NetworkAddress.ALL_NODES, parameters.getDestPort());
        scheduleTimer(TimerKind.ADVERTISEMENT, parameters.getHelloIntervalNs() + uniform(parameters.getHelloJitterNs()));
    }

    private void handleMaintenanceTimer() {
        List<Integer> evicted = neighborTable.removeStale(scheduler.now(), parameters.getNeighborTimeoutNs());
        for (int neighborId : evicted) {
            SimulationLogger.logInfo("GCC_NEIGHBOR_EVICTED",
                    "Node=" + state.getId() + ",Neighbor=" + neighborId + ",Time=" + scheduler.now());
        }

        // Recomputed whether or not anything was evicted
        recolor();
        resolveRole();

        scheduleTimer(TimerKind.MAINTENANCE, parameters.getMaintenanceIntervalNs());
    }

    private void handleDataGenerationTimer() {
        int destinationId = destinationSelector.selectDestination(state.getId());
        if (destinationId != IDestinationSelector.NO_DESTINATION) {
            originate(destinationId);
        }
        scheduleTimer(TimerKind.DATA_GENERATION, parameters.getDataIntervalNs() + uniform(parameters.getDataJitterNs()));
    }

    // =========================================================================
    // COLORING AND ROLES
    // =========================================================================

    private void recolor() {
        int oldColor = state.getColor();
        int newColor = coloringEngine.computeColor(state.getId(), oldColor, neighborTable);
        if (newColor != oldColor) {
            SimulationLogger.logInfo("GCC_COLOR_CHANGE",
                    "Node=" + state.getId() + ",OldColor=" + oldColor + ",NewColor=" + newColor
                            + ",Time=" + scheduler.now());
            state.setColor(newColor);
        }
    }

    private void resolveRole() {
        Role oldRole = state.getRole();
        RoleAssignment assignment = roleResolver.resolve(state.getId(), state.getColor(), neighborTable);
        if (assignment.isDemotion()) {
            demotions++;
            SimulationLogger.logInfo("GCC_UNDECIDED_DEMOTION",
                    "Node=" + state.getId() + ",OldColor=" + state.getColor() + ",Time=" + scheduler.now());
        }
        if (state.apply(assignment)) {
            SimulationLogger.logRoleChange(state.getId(), oldRole.name(), assignment.getRole().name(),
                    assignment.getColor(), assignment.getClusterId(), scheduler.now());
        }
    }

    // =========================================================================
    // RECEPTION
    // =========================================================================

    @Override
    public void onDataArrived(Packet packet, NetworkAddress senderAddress) {
        onMessage(packet, senderAddress);
    }

    /**
     * Handle a packet from the medium.
     *
     * @param packet            Received packet
     * @param senderAddress     Transport address of the transmitting node
     */
    public void onMessage(Packet packet, NetworkAddress senderAddress) {
        if (!running) {
            return;
        }
        if (!(packet instanceof GccPacket)) {
            SimulationLogger.logWarning("GCC_UNKNOWN_PACKET",
                    "Node=" + state.getId() + ",Type=" + packet.getClass().getSimpleName()
                            + ",Sender=" + senderAddress + ",Time=" + scheduler.now());
            return;
        }
        GccPacket gccPacket = (GccPacket) packet;
        switch (gccPacket.getKind()) {
            case ADVERTISEMENT:
                handleAdvertisement((AdvertisementPacket) gccPacket, senderAddress);
                break;
            case DATA_UNIT:
                handleDataUnit((DataUnitPacket) gccPacket, senderAddress);
                break;
            default:
                throw new IllegalArgumentException("Unknown packet kind: " + gccPacket.getKind());
        }
    }

    private void handleAdvertisement(AdvertisementPacket advertisement, NetworkAddress senderAddress) {
        if (advertisement.getSenderId() == state.getId()) {
            return;
        }
        neighborTable.upsert(new NeighborRecord(
                advertisement.getSenderId(),
                senderAddress,
                advertisement.getColor(),
                advertisement.getRole(),
                advertisement.getClusterId(),
                scheduler.now()
        ));
        resolveRole();
    }

    private void handleDataUnit(DataUnitPacket unit, NetworkAddress senderAddress) {
        NeighborRecord sender = neighborTable.findByAddress(senderAddress);
        int senderId = sender == null ? DataPlaneRouter.UNKNOWN_SENDER : sender.getNeighborId();
        execute(router.onReceive(unit, senderId, scheduler.now()));
    }

    // =========================================================================
    // DATA PLANE
    // =========================================================================

    /**
     * Originate a data unit.
     *
     * @param destinationId     Destination node identifier
     *
     * @return Decision the router took for the new unit
     */
    public RoutingDecision originate(int destinationId) {
        DataUnitPacket unit = new DataUnitPacket(
                state.getId(),
                state.nextSequenceNumber(),
                parameters.getDataTtl(),
                destinationId,
                DataUnitPacket.NO_NEXT_HOP,
                scheduler.now()
        );
        RoutingDecision decision = router.onOriginate(unit, scheduler.now());
        execute(decision);
        return decision;
    }

    private void execute(RoutingDecision decision) {
        DataUnitPacket unit = decision.getUnit();
        switch (decision.getOutcome()) {
            case DELIVER:
                SimulationLogger.logDataDelivery(state.getId(), unit.getSourceId(), unit.getSequenceNumber(),
                        unit.getCreationTimeNs(), scheduler.now(), unit.getTimeToLive());
                break;
            case DROP:
                if (!decision.getDropReason().isSilent()) {
                    SimulationLogger.logWarning("GCC_DATA_DROPPED",
                            "Node=" + state.getId() + ",Role=" + state.getRole() + ",Reason=" + decision.getDropReason()
                                    + ",Source=" + unit.getSourceId() + ",Sequence=" + unit.getSequenceNumber()
                                    + ",Destination=" + unit.getDestinationId() + ",Time=" + scheduler.now());
                }
                break;
            case FORWARD:
                for (Transmission transmission : decision.getTransmissions()) {
                    DataUnitPacket copy = unit.withNextHop(transmission.getTargetNeighborId());
                    if (transmission.isDeferred()) {
                        schedule(new DelayedForwardEvent(scheduler.now() + uniform(parameters.getForwardJitterNs()),
                                this, copy, transmission));
                    } else {
                        transmit(copy, transmission);
                    }
                }
                break;
            default:
                throw new IllegalStateException("Unknown routing outcome: " + decision.getOutcome());
        }
    }

    /**
     * Put a data unit copy on the medium. The target neighbor must still be in
     * the table; otherwise the copy is dropped and not retried.
     */
    void transmit(DataUnitPacket copy, Transmission transmission) {
        if (!running) {
            return;
        }
        NeighborRecord target = neighborTable.get(transmission.getTargetNeighborId());
        if (target == null) {
            statistics.recordDrop(DropReason.VANISHED_NEIGHBOR);
            SimulationLogger.logWarning("GCC_DATA_DROPPED",
                    "Node=" + state.getId() + ",Reason=" + DropReason.VANISHED_NEIGHBOR
                            + ",Target=" + transmission.getTargetNeighborId()
                            + ",Source=" + copy.getSourceId() + ",Sequence=" + copy.getSequenceNumber()
                            + ",Time=" + scheduler.now());
            return;
        }
        if (transmission.isMulticast()) {
            transport.sendMulticast(copy, NetworkAddress.ALL_NODES, parameters.getDestPort());
        } else {
            transport.sendUnicast(copy, target.getAddress(), parameters.getDestPort());
        }
    }

    // =========================================================================
    // SCHEDULING
    // =========================================================================

    private void scheduleTimer(TimerKind kind, long delayNs) {
        schedule(new NodeTimerEvent(scheduler.now() + delayNs, this, kind));
    }

    private void schedule(NodeEvent event) {
        pendingEvents.add(event);
        scheduler.scheduleAt(event);
    }

    void onEventFired(NodeEvent event) {
        pendingEvents.remove(event);
    }

    private long uniform(long maxNs) {
        if (maxNs <= 0) {
            return 0;
        }
        return (long) (random.nextDouble() * maxNs);
    }

    // =========================================================================
    // STATE QUERIES
    // =========================================================================

    public int getId() {
        return state.getId();
    }

    public NodeState getState() {
        return state;
    }

    public NeighborTable getNeighborTable() {
        return neighborTable;
    }

    public DataPlaneRouter getRouter() {
        return router;
    }

    public DataPlaneStatistics getStatistics() {
        return statistics;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return Number of Undecided demotions (color resets) so far
     */
    public long getDemotionCount() {
        return demotions;
    }

    /**
     * @return Snapshot of the events still pending (for inspection)
     */
    List<NodeEvent> getPendingEvents() {
        return new ArrayList<>(pendingEvents);
    }

    @Override
    public String toString() {
        return "GraphColoringNode{" + state + ", neighbors=" + neighborTable.size() + "}";
    }

}
