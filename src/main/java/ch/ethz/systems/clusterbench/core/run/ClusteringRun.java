package ch.ethz.systems.clusterbench.core.run;

import ch.ethz.systems.clusterbench.core.Simulator;
import ch.ethz.systems.clusterbench.core.config.NBProperties;
import ch.ethz.systems.clusterbench.core.config.exceptions.PropertyValueInvalidException;
import ch.ethz.systems.clusterbench.core.log.SimulationLogger;
import ch.ethz.systems.clusterbench.core.run.churn.NodeFailureEvent;
import ch.ethz.systems.clusterbench.core.run.topology.Topology;
import ch.ethz.systems.clusterbench.ext.wireless.WirelessMedium;
import ch.ethz.systems.clusterbench.ext.wireless.WirelessTransportLayer;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.ColoringEngine;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.NodeState;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.core.Role;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.IDestinationSelector;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.node.GccParameters;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.node.GraphColoringNode;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.node.SimulatorScheduler;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.routing.DataPlaneStatistics;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A complete clustering experiment: simulator, wireless medium, one
 * {@link GraphColoringNode} per topology node and the scheduled failures.
 *
 * Usage: construct from the configuration, call {@link #run()}, then
 * inspect the nodes or the check methods.
 */
public class ClusteringRun {

    private final NBProperties configuration;
    private final Simulator simulator;
    private final GccParameters parameters;
    private final Topology topology;
    private final WirelessMedium medium;
    private final Map<Integer, GraphColoringNode> nodes;
    private final List<NodeFailureEvent> failures;
    private final long runTimeNs;

    private boolean finished;

    public ClusteringRun(NBProperties configuration) {
        this.configuration = configuration;

        long seed = configuration.getLongPropertyWithDefault("seed", 0L);
        this.runTimeNs = configuration.getLongPropertyOrFail("run_time_ns");
        if (runTimeNs <= 0) {
            throw new PropertyValueInvalidException(configuration, "run_time_ns", "must be > 0");
        }
        SimulationLogger.logInfo("Seed", String.valueOf(seed));
        SimulationLogger.logInfo("Run time (ns)", String.valueOf(runTimeNs));

        this.simulator = new Simulator(seed, configuration);
        this.parameters = GccParameters.fromConfiguration(configuration);
        this.topology = InfrastructureSelector.selectTopology(configuration, simulator);
        this.medium = InfrastructureSelector.selectMedium(configuration, simulator);

        // Nodes
        TreeMap<Integer, GraphColoringNode> nodeMap = new TreeMap<>();
        for (int id = 0; id < topology.getNumNodes(); id++) {
            nodeMap.put(id, null);
        }
        IDestinationSelector destinationSelector = parameters.getDataIntervalNs() > 0
                ? InfrastructureSelector.selectDestinationSelector(configuration, simulator, nodeMap.keySet())
                : null;
        SimulatorScheduler scheduler = new SimulatorScheduler(simulator);
        for (int id = 0; id < topology.getNumNodes(); id++) {
            WirelessTransportLayer transport = medium.attach(id, parameters.getLocalPort());
            nodeMap.put(id, new GraphColoringNode(id, parameters, scheduler, transport,
                    simulator.selectIndependentRandom("gcc_node_" + id), destinationSelector));
        }
        this.nodes = Collections.unmodifiableMap(nodeMap);

        // Links
        for (int[] edge : topology.getEdges()) {
            medium.connect(edge[0], edge[1]);
        }

        this.failures = InfrastructureSelector.selectNodeFailures(configuration, nodes);
        this.finished = false;
    }

    /**
     * Start all nodes, run for the configured time and log the outcome.
     */
    public void run() {
        if (finished) {
            throw new IllegalStateException("A clustering run can only be executed once");
        }

        for (GraphColoringNode node : nodes.values()) {
            node.start();
        }
        for (NodeFailureEvent failure : failures) {
            simulator.registerEvent(failure);
        }

        SimulationLogger.logInfo("RUN_STARTED", "Nodes=" + nodes.size() + ",Edges=" + topology.getNumEdges());
        long startTime = System.currentTimeMillis();
        simulator.runNs(runTimeNs);
        SimulationLogger.logInfo("RUN_FINISHED", "WallTimeMs=" + (System.currentTimeMillis() - startTime));

        finished = true;
        logFinalStates();
        logSummary();
    }

    private void logFinalStates() {
        for (GraphColoringNode node : nodes.values()) {
            NodeState state = node.getState();
            DataPlaneStatistics statistics = node.getStatistics();
            SimulationLogger.logNodeState(state.getId(), state.getColor(), state.getRole().name(),
                    state.getClusterId(), node.getNeighborTable().size(), statistics.getOriginated(),
                    statistics.getDelivered(), statistics.getForwardedTransmissions(), statistics.getTotalDrops());
        }
    }

    private void logSummary() {
        int[] roleCounts = new int[Role.values().length];
        long originated = 0;
        long delivered = 0;
        for (GraphColoringNode node : nodes.values()) {
            if (node.isRunning()) {
                roleCounts[node.getState().getRole().ordinal()]++;
            }
            originated += node.getStatistics().getOriginated();
            delivered += node.getStatistics().getDelivered();
        }
        StringBuilder roles = new StringBuilder();
        for (Role role : Role.values()) {
            if (roles.length() > 0) {
                roles.append(",");
            }
            roles.append(role.name()).append("=").append(roleCounts[role.ordinal()]);
        }
        SimulationLogger.logInfo("SUMMARY_ROLES", roles.toString());
        SimulationLogger.logInfo("SUMMARY_DATA", "Originated=" + originated + ",Delivered=" + delivered);
        SimulationLogger.logInfo("SUMMARY_COLORING",
                "Proper=" + isProperlyColored() + ",AdjacentClusterHeadPairs=" + countAdjacentClusterHeadPairs());
        if (!isProperlyColored()) {
            SimulationLogger.logWarning("COLORING_NOT_CONVERGED", "Time=" + simulator.getCurrentTime());
        }
    }

    // =========================================================================
    // CHECKS
    // =========================================================================

    /**
     * @return True iff no two adjacent running colored nodes share a color
     */
    public boolean isProperlyColored() {
        for (int[] edge : topology.getEdges()) {
            GraphColoringNode a = nodes.get(edge[0]);
            GraphColoringNode b = nodes.get(edge[1]);
            if (a.isRunning() && b.isRunning()
                    && a.getState().isColored()
                    && a.getState().getColor() == b.getState().getColor()) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return Number of adjacent running node pairs which both hold the Cluster Head color
     */
    public int countAdjacentClusterHeadPairs() {
        int pairs = 0;
        for (int[] edge : topology.getEdges()) {
            GraphColoringNode a = nodes.get(edge[0]);
            GraphColoringNode b = nodes.get(edge[1]);
            if (a.isRunning() && b.isRunning()
                    && a.getState().getColor() == ColoringEngine.CLUSTER_HEAD_COLOR
                    && b.getState().getColor() == ColoringEngine.CLUSTER_HEAD_COLOR) {
                pairs++;
            }
        }
        return pairs;
    }

    public Simulator getSimulator() {
        return simulator;
    }

    public Topology getTopology() {
        return topology;
    }

    public WirelessMedium getMedium() {
        return medium;
    }

    public GccParameters getParameters() {
        return parameters;
    }

    /**
     * @return Unmodifiable ascending map of all nodes by identifier
     */
    public Map<Integer, GraphColoringNode> getNodes() {
        return nodes;
    }

    public NBProperties getConfiguration() {
        return configuration;
    }

    public boolean isFinished() {
        return finished;
    }

}
