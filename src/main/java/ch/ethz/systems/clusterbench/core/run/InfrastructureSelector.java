package ch.ethz.systems.clusterbench.core.run;

import ch.ethz.systems.clusterbench.core.Simulator;
import ch.ethz.systems.clusterbench.core.config.NBProperties;
import ch.ethz.systems.clusterbench.core.config.exceptions.PropertyMissingException;
import ch.ethz.systems.clusterbench.core.config.exceptions.PropertyValueInvalidException;
import ch.ethz.systems.clusterbench.core.log.SimulationLogger;
import ch.ethz.systems.clusterbench.core.run.churn.NodeFailureEvent;
import ch.ethz.systems.clusterbench.core.run.topology.Topology;
import ch.ethz.systems.clusterbench.core.run.traffic.UniformDestinationPlanner;
import ch.ethz.systems.clusterbench.ext.wireless.WirelessMedium;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.interfaces.IDestinationSelector;
import ch.ethz.systems.clusterbench.xpt.clustering.gcc.node.GraphColoringNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Builds the scenario components (topology, medium, traffic, churn)
 * from the run configuration.
 */
class InfrastructureSelector {

    static final long DEFAULT_PROPAGATION_DELAY_NS = 1000L;

    private InfrastructureSelector() {
        // Only static class
    }

    /**
     * Select the topology: a topology file if "scenario_topology_file" is set,
     * otherwise a random geometric graph of "scenario_topology_random_nodes"
     * nodes in a square of "scenario_topology_random_area_m" meters with radio
     * range "wireless_radio_range_m".
     *
     * @param configuration     Run configuration
     * @param simulator         Simulator (source of placement randomness)
     *
     * @return Topology
     */
    static Topology selectTopology(NBProperties configuration, Simulator simulator) {

        if (configuration.isPropertyDefined("scenario_topology_file")) {
            String fileName = configuration.getPropertyOrFail("scenario_topology_file");
            Topology topology = Topology.fromFile(fileName);
            SimulationLogger.logInfo("Topology", "FILE," + fileName + "," + topology);
            return topology;
        }

        if (configuration.isPropertyDefined("scenario_topology_random_nodes")) {
            int numNodes = configuration.getIntegerPropertyOrFail("scenario_topology_random_nodes");
            if (numNodes <= 0) {
                throw new PropertyValueInvalidException(configuration, "scenario_topology_random_nodes", "must be > 0");
            }
            double areaM = configuration.getDoublePropertyOrFail("scenario_topology_random_area_m");
            if (areaM <= 0) {
                throw new PropertyValueInvalidException(configuration, "scenario_topology_random_area_m", "must be > 0");
            }
            double rangeM = configuration.getDoublePropertyOrFail("wireless_radio_range_m");
            if (rangeM <= 0) {
                throw new PropertyValueInvalidException(configuration, "wireless_radio_range_m", "must be > 0");
            }
            Topology topology = Topology.randomGeometric(numNodes, areaM, rangeM,
                    simulator.selectIndependentRandom("topology_placement"));
            SimulationLogger.logInfo("Topology", "RANDOM_GEOMETRIC," + topology);
            return topology;
        }

        throw new PropertyMissingException(configuration, "scenario_topology_file");
    }

    /**
     * Create the wireless medium with the configured propagation delay.
     */
    static WirelessMedium selectMedium(NBProperties configuration, Simulator simulator) {
        long delayNs = configuration.getLongPropertyWithDefault("wireless_propagation_delay_ns", DEFAULT_PROPAGATION_DELAY_NS);
        if (delayNs < 0) {
            throw new PropertyValueInvalidException(configuration, "wireless_propagation_delay_ns", "must be >= 0");
        }
        WirelessMedium medium = new WirelessMedium(simulator, delayNs);
        SimulationLogger.logInfo("Wireless propagation delay (ns)", String.valueOf(delayNs));
        return medium;
    }

    /**
     * Select the destination chooser of synthetic data units.
     * "traffic_data_destination" is a node identifier or -1 for uniform random.
     */
    static IDestinationSelector selectDestinationSelector(NBProperties configuration, Simulator simulator,
                                                          Collection<Integer> nodeIds) {
        int destination = configuration.getIntegerPropertyWithDefault("traffic_data_destination",
                UniformDestinationPlanner.RANDOM_DESTINATION);
        if (destination != UniformDestinationPlanner.RANDOM_DESTINATION && !nodeIds.contains(destination)) {
            throw new PropertyValueInvalidException(configuration, "traffic_data_destination",
                    "must be -1 or an existing node identifier");
        }
        SimulationLogger.logInfo("Traffic data destination",
                destination == UniformDestinationPlanner.RANDOM_DESTINATION ? "UNIFORM_RANDOM" : String.valueOf(destination));
        return new UniformDestinationPlanner(nodeIds, destination, simulator.selectIndependentRandom("traffic_destinations"));
    }

    /**
     * Create the crash-stop failures listed in "scenario_node_failures",
     * a comma-separated list of "nodeId@timeNs" entries.
     */
    static List<NodeFailureEvent> selectNodeFailures(NBProperties configuration, Map<Integer, GraphColoringNode> nodes) {
        List<NodeFailureEvent> failures = new ArrayList<>();
        String value = configuration.getPropertyWithDefault("scenario_node_failures", "").trim();
        if (value.isEmpty()) {
            return failures;
        }
        for (String entry : value.split(",")) {
            String[] parts = entry.trim().split("@");
            if (parts.length != 2) {
                throw new PropertyValueInvalidException(configuration, "scenario_node_failures",
                        "entries must have the form nodeId@timeNs");
            }
            int nodeId;
            long timeNs;
            try {
                nodeId = Integer.parseInt(parts[0].trim());
                timeNs = Long.parseLong(parts[1].trim());
            } catch (NumberFormatException e) {
                throw new PropertyValueInvalidException(configuration, "scenario_node_failures",
                        "entries must have the form nodeId@timeNs");
            }
            GraphColoringNode node = nodes.get(nodeId);
            if (node == null || timeNs < 0) {
                throw new PropertyValueInvalidException(configuration, "scenario_node_failures",
                        "unknown node or negative time in entry " + entry.trim());
            }
            failures.add(new NodeFailureEvent(timeNs, node));
            SimulationLogger.logInfo("Scheduled node failure", "Node=" + nodeId + ",Time=" + timeNs);
        }
        return failures;
    }

}
