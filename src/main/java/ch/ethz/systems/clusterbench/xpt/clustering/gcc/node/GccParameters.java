package ch.ethz.systems.clusterbench.xpt.clustering.gcc.node;

import ch.ethz.systems.clusterbench.core.config.NBProperties;
import ch.ethz.systems.clusterbench.core.config.exceptions.PropertyValueInvalidException;
import ch.ethz.systems.clusterbench.core.log.SimulationLogger;

/**
 * Validated parameters of a graph-coloring clustering node.
 *
 * Configuration properties (all optional, defaults in brackets):
 *
 *   gcc_hello_interval_ns=1000000000         (>= 0, 0 disables advertisements)
 *   gcc_hello_jitter_ns=100000000            (>= 0)
 *   gcc_neighbor_timeout_ns=3500000000       (any)
 *   gcc_maintenance_interval_ns=2000000000   (> 0)
 *   gcc_coloring_interval_ns=0               (>= 0, legacy initial coloring delay)
 *   gcc_coloring_jitter_ns=500000000         (>= 0)
 *   gcc_data_interval_ns=0                   (>= 0, 0 disables data generation)
 *   gcc_data_jitter_ns=0                     (>= 0)
 *   gcc_data_ttl=16                          (>= 1)
 *   gcc_forward_jitter_ns=10000000           (>= 0)
 *   gcc_dedup_capacity=0                     (>= 0, 0 is unbounded)
 *   gcc_local_port=5000                      (0 - 65535)
 *   gcc_dest_port=5000                       (0 - 65535)
 *
 * Any violation is fatal: the node is never started with a partial configuration.
 */
public class GccParameters {

    public static final long DEFAULT_HELLO_INTERVAL_NS = 1_000_000_000L;
    public static final long DEFAULT_HELLO_JITTER_NS = 100_000_000L;
    public static final long DEFAULT_NEIGHBOR_TIMEOUT_NS = 3_500_000_000L;
    public static final long DEFAULT_MAINTENANCE_INTERVAL_NS = 2_000_000_000L;
    public static final long DEFAULT_COLORING_INTERVAL_NS = 0L;
    public static final long DEFAULT_COLORING_JITTER_NS = 500_000_000L;
    public static final long DEFAULT_DATA_INTERVAL_NS = 0L;
    public static final long DEFAULT_DATA_JITTER_NS = 0L;
    public static final int DEFAULT_DATA_TTL = 16;
    public static final long DEFAULT_FORWARD_JITTER_NS = 10_000_000L;
    public static final int DEFAULT_DEDUP_CAPACITY = 0;
    public static final int DEFAULT_PORT = 5000;

    private static final int MAX_PORT = 65535;

    private final long helloIntervalNs;
    private final long helloJitterNs;
    private final long neighborTimeoutNs;
    private final long maintenanceIntervalNs;
    private final long coloringIntervalNs;
    private final long coloringJitterNs;
    private final long dataIntervalNs;
    private final long dataJitterNs;
    private final int dataTtl;
    private final long forwardJitterNs;
    private final int dedupCapacity;
    private final int localPort;
    private final int destPort;

    /**
     * Create validated parameters.
     *
     * @throws IllegalArgumentException if any value is out of its range
     */
    public GccParameters(long helloIntervalNs, long helloJitterNs, long neighborTimeoutNs,
                         long maintenanceIntervalNs, long coloringIntervalNs, long coloringJitterNs,
                         long dataIntervalNs, long dataJitterNs, int dataTtl, long forwardJitterNs,
                         int dedupCapacity, int localPort, int destPort) {
        requireNonNegative("helloInterval", helloIntervalNs);
        requireNonNegative("helloJitter", helloJitterNs);
        if (maintenanceIntervalNs <= 0) {
            throw new IllegalArgumentException("maintenanceInterval must be positive: " + maintenanceIntervalNs);
        }
        requireNonNegative("coloringInterval", coloringIntervalNs);
        requireNonNegative("coloringJitter", coloringJitterNs);
        requireNonNegative("dataInterval", dataIntervalNs);
        requireNonNegative("dataJitter", dataJitterNs);
        if (dataTtl < 1) {
            throw new IllegalArgumentException("dataTtl must be at least 1: " + dataTtl);
        }
        requireNonNegative("forwardJitter", forwardJitterNs);
        requireNonNegative("dedupCapacity", dedupCapacity);
        requirePort("localPort", localPort);
        requirePort("destPort", destPort);

        this.helloIntervalNs = helloIntervalNs;
        this.helloJitterNs = helloJitterNs;
        this.neighborTimeoutNs = neighborTimeoutNs;
        this.maintenanceIntervalNs = maintenanceIntervalNs;
        this.coloringIntervalNs = coloringIntervalNs;
        this.coloringJitterNs = coloringJitterNs;
        this.dataIntervalNs = dataIntervalNs;
        this.dataJitterNs = dataJitterNs;
        this.dataTtl = dataTtl;
        this.forwardJitterNs = forwardJitterNs;
        this.dedupCapacity = dedupCapacity;
        this.localPort = localPort;
        this.destPort = destPort;
    }

    private static void requireNonNegative(String name, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " cannot be negative: " + value);
        }
    }

    private static void requirePort(String name, int port) {
        if (port < 0 || port > MAX_PORT) {
            throw new IllegalArgumentException(name + " is not a valid port number: " + port);
        }
    }

    /**
     * @return Parameters with all defaults
     */
    public static GccParameters defaults() {
        return new GccParameters(DEFAULT_HELLO_INTERVAL_NS, DEFAULT_HELLO_JITTER_NS, DEFAULT_NEIGHBOR_TIMEOUT_NS,
                DEFAULT_MAINTENANCE_INTERVAL_NS, DEFAULT_COLORING_INTERVAL_NS, DEFAULT_COLORING_JITTER_NS,
                DEFAULT_DATA_INTERVAL_NS, DEFAULT_DATA_JITTER_NS, DEFAULT_DATA_TTL, DEFAULT_FORWARD_JITTER_NS,
                DEFAULT_DEDUP_CAPACITY, DEFAULT_PORT, DEFAULT_PORT);
    }

    /**
     * Read and validate the parameters from the run configuration.
     *
     * @param configuration     Run configuration
     *
     * @return Validated parameters
     *
     * @throws PropertyValueInvalidException if a value is malformed or out of range
     */
    public static GccParameters fromConfiguration(NBProperties configuration) {

        long helloInterval = nonNegative(configuration, "gcc_hello_interval_ns", DEFAULT_HELLO_INTERVAL_NS);
        long helloJitter = nonNegative(configuration, "gcc_hello_jitter_ns", DEFAULT_HELLO_JITTER_NS);
        long neighborTimeout = configuration.getLongPropertyWithDefault("gcc_neighbor_timeout_ns", DEFAULT_NEIGHBOR_TIMEOUT_NS);
        long maintenanceInterval = configuration.getLongPropertyWithDefault("gcc_maintenance_interval_ns", DEFAULT_MAINTENANCE_INTERVAL_NS);
        if (maintenanceInterval <= 0) {
            throw new PropertyValueInvalidException(configuration, "gcc_maintenance_interval_ns", "must be > 0");
        }
        long coloringInterval = nonNegative(configuration, "gcc_coloring_interval_ns", DEFAULT_COLORING_INTERVAL_NS);
        long coloringJitter = nonNegative(configuration, "gcc_coloring_jitter_ns", DEFAULT_COLORING_JITTER_NS);
        long dataInterval = nonNegative(configuration, "gcc_data_interval_ns", DEFAULT_DATA_INTERVAL_NS);
        long dataJitter = nonNegative(configuration, "gcc_data_jitter_ns", DEFAULT_DATA_JITTER_NS);
        int dataTtl = configuration.getIntegerPropertyWithDefault("gcc_data_ttl", DEFAULT_DATA_TTL);
        if (dataTtl < 1) {
            throw new PropertyValueInvalidException(configuration, "gcc_data_ttl", "must be >= 1");
        }
        long forwardJitter = nonNegative(configuration, "gcc_forward_jitter_ns", DEFAULT_FORWARD_JITTER_NS);
        int dedupCapacity = (int) nonNegative(configuration, "gcc_dedup_capacity", DEFAULT_DEDUP_CAPACITY);
        int localPort = port(configuration, "gcc_local_port");
        int destPort = port(configuration, "gcc_dest_port");

        GccParameters parameters = new GccParameters(helloInterval, helloJitter, neighborTimeout,
                maintenanceInterval, coloringInterval, coloringJitter, dataInterval, dataJitter, dataTtl,
                forwardJitter, dedupCapacity, localPort, destPort);
        parameters.log();
        return parameters;
    }

    private static long nonNegative(NBProperties configuration, String property, long defaultValue) {
        long value = configuration.getLongPropertyWithDefault(property, defaultValue);
        if (value < 0) {
            throw new PropertyValueInvalidException(configuration, property, "must be >= 0");
        }
        return value;
    }

    private static int port(NBProperties configuration, String property) {
        int value = configuration.getIntegerPropertyWithDefault(property, DEFAULT_PORT);
        if (value < 0 || value > MAX_PORT) {
            throw new PropertyValueInvalidException(configuration, property, "must be a port number in [0, 65535]");
        }
        return value;
    }

    private void log() {
        SimulationLogger.logInfo("Protocol", "GRAPH_COLORING_CLUSTERING");
        SimulationLogger.logInfo("GCC hello interval (ns)", String.valueOf(helloIntervalNs));
        SimulationLogger.logInfo("GCC hello jitter (ns)", String.valueOf(helloJitterNs));
        SimulationLogger.logInfo("GCC neighbor timeout (ns)", String.valueOf(neighborTimeoutNs));
        SimulationLogger.logInfo("GCC maintenance interval (ns)", String.valueOf(maintenanceIntervalNs));
        SimulationLogger.logInfo("GCC coloring interval (ns)", String.valueOf(coloringIntervalNs));
        SimulationLogger.logInfo("GCC coloring jitter (ns)", String.valueOf(coloringJitterNs));
        SimulationLogger.logInfo("GCC data interval (ns)", String.valueOf(dataIntervalNs));
        SimulationLogger.logInfo("GCC data jitter (ns)", String.valueOf(dataJitterNs));
        SimulationLogger.logInfo("GCC data TTL", String.valueOf(dataTtl));
        SimulationLogger.logInfo("GCC forward jitter (ns)", String.valueOf(forwardJitterNs));
        SimulationLogger.logInfo("GCC dedup capacity", String.valueOf(dedupCapacity));
        SimulationLogger.logInfo("GCC ports (local/dest)", localPort + "/" + destPort);
    }

    public long getHelloIntervalNs() {
        return helloIntervalNs;
    }

    public long getHelloJitterNs() {
        return helloJitterNs;
    }

    public long getNeighborTimeoutNs() {
        return neighborTimeoutNs;
    }

    public long getMaintenanceIntervalNs() {
        return maintenanceIntervalNs;
    }

    public long getColoringIntervalNs() {
        return coloringIntervalNs;
    }

    public long getColoringJitterNs() {
        return coloringJitterNs;
    }

    public long getDataIntervalNs() {
        return dataIntervalNs;
    }

    public long getDataJitterNs() {
        return dataJitterNs;
    }

    public int getDataTtl() {
        return dataTtl;
    }

    public long getForwardJitterNs() {
        return forwardJitterNs;
    }

    public int getDedupCapacity() {
        return dedupCapacity;
    }

    public int getLocalPort() {
        return localPort;
    }

    public int getDestPort() {
        return destPort;
    }

}
