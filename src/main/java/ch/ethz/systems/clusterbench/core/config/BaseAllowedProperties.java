package ch.ethz.systems.clusterbench.core.config;

public class BaseAllowedProperties {

    private BaseAllowedProperties() {
        // Private constructor, cannot be constructed
    }

    public static final String[] LOG = new String[]{
            "enable_log_data_delivery",
            "enable_log_role_changes",
    };

    public static final String[] PROPERTIES_RUN = new String[] {

            // General
            "seed",
            "run_time_ns",
            "run_folder_name",
            "run_folder_base_dir",

            // Topology
            "scenario_topology_file",
            "scenario_topology_random_nodes",
            "scenario_topology_random_area_m",

            // Churn
            "scenario_node_failures",

            // Traffic
            "traffic_data_destination"

    };

    public static final String[] WIRELESS = new String[]{
            "wireless_radio_range_m",
            "wireless_propagation_delay_ns"
    };

    public static final String[] GCC = new String[]{

            // Advertisement
            "gcc_hello_interval_ns",
            "gcc_hello_jitter_ns",
            "gcc_neighbor_timeout_ns",

            // Maintenance and (legacy) initial coloring
            "gcc_maintenance_interval_ns",
            "gcc_coloring_interval_ns",
            "gcc_coloring_jitter_ns",

            // Data plane
            "gcc_data_interval_ns",
            "gcc_data_jitter_ns",
            "gcc_data_ttl",
            "gcc_forward_jitter_ns",
            "gcc_dedup_capacity",

            // Transport addressing
            "gcc_local_port",
            "gcc_dest_port"
    };

    /**
     * All lists, for run entry points which accept every known key.
     */
    public static String[][] all() {
        return new String[][]{LOG, PROPERTIES_RUN, WIRELESS, GCC};
    }

}
