package ch.ethz.systems.clusterbench.core.log;

import ch.ethz.systems.clusterbench.core.config.NBProperties;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Writes the log files of a single run into its run folder.
 *
 * Files:
 * - extra_info.log          Key/value information lines ({@link #logInfo(String, String)})
 * - warnings.log            Recoverable problems ({@link #logWarning(String, String)})
 * - node_states.csv.log     Final state of every node ({@link #logNodeState})
 * - data_delivery.csv.log   One line per delivered data unit, if enabled
 * - configuration.properties  Copy of the run configuration
 *
 * All calls are no-ops while the logger is not open, so that protocol
 * components can be unit tested without a run folder.
 */
public class SimulationLogger {

    private static String runFolderPath;
    private static BufferedWriter writerExtraInfo;
    private static BufferedWriter writerWarnings;
    private static BufferedWriter writerNodeStates;
    private static BufferedWriter writerDataDelivery;

    private static boolean logDataDelivery;
    private static boolean logRoleChanges;

    private SimulationLogger() {
        // Static class only
    }

    /**
     * Open the log writers in the run folder configured in the properties.
     *
     * @param configuration     Run configuration
     */
    public static void open(NBProperties configuration) {

        String runFolderName = configuration.getPropertyWithDefault("run_folder_name", "default");
        String runFolderBaseDir = configuration.getPropertyWithDefault("run_folder_base_dir", "temp");
        runFolderPath = runFolderBaseDir + "/" + runFolderName;

        File runFolder = new File(runFolderPath);
        if (!runFolder.exists() && !runFolder.mkdirs()) {
            throw new RuntimeException("Could not create run folder: " + runFolderPath);
        }

        logDataDelivery = configuration.getBooleanPropertyWithDefault("enable_log_data_delivery", false);
        logRoleChanges = configuration.getBooleanPropertyWithDefault("enable_log_role_changes", false);

        try {
            writerExtraInfo = openWriter("extra_info.log");
            writerWarnings = openWriter("warnings.log");
            writerNodeStates = openWriter("node_states.csv.log");
            writerNodeStates.write("node_id,color,role,cluster_id,neighbors,originated,delivered,forwarded,dropped\n");
            if (logDataDelivery) {
                writerDataDelivery = openWriter("data_delivery.csv.log");
                writerDataDelivery.write("node_id,source_id,sequence_number,created_ns,delivered_ns,ttl_left\n");
            }
            try (BufferedWriter writerConfig = openWriter("configuration.properties")) {
                writerConfig.write(configuration.getAllPropertiesToString());
            }
        } catch (IOException e) {
            throw new RuntimeException("Could not open log writers in " + runFolderPath, e);
        }

    }

    private static BufferedWriter openWriter(String logFileName) throws IOException {
        return new BufferedWriter(new FileWriter(runFolderPath + "/" + logFileName));
    }

    /**
     * Log a key/value information line.
     *
     * @param key       Key (e.g. "GCC_ROLE_CHANGE")
     * @param value     Value, by convention "Field=value,Field=value"
     */
    public static void logInfo(String key, String value) {
        write(writerExtraInfo, key + ": " + value);
    }

    /**
     * Log a recoverable problem (dropped unit, vanished neighbor, ...).
     *
     * @param key       Key (e.g. "GCC_ORPHANED_UPLINK")
     * @param value     Value, by convention "Field=value,Field=value"
     */
    public static void logWarning(String key, String value) {
        write(writerWarnings, key + ": " + value);
    }

    /**
     * Log a role transition, if role change logging is enabled.
     */
    public static void logRoleChange(int nodeId, String oldRole, String newRole, int color, int clusterId, long timeNs) {
        if (logRoleChanges) {
            logInfo("GCC_ROLE_CHANGE",
                    "Node=" + nodeId +
                    ",OldRole=" + oldRole +
                    ",NewRole=" + newRole +
                    ",Color=" + color +
                    ",ClusterId=" + clusterId +
                    ",Time=" + timeNs);
        }
    }

    /**
     * Log the final state of a node.
     */
    public static void logNodeState(int nodeId, int color, String role, int clusterId, int neighbors,
                                    long originated, long delivered, long forwarded, long dropped) {
        write(writerNodeStates, nodeId + "," + color + "," + role + "," + clusterId + "," + neighbors + ","
                + originated + "," + delivered + "," + forwarded + "," + dropped);
    }

    /**
     * Log a data unit delivery, if delivery logging is enabled.
     */
    public static void logDataDelivery(int nodeId, int sourceId, int sequenceNumber, long createdNs,
                                       long deliveredNs, int ttlLeft) {
        if (logDataDelivery) {
            write(writerDataDelivery, nodeId + "," + sourceId + "," + sequenceNumber + "," + createdNs + ","
                    + deliveredNs + "," + ttlLeft);
        }
    }

    private static void write(BufferedWriter writer, String line) {
        if (writer == null) {
            return;
        }
        try {
            writer.write(line);
            writer.write("\n");
        } catch (IOException e) {
            throw new RuntimeException("Could not write log line to run folder " + runFolderPath, e);
        }
    }

    /**
     * Flush and close all log writers.
     */
    public static void close() {
        try {
            closeWriter(writerExtraInfo);
            closeWriter(writerWarnings);
            closeWriter(writerNodeStates);
            closeWriter(writerDataDelivery);
        } catch (IOException e) {
            throw new RuntimeException("Could not close log writers of " + runFolderPath, e);
        } finally {
            writerExtraInfo = null;
            writerWarnings = null;
            writerNodeStates = null;
            writerDataDelivery = null;
            logDataDelivery = false;
            logRoleChanges = false;
        }
    }

    private static void closeWriter(BufferedWriter writer) throws IOException {
        if (writer != null) {
            writer.close();
        }
    }

    /**
     * Close all log writers and delete the run folder (used by tests).
     */
    public static void closeAndThrowaway() {
        String folder = runFolderPath;
        close();
        if (folder == null) {
            return;
        }
        Path root = new File(folder).toPath();
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).map(Path::toFile).forEach(File::delete);
        } catch (IOException e) {
            throw new RuntimeException("Could not delete run folder " + folder, e);
        }
        runFolderPath = null;
    }

    /**
     * @return Path of the current run folder, or null if never opened
     */
    public static String getRunFolderPath() {
        return runFolderPath;
    }

}
