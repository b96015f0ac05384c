package ch.ethz.systems.clusterbench.core.log;

import ch.ethz.systems.clusterbench.core.config.BaseAllowedProperties;
import ch.ethz.systems.clusterbench.core.config.NBProperties;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationLoggerTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        SimulationLogger.close();
    }

    private NBProperties configuration(boolean deliveries, boolean roleChanges) {
        NBProperties configuration = new NBProperties(BaseAllowedProperties.all());
        configuration.overrideProperty("run_folder_base_dir", tempDir.toString());
        configuration.overrideProperty("run_folder_name", "run");
        configuration.overrideProperty("enable_log_data_delivery", String.valueOf(deliveries));
        configuration.overrideProperty("enable_log_role_changes", String.valueOf(roleChanges));
        return configuration;
    }

    private List<String> lines(String fileName) throws IOException {
        return Files.readAllLines(tempDir.resolve("run").resolve(fileName), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Calls before opening are ignored")
    void notOpen() {
        assertDoesNotThrow(() -> {
            SimulationLogger.logInfo("KEY", "Field=1");
            SimulationLogger.logWarning("KEY", "Field=1");
            SimulationLogger.logNodeState(0, 0, "CLUSTER_HEAD", 0, 2, 1, 1, 0, 0);
        });
    }

    @Test
    @DisplayName("Run folder receives info, warning and node state lines")
    void writesFiles() throws IOException {
        SimulationLogger.open(configuration(false, false));
        SimulationLogger.logInfo("GCC_NODE_STARTED", "Node=3");
        SimulationLogger.logWarning("GCC_DATA_DROPPED", "Node=3,Reason=NO_ROUTE");
        SimulationLogger.logNodeState(3, 1, "GATEWAY", 0, 2, 5, 4, 3, 1);
        SimulationLogger.logDataDelivery(3, 1, 0, 10, 20, 15);
        SimulationLogger.logRoleChange(3, "UNDECIDED", "GATEWAY", 1, 0, 100);
        SimulationLogger.close();

        assertEquals(tempDir.toString() + "/run", SimulationLogger.getRunFolderPath());
        assertTrue(lines("extra_info.log").contains("GCC_NODE_STARTED: Node=3"));
        assertEquals(1, lines("extra_info.log").size());
        assertEquals(List.of("GCC_DATA_DROPPED: Node=3,Reason=NO_ROUTE"), lines("warnings.log"));
        assertEquals("3,1,GATEWAY,0,2,5,4,3,1", lines("node_states.csv.log").get(1));
        assertFalse(Files.exists(tempDir.resolve("run").resolve("data_delivery.csv.log")));
        assertTrue(Files.exists(tempDir.resolve("run").resolve("configuration.properties")));
    }

    @Test
    @DisplayName("Optional deliveries and role changes are written when enabled")
    void optionalLogs() throws IOException {
        SimulationLogger.open(configuration(true, true));
        SimulationLogger.logDataDelivery(3, 1, 0, 10, 20, 15);
        SimulationLogger.logRoleChange(3, "UNDECIDED", "GATEWAY", 1, 0, 100);
        SimulationLogger.close();

        assertEquals("3,1,0,10,20,15", lines("data_delivery.csv.log").get(1));
        assertEquals(List.of("GCC_ROLE_CHANGE: Node=3,OldRole=UNDECIDED,NewRole=GATEWAY,Color=1,ClusterId=0,Time=100"),
                lines("extra_info.log"));
    }

    @Test
    @DisplayName("Throwaway close deletes the run folder")
    void throwaway() {
        SimulationLogger.open(configuration(false, false));
        SimulationLogger.logInfo("KEY", "Field=1");
        SimulationLogger.closeAndThrowaway();

        assertFalse(Files.exists(tempDir.resolve("run")));
        assertNull(SimulationLogger.getRunFolderPath());
    }

}
