package ch.ethz.systems.clusterbench.core.config;

import ch.ethz.systems.clusterbench.core.config.exceptions.PropertyMissingException;
import ch.ethz.systems.clusterbench.core.config.exceptions.PropertyNotExistingException;
import ch.ethz.systems.clusterbench.core.config.exceptions.PropertyValueInvalidException;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class NBPropertiesTest {

    @TempDir
    Path tempDir;

    private Path writeFile(String content) throws IOException {
        Path file = tempDir.resolve("run.properties");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    @DisplayName("Properties are loaded from file and typed getters parse them")
    void loadFromFile() throws IOException {
        Path file = writeFile("seed=12\nrun_time_ns=5000000000\nwireless_radio_range_m=150.5\nenable_log_role_changes=true\n");

        NBProperties properties = new NBProperties(file.toString(), BaseAllowedProperties.all());

        assertEquals(12, properties.getIntegerPropertyOrFail("seed"));
        assertEquals(5_000_000_000L, properties.getLongPropertyOrFail("run_time_ns"));
        assertEquals(150.5, properties.getDoublePropertyOrFail("wireless_radio_range_m"), 1e-9);
        assertTrue(properties.getBooleanPropertyOrFail("enable_log_role_changes"));
        assertEquals(file.toString(), properties.getFileName());
    }

    @Test
    @DisplayName("Unknown keys in the file are refused")
    void unknownKey_isRefused() throws IOException {
        Path file = writeFile("seed=1\nno_such_property=3\n");

        assertThrows(PropertyNotExistingException.class,
                () -> new NBProperties(file.toString(), BaseAllowedProperties.all()));
    }

    @Test
    @DisplayName("Overrides are restricted to allowed keys")
    void override_allowedKeysOnly() {
        NBProperties properties = new NBProperties(BaseAllowedProperties.PROPERTIES_RUN);

        properties.overrideProperty("seed", "99");
        assertEquals(99, properties.getIntegerPropertyOrFail("seed"));

        assertThrows(PropertyNotExistingException.class, () -> properties.overrideProperty("gcc_data_ttl", "3"));
    }

    @Test
    @DisplayName("Missing properties fail, or fall back to the default")
    void missingProperty() {
        NBProperties properties = new NBProperties(BaseAllowedProperties.all());

        assertThrows(PropertyMissingException.class, () -> properties.getPropertyOrFail("run_time_ns"));
        assertEquals(7L, properties.getLongPropertyWithDefault("run_time_ns", 7L));
        assertFalse(properties.getBooleanPropertyWithDefault("enable_log_role_changes", false));
        assertFalse(properties.isPropertyDefined("run_time_ns"));
    }

    @Test
    @DisplayName("Malformed values are reported as invalid")
    void malformedValues_areInvalid() {
        NBProperties properties = new NBProperties(BaseAllowedProperties.all());
        properties.overrideProperty("seed", "twelve");
        properties.overrideProperty("enable_log_role_changes", "yes");

        assertThrows(PropertyValueInvalidException.class, () -> properties.getIntegerPropertyOrFail("seed"));
        assertThrows(PropertyValueInvalidException.class, () -> properties.getLongPropertyWithDefault("seed", 1L));
        assertThrows(PropertyValueInvalidException.class,
                () -> properties.getBooleanPropertyWithDefault("enable_log_role_changes", false));
    }

    @Test
    @DisplayName("The properties dump is sorted by key")
    void allPropertiesToString_isSorted() {
        NBProperties properties = new NBProperties(BaseAllowedProperties.all());
        properties.overrideProperty("seed", "1");
        properties.overrideProperty("run_time_ns", "2");

        String dump = properties.getAllPropertiesToString();

        assertTrue(dump.indexOf("run_time_ns=2") < dump.indexOf("seed=1"));
    }

}
