package ch.ethz.systems.clusterbench.core.run;

import ch.ethz.systems.clusterbench.core.config.BaseAllowedProperties;
import ch.ethz.systems.clusterbench.core.config.NBProperties;
import ch.ethz.systems.clusterbench.core.log.SimulationLogger;

/**
 * Command line entry point.
 *
 * Usage: java -jar gcc-clusterbench.jar [run.properties] [key=value ...]
 *
 * The key=value arguments override the values of the properties file.
 */
public class MainFromProperties {

    private MainFromProperties() {
        // Only static entry point
    }

    public static void main(String[] args) {

        if (args.length < 1) {
            System.out.println("Usage: MainFromProperties [run.properties] [key=value ...]");
            System.exit(1);
        }

        NBProperties configuration = generateConfiguration(args);

        SimulationLogger.open(configuration);
        try {
            new ClusteringRun(configuration).run();
            SimulationLogger.close();
            System.out.println("Finished run; logs in " + SimulationLogger.getRunFolderPath());
        } catch (RuntimeException e) {
            SimulationLogger.closeAndThrowaway();
            throw e;
        }

    }

    /**
     * Load the properties file (first argument) and apply the key=value overrides.
     *
     * @param args  Command line arguments
     *
     * @return Run configuration
     */
    static NBProperties generateConfiguration(String[] args) {
        NBProperties configuration = new NBProperties(args[0], BaseAllowedProperties.all());
        for (int i = 1; i < args.length; i++) {
            String[] split = args[i].split("=", 2);
            if (split.length != 2 || split[0].trim().isEmpty()) {
                throw new IllegalArgumentException("Override must be of the form key=value: " + args[i]);
            }
            configuration.overrideProperty(split[0].trim(), split[1].trim());
        }
        return configuration;
    }

}
