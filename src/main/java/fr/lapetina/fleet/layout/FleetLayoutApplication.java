package fr.lapetina.fleet.layout;

import fr.lapetina.fleet.layout.infrastructure.config.FleetConfigException;
import fr.lapetina.fleet.layout.infrastructure.config.GenconfigConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main entry point for the fleet layout generator.
 *
 * <pre>
 * fleet-layout &lt;fleet-file&gt; [&lt;output-directory&gt;]
 * </pre>
 *
 * The settings file is read from the {@code fleet.layout.settings} system
 * property, {@code genconfig.yaml} by default.
 */
public class FleetLayoutApplication {

    private static final Logger log = LoggerFactory.getLogger(FleetLayoutApplication.class);

    public static final String SETTINGS_PROPERTY = "fleet.layout.settings";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private FleetLayoutApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the generator and returns the process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1 || args.length > 2) {
            err.println("usage: fleet-layout <fleet-file> [<output-directory>]");
            return EXIT_USAGE;
        }

        Path fleetFile = Paths.get(args[0]);
        Path outputDirectory = args.length > 1 ? Paths.get(args[1]) : null;
        String settingsPath = System.getProperty(SETTINGS_PROPERTY, GenconfigConfigLoader.DEFAULT_PATH);

        try {
            GenconfigRunner runner = GenconfigRunner.create(settingsPath);
            int nerrors = runner.run(fleetFile, outputDirectory, out, err);
            if (nerrors > 0) {
                err.println("error: bailing out because of at least one issue");
                return EXIT_FAILURE;
            }
            return EXIT_OK;
        } catch (FleetConfigException e) {
            log.debug("Failed to load fleet description", e);
            err.println("error: " + e.getKind().getDescription() + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (GenconfigConfigLoader.ConfigurationException | GenconfigRunner.GenerationException e) {
            log.debug("Failed to generate layout", e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
