package fr.lapetina.fleet.layout;

import fr.lapetina.fleet.layout.domain.layout.Layout;
import fr.lapetina.fleet.layout.domain.layout.LayoutReport;
import fr.lapetina.fleet.layout.domain.model.FleetConfig;
import fr.lapetina.fleet.layout.domain.placement.LayoutGenerator;
import fr.lapetina.fleet.layout.infrastructure.config.FleetConfigLoader;
import fr.lapetina.fleet.layout.infrastructure.config.GenconfigConfig;
import fr.lapetina.fleet.layout.infrastructure.config.GenconfigConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;

/**
 * Wires settings, loading, generation and output together.
 *
 * <p>Usage:
 * <pre>{@code
 * GenconfigRunner runner = GenconfigRunner.create("genconfig.yaml");
 * int nerrors = runner.run(Paths.get("fleet.json"), Paths.get("out"), System.out, System.err);
 * }</pre>
 *
 * With an output directory, one file per availability zone is written there,
 * named after the zone. Without one, the fleet must span a single zone and
 * its layout is written to the output stream.
 */
public final class GenconfigRunner {

    private static final Logger log = LoggerFactory.getLogger(GenconfigRunner.class);

    private final GenconfigConfig settings;

    public GenconfigRunner(GenconfigConfig settings) {
        this.settings = Objects.requireNonNull(settings, "Settings are required");
    }

    /**
     * Creates a runner with settings loaded from the given path.
     *
     * @throws GenconfigConfigLoader.ConfigurationException if the settings cannot be loaded
     */
    public static GenconfigRunner create(String settingsPath) {
        return new GenconfigRunner(new GenconfigConfigLoader(settingsPath).load());
    }

    /**
     * Generates the layout of a fleet and writes it out.
     *
     * @param fleetFile       fleet description, JSON or YAML
     * @param outputDirectory where to write one file per zone; when null the
     *                        directory from the settings is used, if any
     * @param out             receives the layout when no directory applies
     * @param err             receives progress, the summary and the issues
     * @return the number of layout errors
     * @throws fr.lapetina.fleet.layout.infrastructure.config.FleetConfigException if the fleet cannot be loaded
     * @throws GenerationException if the layout cannot be written
     */
    public int run(Path fleetFile, Path outputDirectory, PrintStream out, PrintStream err) {
        FleetConfig fleet = new FleetConfigLoader().loadFromFile(fleetFile);
        Layout layout = LayoutGenerator.generate(fleet, settings.defaultImages());

        if (layout.nerrors() == 0) {
            Path directory = outputDirectory != null ? outputDirectory : configuredDirectory();
            if (directory != null) {
                writeAll(layout, directory, err);
            } else {
                writeSingle(layout, out);
            }
        }

        LayoutReport.printIssues(layout, err);
        return layout.nerrors();
    }

    private Path configuredDirectory() {
        String directory = settings.getOutput().getDirectory();
        return directory != null && !directory.isBlank() ? Paths.get(directory) : null;
    }

    private void writeSingle(Layout layout, PrintStream out) {
        List<String> azs = layout.azs();
        if (azs.size() != 1) {
            throw new GenerationException("output directory must be specified when generating "
                    + "a configuration with more than one availability zone");
        }
        out.print(serialized(layout, azs.get(0)));
        out.flush();
    }

    private void writeAll(Layout layout, Path directory, PrintStream err) {
        for (String az : layout.azs()) {
            Path target = directory.resolve(az);
            try {
                Files.writeString(target, serialized(layout, az), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new GenerationException("write \"" + target + "\": " + e.getMessage(), e);
            }
            log.info("Wrote layout of {} to {}", az, target);
            err.println("wrote config for \"" + az + "\"");
        }

        if (settings.getOutput().isSummary()) {
            err.println();
            err.println("Summary of generated configuration:");
            err.println();
            LayoutReport.printSummary(layout, err);
            err.println();
        }
    }

    private static String serialized(Layout layout, String az) {
        return layout.serialize(az)
                .orElseThrow(() -> new IllegalStateException("Layout with errors cannot be serialized"));
    }

    /**
     * Thrown when a generated layout cannot be written out.
     */
    public static class GenerationException extends RuntimeException {
        public GenerationException(String message) {
            super(message);
        }

        public GenerationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
