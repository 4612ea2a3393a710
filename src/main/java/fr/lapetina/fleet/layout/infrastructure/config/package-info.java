/**
 * Loading of fleet descriptions and of the application settings.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.fleet.layout.infrastructure.config.FleetConfigLoader} - reads a fleet
 *       description (JSON or YAML) into a validated {@code FleetConfig}</li>
 *   <li>{@link fr.lapetina.fleet.layout.infrastructure.config.FleetConfigException} - the first
 *       problem found in a fleet description</li>
 *   <li>{@link fr.lapetina.fleet.layout.infrastructure.config.GenconfigConfig} - settings model</li>
 *   <li>{@link fr.lapetina.fleet.layout.infrastructure.config.GenconfigConfigLoader} - YAML settings
 *       loading from the file system or the classpath</li>
 * </ul>
 *
 * <h2>Settings Sections</h2>
 * <ul>
 *   <li>{@code images} - default image for each service, by service name</li>
 *   <li>{@code output} - output directory and whether to print a summary</li>
 * </ul>
 */
package fr.lapetina.fleet.layout.infrastructure.config;
