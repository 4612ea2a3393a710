/**
 * Fleet Layout - generates the deployment layout of an object storage region
 * from a description of its servers.
 *
 * <p>Given the servers of a region (their role, memory, rack and availability
 * zone) and the image to deploy for each service, the generator decides how
 * many instances of every service run on each server, then writes one JSON
 * layout per availability zone.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.fleet.layout.GenconfigRunner} - loads settings and a fleet
 *       description, generates the layout and writes it out</li>
 *   <li>{@link fr.lapetina.fleet.layout.FleetLayoutApplication} - command line entry point</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * FleetConfig fleet = new FleetConfigLoader().loadFromFile(Paths.get("fleet.json"));
 * Layout layout = LayoutGenerator.generate(fleet, settings.defaultImages());
 *
 * if (layout.nerrors() == 0) {
 *     for (String az : layout.azs()) {
 *         String json = layout.serialize(az).orElseThrow();
 *     }
 * }
 * LayoutReport.printIssues(layout, System.err);
 * }</pre>
 *
 * @see fr.lapetina.fleet.layout.domain.placement.LayoutGenerator
 * @see fr.lapetina.fleet.layout.infrastructure.config.FleetConfigLoader
 */
package fr.lapetina.fleet.layout;
