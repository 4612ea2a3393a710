/**
 * Domain model for fleet layout generation.
 *
 * <p>The fleet is described by availability zones, racks and servers, wrapped
 * in an immutable {@link fr.lapetina.fleet.layout.domain.model.FleetConfig}.
 * Placement decisions are counted in
 * {@link fr.lapetina.fleet.layout.domain.model.ServiceConfiguration} buckets.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.fleet.layout.domain.model.FleetConfig} - Validated fleet description</li>
 *   <li>{@link fr.lapetina.fleet.layout.domain.model.AvailabilityZone} - Zone with its sorted racks and server counts</li>
 *   <li>{@link fr.lapetina.fleet.layout.domain.model.Rack} - Rack with its metadata and storage servers</li>
 *   <li>{@link fr.lapetina.fleet.layout.domain.model.Server} - Compute node with memory and role</li>
 *   <li>{@link fr.lapetina.fleet.layout.domain.model.ServiceRole} - Closed set of deployable services</li>
 *   <li>{@link fr.lapetina.fleet.layout.domain.model.ServiceConfiguration} - Instance counts grouped by properties</li>
 * </ul>
 *
 * <h2>Mutability</h2>
 * <p>Everything except {@code ServiceConfiguration} is immutable once built.
 * {@code ServiceConfiguration} is only mutated while a layout is generated.
 *
 * @see fr.lapetina.fleet.layout.domain.model.FleetConfig
 */
package fr.lapetina.fleet.layout.domain.model;
