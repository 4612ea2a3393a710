/**
 * Generated layouts and the reports built on them.
 *
 * <p>A {@link fr.lapetina.fleet.layout.domain.layout.Layout} aggregates placement
 * decisions per server, per service per availability zone, and per service.
 * It serializes one JSON document per availability zone and carries the
 * errors and warnings found during generation.
 *
 * @see fr.lapetina.fleet.layout.domain.placement.LayoutGenerator
 */
package fr.lapetina.fleet.layout.domain.layout;
