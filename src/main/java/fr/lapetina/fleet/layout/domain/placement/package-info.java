/**
 * Placement of service instances on the fleet.
 *
 * <p>{@link fr.lapetina.fleet.layout.domain.placement.LayoutGenerator} applies the
 * policy of each service, looked up in
 * {@link fr.lapetina.fleet.layout.domain.placement.PolicyTable}, and records the
 * result into a {@link fr.lapetina.fleet.layout.domain.layout.Layout}.
 *
 * <h2>Policies</h2>
 * <table border="1">
 *   <tr><th>Policy</th><th>Services</th><th>Placement</th></tr>
 *   <tr><td>{@code FIXED_COUNT}</td><td>nameservice, ops, madtom, ...</td><td>Exact count, class "small"</td></tr>
 *   <tr><td>{@code FRONTDOOR_RATIO}</td><td>authcache, electric-moray, webapi, loadbalancer</td><td>Scaled with metadata servers, class "frontdoor"</td></tr>
 *   <tr><td>{@code PER_SHARD}</td><td>postgres, moray</td><td>Three per shard, class named after the service</td></tr>
 *   <tr><td>{@code ONE_PER_STORAGE_NODE}</td><td>storage</td><td>One on every storage server</td></tr>
 *   <tr><td>{@code CAPACITY_DERIVED}</td><td>marlin</td><td>Per storage server, from its memory</td></tr>
 * </table>
 *
 * <h2>Striping</h2>
 * <p>Metadata services are placed by
 * {@link fr.lapetina.fleet.layout.domain.placement.StripedAllocator}, which hands
 * out servers round-robin from a list interleaved across racks. Racks are
 * themselves interleaved across availability zones, so consecutive instances
 * of a class land in different racks and zones whenever the fleet allows.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * FleetConfig fleet = new FleetConfigLoader().loadFromFile(Path.of("fleet.json"));
 * Layout layout = LayoutGenerator.generate(fleet, defaultImages);
 * layout.serialize("us-east-1a").ifPresent(System.out::print);
 * }</pre>
 */
package fr.lapetina.fleet.layout.domain.placement;
