package fr.lapetina.fleet.layout.domain.placement;

import fr.lapetina.fleet.layout.domain.model.FleetConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Round-robin allocator of metadata servers, striped across racks.
 *
 * The server list is built once: racks are taken in the fleet's striped rack
 * order (which already alternates availability zones), and their metadata
 * servers are interleaved, giving
 *
 * <pre>
 *     rack 0, server 0
 *     rack 1, server 0
 *     ...
 *     rack 0, server 1
 *     rack 1, server 1
 *     ...
 * </pre>
 *
 * Racks with fewer servers drop out of later rounds, so they end up with fewer
 * instances overall.
 *
 * Each allocation class keeps its own cursor into that list. A class seen for
 * the first time starts at the beginning, and cursors are never reset for the
 * lifetime of the allocator. Not thread-safe; one allocator serves one
 * generation run.
 */
public final class StripedAllocator {

    /** Class shared by the fixed-count services. */
    public static final String CLASS_SMALL = "small";

    /** Class shared by all front door services so their per-server counts stay level. */
    public static final String CLASS_FRONTDOOR = "frontdoor";

    private final List<String> striped;
    private final Map<String, Integer> cursors = new HashMap<>();

    public StripedAllocator(FleetConfig config) {
        List<List<String>> perRack = new ArrayList<>(config.getRackNames().size());
        for (String rackName : config.getRackNames()) {
            perRack.add(config.getRack(rackName).metadataServers());
        }
        this.striped = List.copyOf(Striping.stripe(perRack));
    }

    /**
     * Returns the server that should receive the next instance of the given
     * allocation class, and advances that class's cursor. Nothing is placed on
     * the server; the caller records the instance.
     *
     * @param allocationClass cursor namespace, e.g. {@link #CLASS_SMALL} or a service name
     * @return id of the chosen metadata server
     * @throws IllegalStateException if the fleet has no metadata servers
     */
    public String next(String allocationClass) {
        if (striped.isEmpty()) {
            throw new IllegalStateException("No metadata servers to allocate from");
        }

        int cursor = cursors.getOrDefault(allocationClass, 0);
        cursors.put(allocationClass, cursor + 1);
        return striped.get(cursor % striped.size());
    }

    /**
     * Metadata server ids in allocation order.
     */
    public List<String> getStripedServers() {
        return striped;
    }

    /**
     * Number of allocations made so far for the given class.
     */
    public int allocations(String allocationClass) {
        return cursors.getOrDefault(allocationClass, 0);
    }
}
