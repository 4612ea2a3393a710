package fr.lapetina.fleet.layout.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * A rack of servers. Rack names are unique across all availability zones.
 *
 * @param name             rack name
 * @param az               availability zone holding this rack
 * @param metadataServers  ids of metadata servers, in load order
 * @param storageServers   ids of storage servers, in load order
 */
public record Rack(String name, String az, List<String> metadataServers, List<String> storageServers) {
    public Rack {
        Objects.requireNonNull(name, "Rack name is required");
        Objects.requireNonNull(az, "Availability zone is required");
        metadataServers = metadataServers != null ? List.copyOf(metadataServers) : List.of();
        storageServers = storageServers != null ? List.copyOf(storageServers) : List.of();
    }
}
