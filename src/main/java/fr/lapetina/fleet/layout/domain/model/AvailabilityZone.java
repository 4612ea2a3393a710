package fr.lapetina.fleet.layout.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * An availability zone (datacenter) of the fleet.
 *
 * @param name           zone name
 * @param rackNames      racks in this zone, sorted lexically
 * @param metadataCount  number of metadata servers in this zone
 * @param storageCount   number of storage servers in this zone
 */
public record AvailabilityZone(String name, List<String> rackNames, int metadataCount, int storageCount) {
    public AvailabilityZone {
        Objects.requireNonNull(name, "Availability zone name is required");
        rackNames = rackNames != null ? List.copyOf(rackNames) : List.of();
    }
}
