package fr.lapetina.fleet.layout.domain.model;

import java.util.Objects;

/**
 * A compute node available for layout.
 *
 * @param id       unique identifier across the fleet (usually a UUID)
 * @param rack     name of the rack holding this server
 * @param memoryGb gigabytes of memory available for services
 * @param role     whether this server takes metadata or storage services
 */
public record Server(String id, String rack, int memoryGb, ServerRole role) {
    public Server {
        Objects.requireNonNull(id, "Server id is required");
        Objects.requireNonNull(rack, "Rack is required");
        Objects.requireNonNull(role, "Role is required");
        if (memoryGb <= 0) {
            throw new IllegalArgumentException("Memory must be positive: " + memoryGb);
        }
    }

    public boolean isMetadata() {
        return role == ServerRole.METADATA;
    }

    public boolean isStorage() {
        return role == ServerRole.STORAGE;
    }
}
