package fr.lapetina.fleet.layout.domain.model;

import java.util.Optional;

/**
 * Role of a server in the fleet. Each server is exactly one of the two.
 */
public enum ServerRole {
    /** Hosts metadata-tier services (databases, front door, small services). */
    METADATA("metadata"),

    /** Hosts the storage service and compute zones. */
    STORAGE("storage");

    private final String token;

    ServerRole(String token) {
        this.token = token;
    }

    /**
     * Returns the name used for this role in fleet descriptions.
     */
    public String getToken() {
        return token;
    }

    public static Optional<ServerRole> fromToken(String token) {
        for (ServerRole role : values()) {
            if (role.token.equals(token)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
