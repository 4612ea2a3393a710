package fr.lapetina.fleet.layout.domain.model;

import java.util.Optional;

/**
 * Service roles that can be laid out on the fleet.
 *
 * Declaration order is the canonical order: roles are evaluated in this order
 * during layout generation and listed in this order in summaries.
 */
public enum ServiceRole {
    NAMESERVICE("nameservice", false),
    POSTGRES("postgres", true),
    MORAY("moray", true),
    ELECTRIC_MORAY("electric-moray", false),
    STORAGE("storage", false),
    AUTHCACHE("authcache", false),
    WEBAPI("webapi", false),
    LOADBALANCER("loadbalancer", false),
    JOBSUPERVISOR("jobsupervisor", false),
    JOBPULLER("jobpuller", false),
    MEDUSA("medusa", false),
    OPS("ops", false),
    MADTOM("madtom", false),
    MARLIN_DASHBOARD("marlin-dashboard", false),
    MARLIN("marlin", false),
    RESHARD("reshard", false),
    PROPELLER("propeller", false);

    private final String serviceName;
    private final boolean sharded;

    ServiceRole(String serviceName, boolean sharded) {
        this.serviceName = serviceName;
        this.sharded = sharded;
    }

    /**
     * Returns the service name as it appears in fleet descriptions and layouts.
     */
    public String getServiceName() {
        return serviceName;
    }

    /**
     * Sharded services are grouped by shard number as well as image.
     */
    public boolean isSharded() {
        return sharded;
    }

    public static Optional<ServiceRole> fromServiceName(String name) {
        for (ServiceRole role : values()) {
            if (role.serviceName.equals(name)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public static boolean isValidServiceName(String name) {
        return fromServiceName(name).isPresent();
    }

    @Override
    public String toString() {
        return serviceName;
    }
}
