package fr.lapetina.fleet.layout.domain.placement;

import fr.lapetina.fleet.layout.domain.model.ServiceRole;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Placement policy for every service role.
 *
 * The counts are heuristics from operating experience, not measurements.
 */
public final class PolicyTable {

    /**
     * Instances of each per-shard service for every shard. Three is what the
     * replicated database needs, and a reasonable ratio for its front end too.
     */
    public static final int REPLICAS_PER_SHARD = 3;

    /**
     * Front door ratio that maps to one instance per metadata server. Services
     * with smaller ratios are scaled down proportionally.
     */
    public static final int FRONTDOOR_MAX_RATIO = 8;

    /** Front door services always get at least this many instances. */
    public static final int FRONTDOOR_MIN_INSTANCES = 2;

    /** Share of a storage server's memory given to compute zones. */
    public static final double COMPUTE_MEMORY_FRACTION = 0.25;

    /** Default memory of one compute zone, in megabytes. */
    public static final int COMPUTE_INSTANCE_MB = 1024;

    /** Compute zones per storage server regardless of memory; jobs run even in small deployments. */
    public static final int COMPUTE_MIN_PER_SERVER = 4;

    private static final Map<ServiceRole, PlacementPolicy> POLICIES;

    static {
        EnumMap<ServiceRole, PlacementPolicy> policies = new EnumMap<>(ServiceRole.class);

        policies.put(ServiceRole.NAMESERVICE, PlacementPolicy.fixedCount(3));
        // Must be deployed once per region
        policies.put(ServiceRole.OPS, PlacementPolicy.fixedCount(1));
        policies.put(ServiceRole.MADTOM, PlacementPolicy.fixedCount(1));
        policies.put(ServiceRole.MARLIN_DASHBOARD, PlacementPolicy.fixedCount(1));
        policies.put(ServiceRole.JOBSUPERVISOR, PlacementPolicy.fixedCount(2));
        policies.put(ServiceRole.JOBPULLER, PlacementPolicy.fixedCount(2));
        policies.put(ServiceRole.MEDUSA, PlacementPolicy.fixedCount(2));
        // Test component, never part of a production layout
        policies.put(ServiceRole.PROPELLER, PlacementPolicy.fixedCount(0));

        policies.put(ServiceRole.POSTGRES, PlacementPolicy.perShard(REPLICAS_PER_SHARD));
        policies.put(ServiceRole.MORAY, PlacementPolicy.perShard(REPLICAS_PER_SHARD));

        policies.put(ServiceRole.AUTHCACHE, PlacementPolicy.frontdoorRatio(1));
        policies.put(ServiceRole.ELECTRIC_MORAY, PlacementPolicy.frontdoorRatio(FRONTDOOR_MAX_RATIO));
        policies.put(ServiceRole.WEBAPI, PlacementPolicy.frontdoorRatio(FRONTDOOR_MAX_RATIO));
        policies.put(ServiceRole.LOADBALANCER, PlacementPolicy.frontdoorRatio(FRONTDOOR_MAX_RATIO));

        policies.put(ServiceRole.STORAGE, PlacementPolicy.onePerStorageNode());
        policies.put(ServiceRole.MARLIN, PlacementPolicy.capacityDerived());

        policies.put(ServiceRole.RESHARD, PlacementPolicy.unplaced());

        for (ServiceRole role : ServiceRole.values()) {
            if (!policies.containsKey(role)) {
                throw new ExceptionInInitializerError("No placement policy for service " + role);
            }
            if (role.isSharded() != (policies.get(role).kind() == PlacementPolicy.Kind.PER_SHARD)) {
                throw new ExceptionInInitializerError("Sharded services must use a per-shard policy: " + role);
            }
        }
        POLICIES = Collections.unmodifiableMap(policies);
    }

    private PolicyTable() {
        // Utility class
    }

    public static PlacementPolicy policyFor(ServiceRole role) {
        return POLICIES.get(role);
    }

    public static Map<ServiceRole, PlacementPolicy> all() {
        return POLICIES;
    }

    /**
     * Instance count for a front door service. The service with the largest
     * ratio gets one instance per metadata server.
     */
    public static int frontdoorCount(int ratio, int metadataServers) {
        int count = (int) Math.ceil((double) ratio * metadataServers / FRONTDOOR_MAX_RATIO);
        return Math.max(FRONTDOOR_MIN_INSTANCES, count);
    }

    /**
     * Compute zones for a storage server with the given memory, in gigabytes.
     */
    public static int computeCount(int memoryGb) {
        double availableMb = COMPUTE_MEMORY_FRACTION * memoryGb * 1024;
        int count = (int) Math.floor(availableMb / COMPUTE_INSTANCE_MB);
        return Math.max(count, COMPUTE_MIN_PER_SERVER);
    }
}
