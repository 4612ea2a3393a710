package fr.lapetina.fleet.layout.domain.placement;

import java.util.Objects;

/**
 * How many instances of a service to create and where to put them.
 *
 * @param kind   the placement rule
 * @param amount fixed instance count for {@link Kind#FIXED_COUNT}, ratio for
 *               {@link Kind#FRONTDOOR_RATIO}, replicas per shard for
 *               {@link Kind#PER_SHARD}; unused otherwise
 */
public record PlacementPolicy(Kind kind, int amount) {

    public PlacementPolicy {
        Objects.requireNonNull(kind, "Kind is required");
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
    }

    public static PlacementPolicy fixedCount(int count) {
        return new PlacementPolicy(Kind.FIXED_COUNT, count);
    }

    public static PlacementPolicy frontdoorRatio(int ratio) {
        if (ratio <= 0) {
            throw new IllegalArgumentException("Front door ratio must be positive: " + ratio);
        }
        return new PlacementPolicy(Kind.FRONTDOOR_RATIO, ratio);
    }

    public static PlacementPolicy perShard(int replicas) {
        return new PlacementPolicy(Kind.PER_SHARD, replicas);
    }

    public static PlacementPolicy onePerStorageNode() {
        return new PlacementPolicy(Kind.ONE_PER_STORAGE_NODE, 0);
    }

    public static PlacementPolicy capacityDerived() {
        return new PlacementPolicy(Kind.CAPACITY_DERIVED, 0);
    }

    public static PlacementPolicy unplaced() {
        return new PlacementPolicy(Kind.UNPLACED, 0);
    }

    public enum Kind {
        /** Exact instance count, striped over metadata servers in the "small" class. */
        FIXED_COUNT,

        /** Count scaled with the number of metadata servers, shared "frontdoor" class. */
        FRONTDOOR_RATIO,

        /** Fixed replicas per shard, in a class named after the service. */
        PER_SHARD,

        /** Exactly one instance on every storage server. */
        ONE_PER_STORAGE_NODE,

        /** Instances per storage server derived from its memory. */
        CAPACITY_DERIVED,

        /** Known service that the layout generator does not deploy. */
        UNPLACED
    }
}
