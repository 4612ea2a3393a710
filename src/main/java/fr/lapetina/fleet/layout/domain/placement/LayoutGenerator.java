package fr.lapetina.fleet.layout.domain.placement;

import fr.lapetina.fleet.layout.domain.layout.Layout;
import fr.lapetina.fleet.layout.domain.model.AvailabilityZone;
import fr.lapetina.fleet.layout.domain.model.FleetConfig;
import fr.lapetina.fleet.layout.domain.model.InstanceProperties;
import fr.lapetina.fleet.layout.domain.model.Server;
import fr.lapetina.fleet.layout.domain.model.ServiceRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lays out services on a fleet.
 *
 * Generation never throws for problems with the fleet itself. Problems that
 * make a layout impossible are recorded as errors on the returned
 * {@link Layout} and generation stops there; problems that only weaken fault
 * tolerance are recorded as warnings.
 *
 * Services are evaluated in {@link ServiceRole} declaration order. Placement
 * is fully deterministic: the same fleet and images always give the same
 * layout.
 */
public final class LayoutGenerator {

    private static final Logger log = LoggerFactory.getLogger(LayoutGenerator.class);

    private final FleetConfig config;
    private final Map<ServiceRole, String> images;
    private final Layout layout;
    private final StripedAllocator allocator;

    private LayoutGenerator(FleetConfig config, Map<ServiceRole, String> images) {
        this.config = config;
        this.images = images;
        this.layout = new Layout(config);
        this.allocator = new StripedAllocator(config);
    }

    /**
     * Generates a layout.
     *
     * @param config        validated fleet description
     * @param defaultImages image to use for each service; the fleet's own
     *                      image overrides win over these. Only services with
     *                      an image are laid out.
     * @return the sealed layout, possibly holding only errors
     */
    public static Layout generate(FleetConfig config, Map<ServiceRole, String> defaultImages) {
        Objects.requireNonNull(config, "Fleet config is required");
        Objects.requireNonNull(defaultImages, "Default images are required");

        Map<ServiceRole, String> images = new EnumMap<>(ServiceRole.class);
        images.putAll(defaultImages);
        images.putAll(config.getImages());

        LayoutGenerator generator = new LayoutGenerator(config, images);
        generator.run();
        generator.layout.seal();
        return generator.layout;
    }

    private void run() {
        log.info("Generating layout: {}", config);

        if (config.getMetadataServers().isEmpty() || config.getStorageServers().isEmpty()) {
            fatal("need at least one metadata server and one storage server");
            return;
        }

        int nazs = config.getAzNames().size();
        if (nazs != 1 && nazs != 3) {
            fatal("only one- and three-datacenter deployments are supported");
            return;
        }

        checkFleetShape();

        for (Map.Entry<ServiceRole, String> entry : images.entrySet()) {
            place(entry.getKey(), entry.getValue());
        }

        log.info("Layout generated: {} services, {} warnings",
                layout.deployedServices().size(), layout.warnings().size());
    }

    private void checkFleetShape() {
        boolean unevenMetadata = false;
        boolean unevenStorage = false;
        for (AvailabilityZone az : config.zones()) {
            unevenMetadata |= az.metadataCount() != config.getMinMetadataPerAz();
            unevenStorage |= az.storageCount() != config.getMinStoragePerAz();
        }

        if (unevenMetadata) {
            warn("datacenters have different numbers of metadata servers. "
                    + "The impact of a datacenter failure will differ depending on which datacenter fails.");
        }

        if (unevenStorage) {
            warn("datacenters have different numbers of storage servers.");
        }

        int nshards = config.getNshards();
        int minMetadata = config.getMinMetadataPerAz();
        if (nshards > minMetadata) {
            // Allowed: small test fleets run several shards per server
            warn(String.format("requested %d shards with only %d metadata server%s in at least one datacenter. "
                            + "Multiple primary databases will wind up running on the same servers, "
                            + "and this configuration may not survive server failure. This is not recommended.",
                    nshards, minMetadata, plural(minMetadata)));
        } else if (PolicyTable.REPLICAS_PER_SHARD * nshards > config.getAzNames().size() * minMetadata) {
            warn(String.format("requested %d shards with only %d metadata server%s in at least one datacenter. "
                            + "Under some conditions, multiple databases may wind up running on the same servers. "
                            + "This is not recommended.",
                    nshards, minMetadata, plural(minMetadata)));
        }

        int nracks = config.getRackNames().size();
        if (nracks < PolicyTable.REPLICAS_PER_SHARD) {
            warn(String.format("configuration has only %d rack%s. This configuration may not survive rack failure.",
                    nracks, plural(nracks)));
        }
    }

    private void place(ServiceRole role, String image) {
        PlacementPolicy policy = PolicyTable.policyFor(role);
        switch (policy.kind()) {
            case FIXED_COUNT -> placeStriped(role, image, StripedAllocator.CLASS_SMALL, policy.amount());
            case FRONTDOOR_RATIO -> placeStriped(role, image, StripedAllocator.CLASS_FRONTDOOR,
                    PolicyTable.frontdoorCount(policy.amount(), config.getMetadataServers().size()));
            case PER_SHARD -> placePerShard(role, image, policy.amount());
            case ONE_PER_STORAGE_NODE -> placeOnStorage(role, image);
            case CAPACITY_DERIVED -> placeByCapacity(role, image);
            case UNPLACED -> warn(String.format("service %s is not laid out automatically; "
                    + "no instances were generated for it.", role));
        }
    }

    private void placeStriped(ServiceRole role, String image, String allocationClass, int count) {
        InstanceProperties properties = InstanceProperties.ofImage(image);
        for (int i = 0; i < count; i++) {
            layout.record(allocator.next(allocationClass), role, properties);
        }
        log.debug("Placed {} instances of {} from class {}", count, role, allocationClass);
    }

    /**
     * Each sharded service draws from its own class. Since every such service
     * makes the same sequence of draws, instance i of one service lands on the
     * same server as instance i of the others, colocating cooperating services
     * of the same shard.
     */
    private void placePerShard(ServiceRole role, String image, int replicas) {
        for (int shard = 1; shard <= config.getNshards(); shard++) {
            InstanceProperties properties = InstanceProperties.ofShard(shard, image);
            for (int i = 0; i < replicas; i++) {
                layout.record(allocator.next(role.getServiceName()), role, properties);
            }
        }
        log.debug("Placed {} instances of {} across {} shards", config.getNshards() * replicas, role,
                config.getNshards());
    }

    private void placeOnStorage(ServiceRole role, String image) {
        InstanceProperties properties = InstanceProperties.ofImage(image);
        for (String serverId : config.getStorageServers()) {
            layout.record(serverId, role, properties);
        }
        log.debug("Placed {} on {} storage servers", role, config.getStorageServers().size());
    }

    private void placeByCapacity(ServiceRole role, String image) {
        InstanceProperties properties = InstanceProperties.ofImage(image);
        for (String serverId : config.getStorageServers()) {
            Server server = config.getServer(serverId);
            int count = PolicyTable.computeCount(server.memoryGb());
            for (int i = 0; i < count; i++) {
                layout.record(serverId, role, properties);
            }
            log.debug("Placed {} instances of {} on {} ({} GB)", count, role, serverId, server.memoryGb());
        }
    }

    private void fatal(String message) {
        log.debug("Layout failed: {}", message);
        layout.addError(message);
    }

    private void warn(String message) {
        log.debug("Layout warning: {}", message);
        layout.addWarning(message);
    }

    private static String plural(int count) {
        return count == 1 ? "" : "s";
    }
}
