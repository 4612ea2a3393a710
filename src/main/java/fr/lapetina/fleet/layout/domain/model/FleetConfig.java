package fr.lapetina.fleet.layout.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated description of the fleet: availability zones, racks, servers and
 * the deployment parameters that drive layout generation.
 *
 * Instances are produced by the fleet configuration loader and are immutable.
 * Rack names are kept in striped order (racks interleaved across availability
 * zones), so walking racks in order also walks zones.
 */
public final class FleetConfig {

    private final int nshards;
    private final Map<ServiceRole, String> images;
    private final List<String> azNames;
    private final Map<String, AvailabilityZone> azs;
    private final List<String> rackNames;
    private final Map<String, Rack> racks;
    private final List<String> serverNames;
    private final Map<String, Server> servers;
    private final List<String> metadataServers;
    private final List<String> storageServers;
    private final int minMetadataPerAz;
    private final int minStoragePerAz;

    private FleetConfig(Builder builder) {
        if (builder.nshards <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + builder.nshards);
        }
        this.nshards = builder.nshards;
        EnumMap<ServiceRole, String> imagesCopy = new EnumMap<>(ServiceRole.class);
        imagesCopy.putAll(builder.images);
        this.images = Collections.unmodifiableMap(imagesCopy);
        this.azNames = List.copyOf(builder.azNames);
        this.azs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.azs));
        this.rackNames = List.copyOf(builder.rackNames);
        this.racks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.racks));
        this.serverNames = List.copyOf(builder.serverNames);
        this.servers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.servers));
        this.metadataServers = List.copyOf(builder.metadataServers);
        this.storageServers = List.copyOf(builder.storageServers);
        this.minMetadataPerAz = builder.minMetadataPerAz;
        this.minStoragePerAz = builder.minStoragePerAz;
    }

    public int getNshards() {
        return nshards;
    }

    /**
     * Image overrides from the fleet description, keyed by service role.
     */
    public Map<ServiceRole, String> getImages() {
        return images;
    }

    /**
     * Availability zone names in discovery order.
     */
    public List<String> getAzNames() {
        return azNames;
    }

    public AvailabilityZone getAz(String name) {
        AvailabilityZone az = azs.get(name);
        if (az == null) {
            throw new IllegalArgumentException("Unknown availability zone: " + name);
        }
        return az;
    }

    public Map<String, AvailabilityZone> getAzs() {
        return azs;
    }

    /**
     * Availability zones in discovery order.
     */
    public List<AvailabilityZone> zones() {
        List<AvailabilityZone> zones = new ArrayList<>(azNames.size());
        for (String name : azNames) {
            zones.add(azs.get(name));
        }
        return zones;
    }

    /**
     * Rack names in striped order.
     */
    public List<String> getRackNames() {
        return rackNames;
    }

    public Rack getRack(String name) {
        Rack rack = racks.get(name);
        if (rack == null) {
            throw new IllegalArgumentException("Unknown rack: " + name);
        }
        return rack;
    }

    public Map<String, Rack> getRacks() {
        return racks;
    }

    /**
     * Server ids in load order.
     */
    public List<String> getServerNames() {
        return serverNames;
    }

    public Server getServer(String id) {
        Server server = servers.get(id);
        if (server == null) {
            throw new IllegalArgumentException("Unknown server: " + id);
        }
        return server;
    }

    public Map<String, Server> getServers() {
        return servers;
    }

    public List<String> getMetadataServers() {
        return metadataServers;
    }

    public List<String> getStorageServers() {
        return storageServers;
    }

    public int getMinMetadataPerAz() {
        return minMetadataPerAz;
    }

    public int getMinStoragePerAz() {
        return minStoragePerAz;
    }

    /**
     * Returns the availability zone holding the given server.
     */
    public String azOf(String serverId) {
        return getRack(getServer(serverId).rack()).az();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FleetConfig that = (FleetConfig) o;
        return nshards == that.nshards
                && images.equals(that.images)
                && azNames.equals(that.azNames)
                && rackNames.equals(that.rackNames)
                && servers.equals(that.servers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nshards, images, azNames, rackNames, servers);
    }

    @Override
    public String toString() {
        return "FleetConfig{" +
                "nshards=" + nshards +
                ", azs=" + azNames +
                ", racks=" + rackNames.size() +
                ", metadata=" + metadataServers.size() +
                ", storage=" + storageServers.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int nshards;
        private final Map<ServiceRole, String> images = new EnumMap<>(ServiceRole.class);
        private final List<String> azNames = new ArrayList<>();
        private final Map<String, AvailabilityZone> azs = new LinkedHashMap<>();
        private final List<String> rackNames = new ArrayList<>();
        private final Map<String, Rack> racks = new LinkedHashMap<>();
        private final List<String> serverNames = new ArrayList<>();
        private final Map<String, Server> servers = new LinkedHashMap<>();
        private final List<String> metadataServers = new ArrayList<>();
        private final List<String> storageServers = new ArrayList<>();
        private int minMetadataPerAz;
        private int minStoragePerAz;

        public Builder nshards(int nshards) {
            this.nshards = nshards;
            return this;
        }

        public Builder images(Map<ServiceRole, String> images) {
            this.images.putAll(images);
            return this;
        }

        public Builder addAz(AvailabilityZone az) {
            this.azNames.add(az.name());
            this.azs.put(az.name(), az);
            return this;
        }

        public Builder rackNames(List<String> rackNames) {
            this.rackNames.addAll(rackNames);
            return this;
        }

        public Builder addRack(Rack rack) {
            this.racks.put(rack.name(), rack);
            return this;
        }

        public Builder addServer(Server server) {
            this.serverNames.add(server.id());
            this.servers.put(server.id(), server);
            if (server.isMetadata()) {
                this.metadataServers.add(server.id());
            } else {
                this.storageServers.add(server.id());
            }
            return this;
        }

        public Builder minMetadataPerAz(int min) {
            this.minMetadataPerAz = min;
            return this;
        }

        public Builder minStoragePerAz(int min) {
            this.minStoragePerAz = min;
            return this;
        }

        public FleetConfig build() {
            return new FleetConfig(this);
        }
    }
}
