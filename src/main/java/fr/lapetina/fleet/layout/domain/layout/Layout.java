package fr.lapetina.fleet.layout.domain.layout;

import fr.lapetina.fleet.layout.domain.model.FleetConfig;
import fr.lapetina.fleet.layout.domain.model.InstanceProperties;
import fr.lapetina.fleet.layout.domain.model.ServiceConfiguration;
import fr.lapetina.fleet.layout.domain.model.ServiceRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * How many instances of which image (and shard) of every service run on each
 * server of a region.
 *
 * The same stream of placement decisions feeds three views:
 * <ul>
 *   <li>server id to service to instance counts (the deployable output)</li>
 *   <li>service to availability zone to instance counts</li>
 *   <li>service to region-wide instance counts</li>
 * </ul>
 *
 * A layout also carries the fatal errors and warnings found while it was
 * generated. It is filled in by the generator and then sealed; after that it
 * is read-only. A layout with errors cannot be serialized.
 */
public final class Layout {

    private final FleetConfig config;
    private final List<LayoutIssue> errors = new ArrayList<>();
    private final List<LayoutIssue> warnings = new ArrayList<>();

    private final Map<String, Map<ServiceRole, ServiceConfiguration>> byServer = new LinkedHashMap<>();
    private final Map<ServiceRole, Map<String, ServiceConfiguration>> byServiceAz = new EnumMap<>(ServiceRole.class);
    private final Map<ServiceRole, ServiceConfiguration> byService = new EnumMap<>(ServiceRole.class);

    private boolean sealed;

    public Layout(FleetConfig config) {
        this.config = Objects.requireNonNull(config, "Fleet config is required");
    }

    /**
     * Records one instance of {@code role} with the given properties on a server.
     *
     * @throws IllegalArgumentException if the server is not part of the fleet
     */
    public void record(String serverId, ServiceRole role, InstanceProperties properties) {
        checkNotSealed();
        String az = config.azOf(serverId);

        byServer.computeIfAbsent(serverId, id -> new EnumMap<>(ServiceRole.class))
                .computeIfAbsent(role, ServiceConfiguration::new)
                .increment(properties);

        byService.computeIfAbsent(role, ServiceConfiguration::new)
                .increment(properties);

        byServiceAz.computeIfAbsent(role, r -> new LinkedHashMap<>())
                .computeIfAbsent(az, name -> new ServiceConfiguration(role))
                .increment(properties);
    }

    public void addError(String message) {
        checkNotSealed();
        errors.add(LayoutIssue.error(message));
    }

    public void addWarning(String message) {
        checkNotSealed();
        warnings.add(LayoutIssue.warning(message));
    }

    /**
     * Marks generation as finished. Any later mutation is a programming error.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new IllegalStateException("Layout is read-only once generated");
        }
    }

    public FleetConfig getConfig() {
        return config;
    }

    /**
     * Returns the availability zones laid out, in discovery order.
     */
    public List<String> azs() {
        return config.getAzNames();
    }

    /**
     * Number of fatal errors. Anything above zero means the layout is unusable.
     */
    public int nerrors() {
        return errors.size();
    }

    public List<LayoutIssue> errors() {
        return Collections.unmodifiableList(errors);
    }

    public List<LayoutIssue> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Services and their instance counts on one server; empty when the server
     * received nothing.
     */
    public Map<ServiceRole, ServiceConfiguration> getServerConfigurations(String serverId) {
        Map<ServiceRole, ServiceConfiguration> configs = byServer.get(serverId);
        return configs != null ? Collections.unmodifiableMap(configs) : Map.of();
    }

    /**
     * Instance counts of one service per availability zone.
     */
    public Map<String, ServiceConfiguration> getServiceConfigurationsByAz(ServiceRole role) {
        Map<String, ServiceConfiguration> configs = byServiceAz.get(role);
        return configs != null ? Collections.unmodifiableMap(configs) : Map.of();
    }

    /**
     * Region-wide instance counts of one service.
     */
    public Optional<ServiceConfiguration> getServiceConfiguration(ServiceRole role) {
        return Optional.ofNullable(byService.get(role));
    }

    /**
     * Services that received at least one instance, in canonical order.
     */
    public List<ServiceRole> deployedServices() {
        return List.copyOf(byService.keySet());
    }

    /**
     * Returns the JSON description of the layout for one availability zone,
     * or empty if the layout has fatal errors.
     */
    public Optional<String> serialize(String azName) {
        if (nerrors() > 0) {
            return Optional.empty();
        }
        if (!config.getAzs().containsKey(azName)) {
            throw new IllegalArgumentException("Unknown availability zone: " + azName);
        }
        return Optional.of(LayoutSerializer.serialize(this, azName));
    }

    @Override
    public String toString() {
        return "Layout{" +
                "azs=" + azs() +
                ", services=" + byService.keySet() +
                ", errors=" + errors.size() +
                ", warnings=" + warnings.size() +
                '}';
    }
}
