package fr.lapetina.fleet.layout.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.fleet.layout.domain.model.AvailabilityZone;
import fr.lapetina.fleet.layout.domain.model.FleetConfig;
import fr.lapetina.fleet.layout.domain.model.Rack;
import fr.lapetina.fleet.layout.domain.model.Server;
import fr.lapetina.fleet.layout.domain.model.ServerRole;
import fr.lapetina.fleet.layout.domain.model.ServiceRole;
import fr.lapetina.fleet.layout.domain.placement.Striping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a fleet description and validates it into a {@link FleetConfig}.
 *
 * Loading runs in three stages, each only when the previous one succeeded:
 * <ol>
 *   <li>parsing and schema validation of the raw structure</li>
 *   <li>structural checks while servers are read: duplicate server ids, and
 *       racks that appear under more than one availability zone</li>
 *   <li>derived values: per-zone minimum server counts and the rack order
 *       striped across zones</li>
 * </ol>
 *
 * The first problem found is reported as a {@link FleetConfigException}.
 *
 * A loader is used once: call exactly one of {@link #loadFromFile(Path)},
 * {@link #loadFromStream(InputStream, Format)} or {@link #loadDirectly(Map)}.
 */
public final class FleetConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(FleetConfigLoader.class);

    /** Zone assigned to servers that do not name one. */
    public static final String DEFAULT_AZ = "default_az";

    /** Rack assigned to servers that do not name one. */
    public static final String DEFAULT_RACK = "default_rack";

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private boolean used;
    private String source;

    /**
     * Supported fleet description formats.
     */
    public enum Format {
        JSON,
        YAML;

        /**
         * YAML for {@code .yaml} and {@code .yml} files, JSON otherwise.
         */
        public static Format forPath(Path path) {
            Path fileName = path.getFileName();
            String name = fileName != null ? fileName.toString().toLowerCase() : "";
            return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : JSON;
        }
    }

    /**
     * Loads the fleet description stored in a file.
     *
     * @throws FleetConfigException if the file cannot be read or is invalid
     */
    public FleetConfig loadFromFile(Path path) {
        begin("file: \"" + path + "\"");

        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new FleetConfigException(FleetConfigException.Kind.IO, source + ": " + describe(e), e);
        }
        return load(parse(new String(content, StandardCharsets.UTF_8), Format.forPath(path)));
    }

    /**
     * Loads a fleet description from a stream. The stream is read to the end
     * but not closed.
     *
     * @throws FleetConfigException if the stream cannot be read or is invalid
     */
    public FleetConfig loadFromStream(InputStream inputStream, Format format) {
        begin("stream");

        String content;
        try {
            content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FleetConfigException(FleetConfigException.Kind.IO, source + ": " + describe(e), e);
        }
        return load(parse(content, format));
    }

    /**
     * Loads a fleet description already held in memory, in the same shape as
     * a parsed JSON file. The structure is copied, so later changes made by
     * the caller have no effect.
     *
     * @throws FleetConfigException if the description is invalid
     */
    public FleetConfig loadDirectly(Map<String, ?> description) {
        begin("directly-passed");
        return load(deepCopy(description));
    }

    private void begin(String source) {
        if (used) {
            throw new IllegalStateException("cannot re-use FleetConfigLoader");
        }
        used = true;
        this.source = source;
        log.info("Loading fleet description from {}", source);
    }

    private Object parse(String content, Format format) {
        try {
            if (format == Format.YAML) {
                return new Yaml(new SafeConstructor(new LoaderOptions())).load(content);
            }
            return JSON.readValue(content, Object.class);
        } catch (JsonProcessingException | YAMLException e) {
            throw new FleetConfigException(FleetConfigException.Kind.PARSE,
                    "parse " + source + ": " + describe(e), e);
        }
    }

    private FleetConfig load(Object parsed) {
        FleetSchemaValidator.validate(parsed);

        Map<?, ?> root = (Map<?, ?>) parsed;
        FleetConfig config = build(root);
        log.debug("Loaded {}", config);
        return config;
    }

    private FleetConfig build(Map<?, ?> root) {
        Map<String, ZoneState> zones = new LinkedHashMap<>();
        Map<String, RackState> racks = new LinkedHashMap<>();
        Map<String, Server> servers = new LinkedHashMap<>();

        for (Object entry : (List<?>) root.get(FleetSchemaValidator.SERVERS)) {
            Map<?, ?> descriptor = (Map<?, ?>) entry;
            ServerRole role = ServerRole.fromToken((String) descriptor.get(FleetSchemaValidator.TYPE)).orElseThrow();
            String id = (String) descriptor.get(FleetSchemaValidator.UUID);
            int memory = ((Number) descriptor.get(FleetSchemaValidator.MEMORY)).intValue();
            String rackName = stringOrDefault(descriptor.get(FleetSchemaValidator.RACK), DEFAULT_RACK);
            String azName = stringOrDefault(descriptor.get(FleetSchemaValidator.AZ), DEFAULT_AZ);

            ZoneState zone = zones.computeIfAbsent(azName, ZoneState::new);

            RackState rack = racks.get(rackName);
            if (rack == null) {
                rack = new RackState(rackName, azName);
                racks.put(rackName, rack);
                zone.rackNames.add(rackName);
            } else if (!rack.az.equals(azName)) {
                throw structural(String.format("server %s, rack %s, az %s: rack already exists in different az %s",
                        id, rackName, azName, rack.az));
            }

            if (servers.containsKey(id)) {
                throw structural(String.format("server %s, rack %s, az %s: duplicate server", id, rackName, azName));
            }
            servers.put(id, new Server(id, rackName, memory, role));

            if (role == ServerRole.METADATA) {
                rack.metadataServers.add(id);
                zone.metadataCount++;
            } else {
                rack.storageServers.add(id);
                zone.storageCount++;
            }
        }

        int minMetadata = Integer.MAX_VALUE;
        int minStorage = Integer.MAX_VALUE;
        List<List<String>> racksByZone = new ArrayList<>(zones.size());
        for (ZoneState zone : zones.values()) {
            minMetadata = Math.min(minMetadata, zone.metadataCount);
            minStorage = Math.min(minStorage, zone.storageCount);
            Collections.sort(zone.rackNames);
            racksByZone.add(zone.rackNames);
        }

        // Striping racks across zones means spreading instances across racks also spreads them across zones.
        List<String> rackNames = Striping.stripe(racksByZone);
        checkSameNames("rack", rackNames, racks.keySet());

        List<String> zoneNames = new ArrayList<>();
        List<String> serverIds = new ArrayList<>();
        for (RackState rack : racks.values()) {
            if (!zoneNames.contains(rack.az)) {
                zoneNames.add(rack.az);
            }
            serverIds.addAll(rack.metadataServers);
            serverIds.addAll(rack.storageServers);
        }
        checkSameNames("availability zone", zoneNames, zones.keySet());
        checkSameNames("server", serverIds, servers.keySet());

        FleetConfig.Builder builder = FleetConfig.builder()
                .nshards(((Number) root.get(FleetSchemaValidator.NSHARDS)).intValue())
                .images(images(root.get(FleetSchemaValidator.IMAGES)))
                .rackNames(rackNames)
                .minMetadataPerAz(minMetadata)
                .minStoragePerAz(minStorage);
        for (ZoneState zone : zones.values()) {
            builder.addAz(new AvailabilityZone(zone.name, zone.rackNames, zone.metadataCount, zone.storageCount));
        }
        for (RackState rack : racks.values()) {
            builder.addRack(new Rack(rack.name, rack.az, rack.metadataServers, rack.storageServers));
        }
        for (Server server : servers.values()) {
            builder.addServer(server);
        }

        log.debug("Read {} servers in {} racks across {} availability zones",
                servers.size(), racks.size(), zones.size());
        return builder.build();
    }

    private static Map<ServiceRole, String> images(Object value) {
        Map<ServiceRole, String> images = new EnumMap<>(ServiceRole.class);
        if (value == null) {
            return images;
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            images.put(ServiceRole.fromServiceName((String) entry.getKey()).orElseThrow(), (String) entry.getValue());
        }
        return images;
    }

    static void checkSameNames(String what, List<String> ordered, Set<String> known) {
        List<String> left = new ArrayList<>(ordered);
        List<String> right = new ArrayList<>(known);
        Collections.sort(left);
        Collections.sort(right);
        if (!left.equals(right)) {
            throw new IllegalStateException("Inconsistent " + what + " index: " + left + " vs " + right);
        }
    }

    private static String stringOrDefault(Object value, String defaultValue) {
        return value != null ? (String) value : defaultValue;
    }

    private static FleetConfigException structural(String message) {
        return new FleetConfigException(FleetConfigException.Kind.STRUCTURE, message);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null ? message.lines().findFirst().orElse(message) : e.getClass().getSimpleName();
    }

    @SuppressWarnings("unchecked")
    private static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) value).entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }

    private static final class ZoneState {
        private final String name;
        private final List<String> rackNames = new ArrayList<>();
        private int metadataCount;
        private int storageCount;

        private ZoneState(String name) {
            this.name = name;
        }
    }

    private static final class RackState {
        private final String name;
        private final String az;
        private final List<String> metadataServers = new ArrayList<>();
        private final List<String> storageServers = new ArrayList<>();

        private RackState(String name, String az) {
            this.name = name;
            this.az = az;
        }
    }
}
