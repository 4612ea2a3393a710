package fr.lapetina.fleet.layout;

import fr.lapetina.fleet.layout.domain.model.FleetConfig;
import fr.lapetina.fleet.layout.domain.model.ServiceRole;
import fr.lapetina.fleet.layout.infrastructure.config.FleetConfigLoader;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds fleet descriptions for tests.
 */
public final class FleetFixtures {

    private final List<Map<String, Object>> servers = new ArrayList<>();
    private final Map<String, Object> images = new LinkedHashMap<>();
    private int nshards = 1;

    public static FleetFixtures fleet() {
        return new FleetFixtures();
    }

    public FleetFixtures nshards(int nshards) {
        this.nshards = nshards;
        return this;
    }

    public FleetFixtures metadata(String uuid, String rack, String az) {
        return server("metadata", uuid, 64, rack, az);
    }

    public FleetFixtures storage(String uuid, int memoryGb, String rack, String az) {
        return server("storage", uuid, memoryGb, rack, az);
    }

    public FleetFixtures server(String type, String uuid, int memoryGb, String rack, String az) {
        Map<String, Object> server = new LinkedHashMap<>();
        server.put("type", type);
        server.put("uuid", uuid);
        server.put("memory", memoryGb);
        if (rack != null) {
            server.put("rack", rack);
        }
        if (az != null) {
            server.put("az", az);
        }
        servers.add(server);
        return this;
    }

    public FleetFixtures image(String service, String image) {
        images.put(service, image);
        return this;
    }

    public Map<String, Object> description() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("nshards", nshards);
        if (!images.isEmpty()) {
            description.put("images", new LinkedHashMap<>(images));
        }
        description.put("servers", new ArrayList<>(servers));
        return description;
    }

    public FleetConfig load() {
        return new FleetConfigLoader().loadDirectly(description());
    }

    /**
     * One image per laid-out service, named {@code img-<service>}. Services
     * that are never laid out automatically are left out.
     */
    public static Map<ServiceRole, String> images() {
        Map<ServiceRole, String> images = new EnumMap<>(ServiceRole.class);
        for (ServiceRole role : ServiceRole.values()) {
            if (role != ServiceRole.RESHARD) {
                images.put(role, image(role));
            }
        }
        return images;
    }

    public static String image(ServiceRole role) {
        return "img-" + role.getServiceName();
    }
}
