package fr.lapetina.fleet.layout.domain.layout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import fr.lapetina.fleet.layout.domain.model.FleetConfig;
import fr.lapetina.fleet.layout.domain.model.ServiceConfiguration;
import fr.lapetina.fleet.layout.domain.model.ServiceRole;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the per-zone layout document consumed by the deployment tooling.
 *
 * <pre>{@code
 * {
 *     "<server id>": {
 *         "<service>": [ { "shard": 1, "image_uuid": "...", "count": 1 } ]
 *     }
 * }
 * }</pre>
 *
 * Metadata servers come first, then storage servers, each in load order.
 * Services are sorted by name. Output is byte-for-byte stable for a given
 * layout so operators can diff generated files.
 */
final class LayoutSerializer {

    private static final ObjectWriter WRITER = createWriter();

    private LayoutSerializer() {
        // Utility class
    }

    static String serialize(Layout layout, String azName) {
        Map<String, Object> document = toDocument(layout, azName);
        try {
            return WRITER.writeValueAsString(document) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize layout for " + azName, e);
        }
    }

    static Map<String, Object> toDocument(Layout layout, String azName) {
        FleetConfig config = layout.getConfig();
        List<String> serverIds = new ArrayList<>(config.getMetadataServers());
        serverIds.addAll(config.getStorageServers());

        Map<String, Object> document = new LinkedHashMap<>();
        for (String serverId : serverIds) {
            if (!config.azOf(serverId).equals(azName)) {
                continue;
            }

            List<Map.Entry<ServiceRole, ServiceConfiguration>> services =
                    new ArrayList<>(layout.getServerConfigurations(serverId).entrySet());
            services.sort(Comparator.comparing(entry -> entry.getKey().getServiceName()));

            Map<String, Object> byService = new LinkedHashMap<>();
            for (Map.Entry<ServiceRole, ServiceConfiguration> entry : services) {
                byService.put(entry.getKey().getServiceName(), entry.getValue().summary());
            }
            document.put(serverId, byService);
        }
        return document;
    }

    private static ObjectWriter createWriter() {
        DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
                        .withObjectEmptySeparator("")
                        .withArrayEmptySeparator(""));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return new ObjectMapper().writer(printer);
    }
}
