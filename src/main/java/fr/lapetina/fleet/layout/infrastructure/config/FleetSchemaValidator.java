package fr.lapetina.fleet.layout.infrastructure.config;

import fr.lapetina.fleet.layout.domain.model.ServerRole;
import fr.lapetina.fleet.layout.domain.model.ServiceRole;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates the raw structure of a fleet description, as parsed from JSON or
 * YAML or passed in directly.
 *
 * Expected shape:
 * <pre>{@code
 * {
 *     "nshards": 1..1024,                       (required)
 *     "images": { "<service>": "<image>" },     (optional)
 *     "servers": [                              (required, non-empty)
 *         {
 *             "type": "metadata" | "storage",   (required)
 *             "uuid": "<non-empty string>",     (required)
 *             "memory": 1..1024,                (required, gigabytes)
 *             "rack": "<non-empty string>",     (optional)
 *             "az": "<non-empty string>"        (optional)
 *         }
 *     ]
 * }
 * }</pre>
 *
 * No other properties are allowed. Validation stops at the first problem.
 */
final class FleetSchemaValidator {

    static final String NSHARDS = "nshards";
    static final String IMAGES = "images";
    static final String SERVERS = "servers";
    static final String TYPE = "type";
    static final String UUID = "uuid";
    static final String MEMORY = "memory";
    static final String RACK = "rack";
    static final String AZ = "az";

    static final int MAX_SHARDS = 1024;
    static final int MAX_MEMORY_GB = 1024;

    private static final Set<String> TOP_LEVEL_PROPERTIES = Set.of(NSHARDS, IMAGES, SERVERS);
    private static final Set<String> SERVER_PROPERTIES = Set.of(TYPE, UUID, MEMORY, RACK, AZ);

    private FleetSchemaValidator() {
        // Utility class
    }

    /**
     * @throws FleetConfigException with kind {@code SCHEMA} on the first violation
     */
    static void validate(Object parsed) {
        if (!(parsed instanceof Map)) {
            throw violation("fleet description must be an object");
        }
        Map<?, ?> root = (Map<?, ?>) parsed;

        checkProperties(root, TOP_LEVEL_PROPERTIES, "");
        checkInteger(root, NSHARDS, "", 1, MAX_SHARDS);

        Object servers = root.get(SERVERS);
        if (servers == null) {
            throw violation("property \"servers\": is missing and it is required");
        }
        if (!(servers instanceof List)) {
            throw violation("property \"servers\": array value expected");
        }
        List<?> serverList = (List<?>) servers;
        if (serverList.isEmpty()) {
            throw violation("property \"servers\": must contain at least 1 item");
        }
        for (int i = 0; i < serverList.size(); i++) {
            validateServer(serverList.get(i), "servers[" + i + "].");
        }

        if (root.containsKey(IMAGES)) {
            validateImages(root.get(IMAGES));
        }
    }

    private static void validateServer(Object value, String prefix) {
        if (!(value instanceof Map)) {
            throw violation("property \"" + prefix.substring(0, prefix.length() - 1) + "\": object value expected");
        }
        Map<?, ?> server = (Map<?, ?>) value;

        checkProperties(server, SERVER_PROPERTIES, prefix);

        String type = checkString(server, TYPE, prefix, true);
        if (ServerRole.fromToken(type).isEmpty()) {
            throw violation("property \"" + prefix + TYPE + "\": value must be one of \"metadata\", \"storage\"");
        }
        checkString(server, UUID, prefix, true);
        checkInteger(server, MEMORY, prefix, 1, MAX_MEMORY_GB);
        checkString(server, RACK, prefix, false);
        checkString(server, AZ, prefix, false);
    }

    private static void validateImages(Object value) {
        if (!(value instanceof Map)) {
            throw violation("property \"images\": object value expected");
        }
        Map<?, ?> images = (Map<?, ?>) value;
        for (Map.Entry<?, ?> entry : images.entrySet()) {
            String service = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof String)) {
                throw violation("images[" + service + "]: not a string");
            }
            if (!ServiceRole.isValidServiceName(service)) {
                throw violation("images[" + service + "]: invalid service name");
            }
        }
    }

    private static void checkProperties(Map<?, ?> object, Set<String> allowed, String prefix) {
        for (Object key : object.keySet()) {
            if (!(key instanceof String) || !allowed.contains(key)) {
                throw violation("property \"" + prefix + key + "\": unsupported property");
            }
        }
    }

    private static String checkString(Map<?, ?> object, String property, String prefix, boolean required) {
        Object value = object.get(property);
        if (value == null) {
            if (required || object.containsKey(property)) {
                throw violation("property \"" + prefix + property + "\": is missing and it is required");
            }
            return null;
        }
        if (!(value instanceof String)) {
            throw violation("property \"" + prefix + property + "\": string value expected");
        }
        String text = (String) value;
        if (text.isEmpty()) {
            throw violation("property \"" + prefix + property + "\": string must have length at least 1");
        }
        return text;
    }

    private static void checkInteger(Map<?, ?> object, String property, String prefix, long min, long max) {
        Object value = object.get(property);
        if (value == null) {
            throw violation("property \"" + prefix + property + "\": is missing and it is required");
        }
        if (!isInteger(value)) {
            throw violation("property \"" + prefix + property + "\": integer value expected");
        }
        BigInteger number = new BigInteger(value.toString());
        if (number.compareTo(BigInteger.valueOf(min)) < 0) {
            throw violation("property \"" + prefix + property + "\": value " + number
                    + " is less than minimum " + min);
        }
        if (number.compareTo(BigInteger.valueOf(max)) > 0) {
            throw violation("property \"" + prefix + property + "\": value " + number
                    + " is greater than maximum " + max);
        }
    }

    private static boolean isInteger(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    private static FleetConfigException violation(String message) {
        return new FleetConfigException(FleetConfigException.Kind.SCHEMA, message);
    }
}
