package fr.lapetina.fleet.layout.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Count of service instances, grouped by distinct {@link InstanceProperties}.
 *
 * For most services the properties are just the image, which gives a count
 * of instances per image. For sharded services the shard number is part of
 * the properties, so counts are kept per (shard, image) pair.
 *
 * A configuration is kept per service per server, per service per
 * availability zone, and per service for the whole region. Buckets are kept
 * in the order they were first seen; few distinct buckets are expected.
 */
public final class ServiceConfiguration {

    static final String KEY_SHARD = "shard";
    static final String KEY_IMAGE = "image_uuid";
    static final String KEY_COUNT = "count";

    private final ServiceRole role;
    private final List<Bucket> buckets = new ArrayList<>();

    public ServiceConfiguration(ServiceRole role) {
        this.role = Objects.requireNonNull(role, "Service role is required");
    }

    public ServiceRole getRole() {
        return role;
    }

    /**
     * Adds one instance having the given properties.
     */
    public void increment(InstanceProperties properties) {
        increment(properties, 1);
    }

    /**
     * Adds {@code count} instances having the given properties, merging into
     * an existing bucket when one has identical properties.
     */
    public void increment(InstanceProperties properties, int count) {
        Objects.requireNonNull(properties, "Properties are required");
        if (properties.isSharded() != role.isSharded()) {
            throw new IllegalArgumentException("Service " + role
                    + (role.isSharded() ? " requires" : " does not take") + " a shard number");
        }
        if (count <= 0) {
            throw new IllegalArgumentException("Count must be positive: " + count);
        }

        for (Bucket bucket : buckets) {
            if (bucket.properties.equals(properties)) {
                bucket.count += count;
                return;
            }
        }
        buckets.add(new Bucket(properties, count));
    }

    /**
     * Returns the number of instances having exactly the given properties.
     */
    public int count(InstanceProperties properties) {
        for (Bucket bucket : buckets) {
            if (bucket.properties.equals(properties)) {
                return bucket.count;
            }
        }
        return 0;
    }

    public boolean contains(InstanceProperties properties) {
        return count(properties) > 0;
    }

    /**
     * Total number of instances across all buckets.
     */
    public int total() {
        int total = 0;
        for (Bucket bucket : buckets) {
            total += bucket.count;
        }
        return total;
    }

    /**
     * Returns the distinct properties and their counts, in first-seen order.
     */
    public Map<InstanceProperties, Integer> buckets() {
        Map<InstanceProperties, Integer> view = new LinkedHashMap<>();
        for (Bucket bucket : buckets) {
            view.put(bucket.properties, bucket.count);
        }
        return Collections.unmodifiableMap(view);
    }

    /**
     * Returns the serializable summary: one entry per bucket with the shard
     * (sharded services only), the image and the count, in that key order.
     * Consumers of generated layouts rely on this shape.
     */
    public List<Map<String, Object>> summary() {
        List<Map<String, Object>> summary = new ArrayList<>(buckets.size());
        for (Bucket bucket : buckets) {
            Map<String, Object> entry = new LinkedHashMap<>();
            if (bucket.properties.isSharded()) {
                entry.put(KEY_SHARD, bucket.properties.shard());
            }
            entry.put(KEY_IMAGE, bucket.properties.image());
            entry.put(KEY_COUNT, bucket.count);
            summary.add(entry);
        }
        return summary;
    }

    @Override
    public String toString() {
        return "ServiceConfiguration{" + role + "=" + buckets() + '}';
    }

    private static final class Bucket {
        private final InstanceProperties properties;
        private int count;

        private Bucket(InstanceProperties properties, int count) {
            this.properties = properties;
            this.count = count;
        }
    }
}
