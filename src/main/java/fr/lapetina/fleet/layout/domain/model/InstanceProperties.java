package fr.lapetina.fleet.layout.domain.model;

import java.util.Objects;

/**
 * Properties that distinguish one group of service instances from another.
 * Instances with equal properties are counted together.
 *
 * @param shard shard number, or null for services that are not sharded
 * @param image image identifier the instances run
 */
public record InstanceProperties(Integer shard, String image) {
    public InstanceProperties {
        Objects.requireNonNull(image, "Image is required");
        if (shard != null && shard <= 0) {
            throw new IllegalArgumentException("Shard numbers start at 1: " + shard);
        }
    }

    public static InstanceProperties ofImage(String image) {
        return new InstanceProperties(null, image);
    }

    public static InstanceProperties ofShard(int shard, String image) {
        return new InstanceProperties(shard, image);
    }

    public boolean isSharded() {
        return shard != null;
    }
}
