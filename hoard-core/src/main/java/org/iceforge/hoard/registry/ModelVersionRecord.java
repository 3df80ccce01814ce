package org.iceforge.hoard.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable version of a model. Only {@code active} and {@code activatedAt}
 * ever change, and only through {@link ModelRegistryEntry#activate}.
 *
 * @param blobLocation blob path relative to the registry root
 * @param metadata     producer-supplied metadata, may contain a {@code metrics} map
 */
public record ModelVersionRecord(
        String modelId,
        String versionId,
        int versionNumber,
        String versionTag,
        String blobLocation,
        String contentHash,
        Instant createdAt,
        Map<String, Object> metadata,
        @JsonProperty("is_active") boolean active,
        Instant activatedAt
) {
    public ModelVersionRecord {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(blobLocation, "blobLocation");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    ModelVersionRecord withActive(boolean isActive, Instant at) {
        return new ModelVersionRecord(modelId, versionId, versionNumber, versionTag, blobLocation, contentHash,
                createdAt, metadata, isActive, at);
    }
}
