package org.iceforge.hoard.registry;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * The {@code versions_metadata.json} document.
 */
public class RegistryDocument {

    private Map<String, ModelRegistryEntry> models = new TreeMap<>();
    private Instant createdAt;

    public Map<String, ModelRegistryEntry> getModels() {
        return models;
    }

    public void setModels(Map<String, ModelRegistryEntry> models) {
        this.models = models == null ? new TreeMap<>() : new TreeMap<>(models);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
