package org.iceforge.hoard.registry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Version history of one model. Versions are kept in creation order; at most one
 * is active, and {@code currentVersion} names it.
 */
public class ModelRegistryEntry {

    private List<ModelVersionRecord> versions = new ArrayList<>();
    private String currentVersion;
    private int lastVersionNumber;
    private Instant createdAt;

    public ModelRegistryEntry() {
    }

    public ModelRegistryEntry(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public List<ModelVersionRecord> getVersions() {
        return versions;
    }

    public void setVersions(List<ModelVersionRecord> versions) {
        this.versions = versions == null ? new ArrayList<>() : new ArrayList<>(versions);
    }

    public String getCurrentVersion() {
        return currentVersion;
    }

    public void setCurrentVersion(String currentVersion) {
        this.currentVersion = currentVersion;
    }

    public int getLastVersionNumber() {
        return lastVersionNumber;
    }

    public void setLastVersionNumber(int lastVersionNumber) {
        this.lastVersionNumber = lastVersionNumber;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    /**
     * Next number to hand out. Numbers of deleted versions are never reused.
     */
    int nextVersionNumber() {
        int highest = lastVersionNumber;
        for (ModelVersionRecord v : versions) {
            highest = Math.max(highest, v.versionNumber());
        }
        return highest + 1;
    }

    Optional<ModelVersionRecord> find(String versionId) {
        return versions.stream().filter(v -> v.versionId().equals(versionId)).findFirst();
    }

    void add(ModelVersionRecord record) {
        versions.add(record);
        lastVersionNumber = Math.max(lastVersionNumber, record.versionNumber());
    }

    /**
     * Makes {@code versionId} the only active version.
     */
    void activate(String versionId, Instant at) {
        for (int i = 0; i < versions.size(); i++) {
            ModelVersionRecord v = versions.get(i);
            if (v.versionId().equals(versionId)) {
                versions.set(i, v.withActive(true, at));
            } else if (v.active()) {
                versions.set(i, v.withActive(false, v.activatedAt()));
            }
        }
        currentVersion = versionId;
    }

    boolean remove(String versionId) {
        return versions.removeIf(v -> v.versionId().equals(versionId));
    }
}
