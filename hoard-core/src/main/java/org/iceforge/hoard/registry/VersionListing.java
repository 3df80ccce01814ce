package org.iceforge.hoard.registry;

import java.util.List;

public record VersionListing(String modelId, String currentVersion, List<ModelVersionRecord> versions,
                             int totalVersions) {
    public VersionListing {
        versions = List.copyOf(versions);
    }
}
