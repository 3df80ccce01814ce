package org.iceforge.hoard.registry;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Layout of a {@link VersionRegistry} root:
 * <pre>
 *   {root}/versions/versions_metadata.json
 *   {root}/versions/{modelId}/{versionId}/{modelId}.blob
 *   {root}/{modelId}.blob                      serving copy of the active version
 * </pre>
 */
public record RegistrySettings(Path rootDir) {

    static final String VERSIONS_DIR = "versions";
    static final String METADATA_FILE = "versions_metadata.json";
    static final String BLOB_SUFFIX = ".blob";

    public RegistrySettings {
        Objects.requireNonNull(rootDir, "rootDir");
        rootDir = rootDir.toAbsolutePath().normalize();
    }

    public Path versionsDir() {
        return rootDir.resolve(VERSIONS_DIR);
    }

    public Path metadataFile() {
        return versionsDir().resolve(METADATA_FILE);
    }

    public Path servingPath(String modelId) {
        return rootDir.resolve(modelId + BLOB_SUFFIX);
    }

    static String blobLocation(String modelId, String versionId) {
        return VERSIONS_DIR + "/" + modelId + "/" + versionId + "/" + modelId + BLOB_SUFFIX;
    }
}
