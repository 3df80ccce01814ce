package org.iceforge.hoard.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request body shared by the registry routes and the CLI. Each operation reads
 * only the fields it needs.
 */
public record VersionRequest(
        String modelId,
        String modelPath,
        String versionTag,
        Map<String, Object> metadata,
        Boolean activate,
        String versionId,
        @JsonProperty("version_id_1") String versionId1,
        @JsonProperty("version_id_2") String versionId2
) {
    public static final VersionRequest EMPTY = new VersionRequest(null, null, null, null, null, null, null, null);

    public boolean activateRequested() {
        return Boolean.TRUE.equals(activate);
    }
}
