package org.iceforge.hoard.registry;

import org.iceforge.hoard.store.BlobFiles;

import java.util.regex.Pattern;

/**
 * Identifier rules. Model and version ids become path segments, so only a
 * conservative character set is accepted.
 */
final class VersionIds {
    private VersionIds() {}

    private static final Pattern MODEL_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");
    private static final Pattern VERSION_ID = Pattern.compile("v?([1-9][0-9]{0,8})");

    /**
     * Model directories share {@code versions/} with the metadata document, so its
     * lock sidecar and atomic-write temp names are reserved.
     */
    static boolean isValidModelId(String modelId) {
        return modelId != null && MODEL_ID.matcher(modelId).matches() && !modelId.contains("..")
                && !isReservedName(modelId);
    }

    private static boolean isReservedName(String name) {
        return name.startsWith(RegistrySettings.METADATA_FILE)
                || (name.startsWith(BlobFiles.TEMP_PREFIX) && name.endsWith(BlobFiles.TEMP_SUFFIX));
    }

    static String format(int versionNumber) {
        return "v" + versionNumber;
    }

    /**
     * Accepts {@code "v3"} or {@code "3"}; returns {@code "v3"}, or null if malformed.
     */
    static String normalize(String versionId) {
        if (versionId == null) {
            return null;
        }
        var m = VERSION_ID.matcher(versionId.trim());
        return m.matches() ? format(Integer.parseInt(m.group(1))) : null;
    }
}
