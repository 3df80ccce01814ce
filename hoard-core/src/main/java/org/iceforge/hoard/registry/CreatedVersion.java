package org.iceforge.hoard.registry;

public record CreatedVersion(String modelId, ModelVersionRecord versionInfo, int totalVersions) {}
