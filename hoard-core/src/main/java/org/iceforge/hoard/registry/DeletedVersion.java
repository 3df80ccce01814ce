package org.iceforge.hoard.registry;

public record DeletedVersion(String modelId, String deletedVersion, int remainingVersions) {}
