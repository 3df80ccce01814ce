package org.iceforge.hoard.registry;

import java.time.Instant;

/**
 * @param previousVersion version that was active before, equal to {@code rolledBackTo} for a no-op rollback
 * @param servingPath     where the activated blob was published
 */
public record RollbackResult(String modelId, String rolledBackTo, String previousVersion, String servingPath,
                             Instant timestamp) {}
