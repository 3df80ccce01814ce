package org.iceforge.hoard.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Numeric differences between two versions of a model. Keys that are missing on
 * either side, or whose values are not numeric, are left out of the deltas.
 */
public record VersionComparison(
        String modelId,
        Summary version1,
        Summary version2,
        Map<String, NumericDelta> metadataDeltas,
        Map<String, NumericDelta> metricDeltas
) {
    public record Summary(String versionId, String versionTag, Instant createdAt,
                          Map<String, Object> metadata, @JsonProperty("is_active") boolean active) {

        static Summary of(ModelVersionRecord r) {
            return new Summary(r.versionId(), r.versionTag(), r.createdAt(), r.metadata(), r.active());
        }
    }

    /**
     * @param percentChange {@code difference / version1 * 100}, or null when {@code version1} is zero
     */
    public record NumericDelta(double version1, double version2, double difference, Double percentChange) {

        static NumericDelta between(double v1, double v2) {
            double diff = v2 - v1;
            return new NumericDelta(v1, v2, diff, v1 == 0.0 ? null : diff / v1 * 100.0);
        }
    }
}
