package org.iceforge.hoard.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.hoard.hash.HashVerifier;
import org.iceforge.hoard.result.ErrorKind;
import org.iceforge.hoard.result.OperationResult;
import org.iceforge.hoard.serial.ArtifactSerializationException;
import org.iceforge.hoard.serial.ArtifactSerializer;
import org.iceforge.hoard.store.BlobFiles;
import org.iceforge.hoard.store.JsonMetadataStore;
import org.iceforge.hoard.store.LockService;
import org.iceforge.hoard.store.StoreUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-model history of immutable, integrity-checked version blobs with exactly
 * one active version.
 *
 * <p>Version states: created, active, inactive, deleted. A version becomes active
 * on creation (first version, or when requested) or by {@link #rollback}; activating
 * one deactivates the previous one. Only inactive versions can be deleted. Version
 * numbers are never reused.
 *
 * <p>Every mutation is a locked read-modify-write of the metadata document. Reads
 * re-hash the stored blob before returning it.
 */
public class VersionRegistry {

    private static final Logger log = LoggerFactory.getLogger(VersionRegistry.class);

    /** Metadata flag that asks {@code createVersion} to activate the new version. */
    public static final String SET_AS_CURRENT = "set_as_current";
    static final String METRICS_KEY = "metrics";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    @FunctionalInterface
    private interface BlobWriter {
        void write(Path target) throws IOException;
    }

    private record Removal(OperationResult<DeletedVersion> result, String blobLocation) {}

    private final RegistrySettings settings;
    private final HashVerifier hasher;
    private final ObjectMapper mapper;
    private final JsonMetadataStore<RegistryDocument> store;
    private final Clock clock;

    public VersionRegistry(RegistrySettings settings,
                           HashVerifier hasher,
                           ObjectMapper mapper,
                           LockService locks,
                           Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.store = new JsonMetadataStore<>(settings.metadataFile(), RegistryDocument.class,
                this::emptyDocument, mapper, locks);
        try {
            Files.createDirectories(settings.versionsDir());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create versions directory: " + settings.versionsDir(), e);
        }
    }

    private RegistryDocument emptyDocument() {
        RegistryDocument doc = new RegistryDocument();
        doc.setCreatedAt(clock.instant());
        return doc;
    }

    public RegistrySettings settings() {
        return settings;
    }

    /**
     * Registers a copy of {@code blobSource} as the next version of {@code modelId}.
     * The new version is activated if it is the model's first, or if
     * {@code metadata} contains {@code "set_as_current": true}.
     */
    public OperationResult<CreatedVersion> createVersion(String modelId, Path blobSource, String tag,
                                                         Map<String, ?> metadata) {
        return createVersion(modelId, blobSource, tag, metadata, requestsActivation(metadata));
    }

    public OperationResult<CreatedVersion> createVersion(String modelId, Path blobSource, String tag,
                                                         Map<String, ?> metadata, boolean activate) {
        Objects.requireNonNull(blobSource, "blobSource");
        if (!Files.isRegularFile(blobSource)) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Model file not found: " + blobSource);
        }
        return register(modelId, target -> BlobFiles.copyAtomically(blobSource, target), tag, metadata, activate);
    }

    public OperationResult<CreatedVersion> createVersion(String modelId, byte[] blob, String tag,
                                                         Map<String, ?> metadata, boolean activate) {
        Objects.requireNonNull(blob, "blob");
        return register(modelId, target -> BlobFiles.writeAtomically(target, blob), tag, metadata, activate);
    }

    public <A> OperationResult<CreatedVersion> createVersion(String modelId, A artifact,
                                                             ArtifactSerializer<A> serializer, String tag,
                                                             Map<String, ?> metadata, boolean activate) {
        byte[] blob;
        try {
            blob = serializer.serialize(artifact);
        } catch (ArtifactSerializationException e) {
            return OperationResult.failure(ErrorKind.SERIALIZATION_ERROR, e.getMessage());
        }
        return createVersion(modelId, blob, tag, metadata, activate);
    }

    private OperationResult<CreatedVersion> register(String modelId, BlobWriter writer, String tag,
                                                  Map<String, ?> metadata, boolean activate) {
        if (!VersionIds.isValidModelId(modelId)) {
            return invalidModelId(modelId);
        }
        Map<String, Object> extra;
        try {
            extra = metadata == null ? Map.of() : mapper.convertValue(metadata, METADATA_TYPE);
        } catch (IllegalArgumentException e) {
            return OperationResult.failure(ErrorKind.INVALID_OPERATION, "Unsupported metadata: " + e.getMessage());
        }

        try {
            CreatedVersion created = store.update(doc -> {
                Instant now = clock.instant();
                ModelRegistryEntry entry = doc.getModels().computeIfAbsent(modelId, id -> new ModelRegistryEntry(now));
                int number = entry.nextVersionNumber();
                String versionId = VersionIds.format(number);
                String location = RegistrySettings.blobLocation(modelId, versionId);
                Path target = resolve(location);
                boolean makeActive = activate || entry.getCurrentVersion() == null;
                try {
                    writer.write(target);
                    String contentHash = hasher.hash(target);
                    entry.add(new ModelVersionRecord(modelId, versionId, number, tag, location, contentHash,
                            now, extra, false, null));
                    if (makeActive) {
                        entry.activate(versionId, now);
                    }
                } catch (IOException | RuntimeException e) {
                    discardVersionDir(target.getParent(), e);
                    throw e;
                }
                CreatedVersion result = new CreatedVersion(modelId, entry.find(versionId).orElseThrow(),
                        entry.getVersions().size());
                if (!makeActive) {
                    return StoreUpdate.changed(result);
                }
                // serving copy follows the persisted activation
                return StoreUpdate.changed(result,
                        () -> BlobFiles.copyAtomically(target, settings.servingPath(modelId)));
            });
            log.info("Created version {} of model {} (active={})", created.versionInfo().versionId(), modelId,
                    created.versionInfo().active());
            return OperationResult.ok(created);
        } catch (IOException e) {
            log.warn("Failed to create version of model {}: {}", modelId, e.toString());
            return OperationResult.failure(ErrorKind.IO_FAILURE, "Failed to create version: " + e.getMessage());
        }
    }

    public OperationResult<List<String>> listModels() {
        try {
            return OperationResult.ok(List.copyOf(store.read().getModels().keySet()));
        } catch (IOException e) {
            return unreadable(e);
        }
    }

    public OperationResult<VersionListing> listVersions(String modelId) {
        if (!VersionIds.isValidModelId(modelId)) {
            return invalidModelId(modelId);
        }
        RegistryDocument doc;
        try {
            doc = store.read();
        } catch (IOException e) {
            return unreadable(e);
        }
        ModelRegistryEntry entry = doc.getModels().get(modelId);
        if (entry == null) {
            return modelNotFound(modelId);
        }
        return OperationResult.ok(new VersionListing(modelId, entry.getCurrentVersion(), entry.getVersions(),
                entry.getVersions().size()));
    }

    /**
     * Returns the version record after re-hashing its blob.
     */
    public OperationResult<ModelVersionRecord> getVersion(String modelId, String versionId) {
        OperationResult<ModelVersionRecord> found = lookup(modelId, versionId);
        return found.isSuccess() ? verify(found.value()) : found;
    }

    public OperationResult<ModelVersionRecord> getActiveVersion(String modelId) {
        OperationResult<VersionListing> listing = listVersions(modelId);
        if (!listing.isSuccess()) {
            return listing.propagate();
        }
        String current = listing.value().currentVersion();
        if (current == null) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Model " + modelId + " has no active version");
        }
        return getVersion(modelId, current);
    }

    /**
     * Reads and decodes a version's blob. The digest is checked against the bytes
     * actually decoded.
     */
    public <A> OperationResult<A> loadArtifact(String modelId, String versionId, ArtifactSerializer<A> serializer) {
        Objects.requireNonNull(serializer, "serializer");
        OperationResult<ModelVersionRecord> found = lookup(modelId, versionId);
        if (!found.isSuccess()) {
            return found.propagate();
        }
        ModelVersionRecord record = found.value();
        byte[] blob;
        try {
            blob = Files.readAllBytes(resolve(record.blobLocation()));
        } catch (NoSuchFileException e) {
            return blobMissing(record);
        } catch (IOException e) {
            return OperationResult.failure(ErrorKind.IO_FAILURE, "Failed to read model file: " + e.getMessage());
        }
        if (!hasher.verify(blob, record.contentHash())) {
            return integrityViolation(record);
        }
        try {
            return OperationResult.ok(serializer.deserialize(blob));
        } catch (ArtifactSerializationException e) {
            return OperationResult.failure(ErrorKind.SERIALIZATION_ERROR, e.getMessage());
        }
    }

    /**
     * Activates {@code versionId} after verifying its blob, deactivates the previous
     * active version and publishes the blob to the model's serving location.
     * Rolling back to the version that is already active changes nothing.
     */
    public OperationResult<RollbackResult> rollback(String modelId, String versionId) {
        if (!VersionIds.isValidModelId(modelId)) {
            return invalidModelId(modelId);
        }
        String vid = VersionIds.normalize(versionId);
        if (vid == null) {
            return badVersionId(modelId, versionId);
        }
        try {
            OperationResult<RollbackResult> result = store.update(doc -> {
                ModelRegistryEntry entry = doc.getModels().get(modelId);
                if (entry == null) {
                    return StoreUpdate.unchanged(modelNotFound(modelId));
                }
                Optional<ModelVersionRecord> target = entry.find(vid);
                if (target.isEmpty()) {
                    return StoreUpdate.unchanged(versionNotFound(modelId, vid));
                }
                OperationResult<ModelVersionRecord> verified = verify(target.get());
                if (!verified.isSuccess()) {
                    return StoreUpdate.unchanged(verified.propagate());
                }

                Instant now = clock.instant();
                Path blob = resolve(target.get().blobLocation());
                Path serving = settings.servingPath(modelId);
                String previous = entry.getCurrentVersion();
                RollbackResult rolledBack = new RollbackResult(modelId, vid, previous, serving.toString(), now);

                if (vid.equals(previous) && target.get().active()) {
                    if (!Files.exists(serving) || !hasher.verify(serving, target.get().contentHash())) {
                        BlobFiles.copyAtomically(blob, serving);
                    }
                    return StoreUpdate.unchanged(OperationResult.ok(rolledBack));
                }
                entry.activate(vid, now);
                return StoreUpdate.changed(OperationResult.ok(rolledBack),
                        () -> BlobFiles.copyAtomically(blob, serving));
            });
            if (result.isSuccess()) {
                log.info("Model {} rolled back to {} (was {})", modelId, vid, result.value().previousVersion());
            }
            return result;
        } catch (IOException e) {
            log.warn("Rollback of model {} to {} failed: {}", modelId, vid, e.toString());
            return OperationResult.failure(ErrorKind.IO_FAILURE, "Rollback failed: " + e.getMessage());
        }
    }

    public OperationResult<VersionComparison> compareVersions(String modelId, String versionId1, String versionId2) {
        OperationResult<ModelVersionRecord> v1 = getVersion(modelId, versionId1);
        if (!v1.isSuccess()) {
            return v1.propagate();
        }
        OperationResult<ModelVersionRecord> v2 = getVersion(modelId, versionId2);
        if (!v2.isSuccess()) {
            return v2.propagate();
        }
        Map<String, Object> m1 = v1.value().metadata();
        Map<String, Object> m2 = v2.value().metadata();
        return OperationResult.ok(new VersionComparison(
                modelId,
                VersionComparison.Summary.of(v1.value()),
                VersionComparison.Summary.of(v2.value()),
                numericDeltas(m1, m2),
                numericDeltas(asMap(m1.get(METRICS_KEY)), asMap(m2.get(METRICS_KEY)))));
    }

    /**
     * Removes an inactive version and its blob. Remaining versions keep their numbers.
     */
    public OperationResult<DeletedVersion> deleteVersion(String modelId, String versionId) {
        if (!VersionIds.isValidModelId(modelId)) {
            return invalidModelId(modelId);
        }
        String vid = VersionIds.normalize(versionId);
        if (vid == null) {
            return badVersionId(modelId, versionId);
        }
        Removal removal;
        try {
            removal = store.update(doc -> {
                ModelRegistryEntry entry = doc.getModels().get(modelId);
                if (entry == null) {
                    return StoreUpdate.unchanged(new Removal(modelNotFound(modelId), null));
                }
                Optional<ModelVersionRecord> target = entry.find(vid);
                if (target.isEmpty()) {
                    return StoreUpdate.unchanged(new Removal(versionNotFound(modelId, vid), null));
                }
                if (target.get().active() || vid.equals(entry.getCurrentVersion())) {
                    return StoreUpdate.unchanged(new Removal(OperationResult.failure(ErrorKind.INVALID_OPERATION,
                            "Cannot delete active version. Rollback to a different version first."), null));
                }
                entry.remove(vid);
                return StoreUpdate.changed(new Removal(
                        OperationResult.ok(new DeletedVersion(modelId, vid, entry.getVersions().size())),
                        target.get().blobLocation()));
            });
        } catch (IOException e) {
            log.warn("Deleting version {} of model {} failed: {}", vid, modelId, e.toString());
            return OperationResult.failure(ErrorKind.IO_FAILURE, "Delete failed: " + e.getMessage());
        }

        if (removal.blobLocation() != null) {
            Path versionDir = resolve(removal.blobLocation()).getParent();
            try {
                BlobFiles.deleteRecursively(versionDir);
            } catch (IOException e) {
                log.warn("Version {} of model {} removed from registry but {} could not be deleted: {}",
                        vid, modelId, versionDir, e.toString());
            }
            log.info("Deleted version {} of model {}", vid, modelId);
        }
        return removal.result();
    }

    private OperationResult<ModelVersionRecord> lookup(String modelId, String versionId) {
        if (!VersionIds.isValidModelId(modelId)) {
            return invalidModelId(modelId);
        }
        String vid = VersionIds.normalize(versionId);
        if (vid == null) {
            return badVersionId(modelId, versionId);
        }
        RegistryDocument doc;
        try {
            doc = store.read();
        } catch (IOException e) {
            return unreadable(e);
        }
        ModelRegistryEntry entry = doc.getModels().get(modelId);
        if (entry == null) {
            return modelNotFound(modelId);
        }
        return entry.find(vid)
                .map(OperationResult::ok)
                .orElseGet(() -> versionNotFound(modelId, vid));
    }

    private OperationResult<ModelVersionRecord> verify(ModelVersionRecord record) {
        try {
            if (!hasher.verify(resolve(record.blobLocation()), record.contentHash())) {
                return integrityViolation(record);
            }
            return OperationResult.ok(record);
        } catch (NoSuchFileException e) {
            return blobMissing(record);
        } catch (IOException e) {
            return OperationResult.failure(ErrorKind.IO_FAILURE, "Failed to read model file: " + e.getMessage());
        }
    }

    private Path resolve(String location) {
        return BlobFiles.resolveInside(settings.rootDir(), location);
    }

    private void discardVersionDir(Path versionDir, Exception cause) {
        try {
            BlobFiles.deleteRecursively(versionDir);
        } catch (IOException cleanup) {
            cause.addSuppressed(cleanup);
        }
    }

    static boolean requestsActivation(Map<String, ?> metadata) {
        if (metadata == null) {
            return false;
        }
        Object flag = metadata.get(SET_AS_CURRENT);
        return Boolean.TRUE.equals(flag) || (flag instanceof String s && Boolean.parseBoolean(s));
    }

    static Map<String, VersionComparison.NumericDelta> numericDeltas(Map<String, ?> m1, Map<String, ?> m2) {
        Map<String, VersionComparison.NumericDelta> out = new TreeMap<>();
        for (Map.Entry<String, ?> e : m1.entrySet()) {
            if (!m2.containsKey(e.getKey())) {
                continue;
            }
            Double a = toNumber(e.getValue());
            Double b = toNumber(m2.get(e.getKey()));
            if (a != null && b != null) {
                out.put(e.getKey(), VersionComparison.NumericDelta.between(a, b));
            }
        }
        return out;
    }

    private static Double toNumber(Object v) {
        Double d = null;
        if (v instanceof Number n) {
            d = n.doubleValue();
        } else if (v instanceof String s) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException ignored) {
                // not numeric, left out of the diff
            }
        }
        return d != null && Double.isFinite(d) ? d : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asMap(Object v) {
        return v instanceof Map<?, ?> m ? (Map<String, ?>) m : Map.of();
    }

    private static <T> OperationResult<T> invalidModelId(String modelId) {
        return OperationResult.failure(ErrorKind.INVALID_OPERATION, "Invalid model id: " + modelId);
    }

    private static <T> OperationResult<T> modelNotFound(String modelId) {
        return OperationResult.failure(ErrorKind.NOT_FOUND, "Model " + modelId + " not found");
    }

    private static <T> OperationResult<T> versionNotFound(String modelId, String versionId) {
        return OperationResult.failure(ErrorKind.NOT_FOUND,
                "Version " + versionId + " not found for model " + modelId);
    }

    private static <T> OperationResult<T> badVersionId(String modelId, String versionId) {
        return versionId == null
                ? OperationResult.failure(ErrorKind.INVALID_OPERATION, "Version id is required")
                : versionNotFound(modelId, versionId);
    }

    private static <T> OperationResult<T> blobMissing(ModelVersionRecord record) {
        return OperationResult.failure(ErrorKind.NOT_FOUND, "Model file not found: " + record.blobLocation());
    }

    private static <T> OperationResult<T> integrityViolation(ModelVersionRecord record) {
        log.warn("Integrity check failed for {} {}", record.modelId(), record.versionId());
        return OperationResult.failure(ErrorKind.INTEGRITY_VIOLATION,
                "Model integrity check failed - file may be corrupted");
    }

    private static <T> OperationResult<T> unreadable(IOException e) {
        return OperationResult.failure(ErrorKind.IO_FAILURE, "Registry metadata unreadable: " + e.getMessage());
    }
}
