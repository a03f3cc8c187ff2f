package mediaflow.stage;

import mediaflow.ai.InferenceGateway;
import mediaflow.error.FailureKind;
import mediaflow.util.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Best-effort removal of local and remote artifacts. Failures are logged, never thrown.
 *
 * <p>Content blocked for safety reasons is kept; when an audit directory is configured it
 * is also copied there next to a JSON metadata file.
 */
public final class ArtifactCleaner {
    private static final Logger logger = Logger.getLogger(ArtifactCleaner.class.getName());

    private final InferenceGateway gateway;
    private final Path auditDirectory;
    private final JsonCodec codec;
    private final Clock clock;

    /**
     * @param gateway        used for remote deletions
     * @param auditDirectory where blocked content is copied, or {@code null} to only keep it in place
     * @param codec          codec for the metadata file
     * @param clock          clock for the metadata timestamp
     */
    public ArtifactCleaner(InferenceGateway gateway, Path auditDirectory, JsonCodec codec, Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.auditDirectory = auditDirectory;
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Deletes the job's local content and its remote file, if any.
     */
    public void cleanup(StageJob job) {
        deleteLocal(job.media().contentRef());
        job.remoteFile().ifPresent(file -> gateway.deleteQuietly(file.name()));
    }

    public boolean deleteLocal(String contentRef) {
        if (contentRef == null) {
            return false;
        }
        try {
            return Files.deleteIfExists(Path.of(contentRef));
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Failed to delete local file " + contentRef, e);
            return false;
        }
    }

    /**
     * Keeps the content of a blocked job and copies it to the audit directory.
     *
     * @return the archived copy, or {@code null} if nothing was copied
     */
    public Path archiveBlocked(StageJob job, FailureKind kind) {
        Path source = Path.of(job.media().contentRef());
        if (auditDirectory == null || !Files.exists(source)) {
            logger.log(Level.INFO, "Keeping blocked content for {0} at {1}",
                    new Object[]{job.route().transactionId(), source});
            return null;
        }
        String baseName = job.route().transactionId() + "-" + source.getFileName();
        Path copy = auditDirectory.resolve(baseName);
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("transactionId", job.route().transactionId());
        metadata.put("conversationId", job.route().conversationId());
        metadata.put("classification", kind.code());
        metadata.put("mimeType", job.media().mimeType() == null ? "" : job.media().mimeType());
        metadata.put("source", source.toString());
        metadata.put("blockedAt", clock.instant().toString());
        try {
            Files.createDirectories(auditDirectory);
            Files.copy(source, copy, StandardCopyOption.REPLACE_EXISTING);
            Files.writeString(auditDirectory.resolve(baseName + ".json"), codec.encode(metadata),
                    StandardCharsets.UTF_8);
            logger.log(Level.INFO, "Archived blocked content for {0} to {1}",
                    new Object[]{job.route().transactionId(), copy});
            return copy;
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Failed to archive blocked content " + source, e);
            return null;
        }
    }
}
