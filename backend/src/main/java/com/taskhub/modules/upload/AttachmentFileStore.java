package com.taskhub.modules.upload;

import com.taskhub.config.UploadProperties;
import com.taskhub.modules.upload.ratelimit.QuotaReservation;
import com.taskhub.modules.upload.ratelimit.RateLimitDecision;
import com.taskhub.modules.upload.ratelimit.UploadRateLimiter;
import com.taskhub.modules.upload.validation.FileClassifier;
import com.taskhub.modules.upload.validation.FileValidator;
import com.taskhub.modules.upload.validation.ValidationErrorKind;
import com.taskhub.modules.upload.validation.ValidationFailure;
import com.taskhub.modules.upload.validation.ValidationOutcome;
import com.taskhub.service.storage.LocalStorageServiceImpl;
import com.taskhub.service.storage.StorageException;
import com.taskhub.service.storage.StorageService;
import com.taskhub.service.storage.StoredObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Writes attachments to {@code {root}/tasks/{taskId}/{uuid}.{ext}} and keeps
 * the tree consistent: a file is either fully accepted and counted against
 * the uploader's quota, or removed again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttachmentFileStore {

    private static final String DEFAULT_MIME = "application/octet-stream";

    private final StorageService storageService;
    private final FileValidator fileValidator;
    private final UploadRateLimiter rateLimiter;
    private final UploadProperties properties;
    private final Clock clock;

    /**
     * Random name carrying only the original extension, e.g.
     * {@code 3f2b...-9c.pdf}. The original base name is never reused.
     */
    public String generateUniqueName(String originalName) {
        return UUID.randomUUID() + FileValidator.extensionOf(originalName);
    }

    public StoredFileRecord save(UploadRequest request) {
        return save(request, PostWriteCheck.NONE);
    }

    /**
     * Store one upload.
     * <ol>
     * <li>filename, executable header and declared size are checked before
     * anything is written</li>
     * <li>a quota slot is reserved (the max file size stands in for an unknown
     * size)</li>
     * <li>the stream is copied to a fresh unique path</li>
     * <li>the written size is re-checked, then {@code postWriteCheck} runs</li>
     * <li>the slot is committed with the real size, re-checking the byte
     * volume when the file turned out larger than declared</li>
     * </ol>
     * Any failure after the write starts removes the file and releases the slot.
     *
     * @throws UploadRejectedException on any rejection or I/O failure
     */
    public StoredFileRecord save(UploadRequest request, PostWriteCheck postWriteCheck) {
        String originalName = request.originalFilename();
        long maxFileSize = properties.getMaxFileSize();

        ValidationOutcome preWrite = fileValidator.checkFilename(originalName);
        if (request.sizeKnown() && request.declaredSize() > maxFileSize) {
            preWrite = preWrite.merge(tooLarge(request.declaredSize()));
        }

        BufferedInputStream content = new BufferedInputStream(request.content());
        byte[] header;
        try {
            content.mark(FileClassifier.HEADER_BYTES);
            header = content.readNBytes(FileClassifier.HEADER_BYTES);
            content.reset();
        } catch (IOException e) {
            log.error("Failed to read upload stream for {}: {}", originalName, e.getMessage());
            throw UploadRejectedException.storage("Error reading upload stream", e);
        }
        preWrite = preWrite.merge(fileValidator.checkHeader(header));
        if (!preWrite.accepted()) {
            log.warn("Upload rejected before write: task={}, user={}, reasons={}",
                    request.taskId(), request.uploaderId(), preWrite.reasons());
            throw UploadRejectedException.validation(preWrite);
        }

        long candidateSize = request.sizeKnown() ? request.declaredSize() : maxFileSize;
        RateLimitDecision decision = rateLimiter.reserve(request.uploaderId(), candidateSize);
        if (!decision.allowed()) {
            throw UploadRejectedException.rateLimited(decision);
        }
        QuotaReservation reservation = decision.reservation();

        String storedName = generateUniqueName(originalName);
        String key = LocalStorageServiceImpl.TASKS_DIR + "/" + request.taskId() + "/" + storedName;
        StoredObject stored = null;
        boolean committed = false;
        try {
            stored = storageService.write(content, key);

            if (stored.size() > maxFileSize) {
                throw UploadRejectedException.validation(tooLarge(stored.size()));
            }

            ValidationOutcome postWrite = postWriteCheck.verify(stored.path());
            if (!postWrite.accepted()) {
                throw UploadRejectedException.validation(postWrite);
            }

            RateLimitDecision settled = reservation.commit(stored.size());
            if (!settled.allowed()) {
                throw UploadRejectedException.rateLimited(settled);
            }
            committed = true;
            log.info("File saved successfully: {} ({} bytes, task={}, user={})",
                    stored.path(), stored.size(), request.taskId(), request.uploaderId());

            return StoredFileRecord.builder()
                    .storedFilename(storedName)
                    .originalFilename(originalName)
                    .filePath(stored.path().toString())
                    .storageKey(key)
                    .fileSize(stored.size())
                    .mimeType(mimeTypeOf(request.declaredContentType()))
                    .sha256(stored.sha256())
                    .taskId(request.taskId())
                    .uploadedBy(request.uploaderId())
                    .createdAt(OffsetDateTime.now(clock))
                    .build();
        } catch (StorageException e) {
            log.error("Error saving file {}: {}", originalName, e.getMessage());
            throw UploadRejectedException.storage("Error saving file", e);
        } finally {
            if (!committed) {
                reservation.release();
                if (stored != null) {
                    rollback(key);
                }
            }
        }
    }

    /**
     * Delete a stored file by its absolute path.
     *
     * @return {@code false} when the file did not exist
     */
    public boolean delete(String filePath) {
        Path path = Path.of(filePath).toAbsolutePath().normalize();
        if (!insideStorage(path)) {
            log.warn("Refusing to delete file outside storage root: {}", filePath);
            return false;
        }
        String key = keyOf(path);
        boolean deleted = storageService.delete(key);
        if (deleted) {
            log.info("File deleted successfully: {}", filePath);
        } else {
            log.warn("File not found for deletion: {}", filePath);
        }
        return deleted;
    }

    /**
     * Delete every file under {@code tasks/} whose absolute path is not in
     * {@code referencedPaths}. Files modified within the cleanup min-age are
     * kept, since their record may not be persisted yet. Files that vanish in
     * the meantime are skipped.
     *
     * @return number of files actually deleted
     */
    public int cleanupOrphans(Set<String> referencedPaths) {
        Set<Path> referenced = referencedPaths.stream()
                .map(p -> Path.of(p).toAbsolutePath().normalize())
                .collect(Collectors.toSet());
        Instant cutoff = clock.instant().minusMillis(properties.getCleanup().getMinAgeMs());

        int deleted = 0;
        for (Path file : storageService.list(LocalStorageServiceImpl.TASKS_DIR)) {
            if (referenced.contains(file) || !olderThan(file, cutoff)) {
                continue;
            }
            try {
                if (storageService.delete(keyOf(file))) {
                    deleted++;
                }
            } catch (StorageException e) {
                log.warn("Could not delete orphaned file {}: {}", file, e.getMessage());
            }
        }
        log.info("Cleaned up {} orphaned files", deleted);
        return deleted;
    }

    public StorageStats stats() {
        long count = 0;
        long total = 0;
        for (Path file : storageService.list(LocalStorageServiceImpl.TASKS_DIR)) {
            try {
                total += Files.size(file);
                count++;
            } catch (NoSuchFileException e) {
                log.debug("File vanished while collecting stats: {}", file);
            } catch (IOException e) {
                log.warn("Could not read size of {}: {}", file, e.getMessage());
            }
        }
        return new StorageStats(count, total, storageService.root().toString());
    }

    /**
     * Absolute path of a stored attachment, if it exists.
     */
    public Optional<Path> resolve(long taskId, String storedFilename) {
        if (storedFilename == null || storedFilename.isBlank()
                || storedFilename.contains("/") || storedFilename.contains("\\")) {
            return Optional.empty();
        }
        Path path = storageService.resolve(LocalStorageServiceImpl.TASKS_DIR + "/" + taskId + "/" + storedFilename);
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    public Optional<StoredFileInfo> describe(String filePath) {
        Path path = Path.of(filePath).toAbsolutePath().normalize();
        if (!insideStorage(path)) {
            return Optional.empty();
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            String mime = Files.probeContentType(path);
            return Optional.of(new StoredFileInfo(attributes.size(),
                    mime != null ? mime : DEFAULT_MIME,
                    attributes.creationTime().toInstant(),
                    attributes.lastModifiedTime().toInstant()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.error("Error getting file info for {}: {}", filePath, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean olderThan(Path file, Instant cutoff) {
        try {
            return Files.getLastModifiedTime(file).toInstant().isBefore(cutoff);
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            log.warn("Could not read modification time of {}: {}", file, e.getMessage());
            return false;
        }
    }

    private boolean insideStorage(Path path) {
        Path root = storageService.root();
        return path.startsWith(root) && !path.equals(root);
    }

    private String keyOf(Path file) {
        Path relative = storageService.root().relativize(file.toAbsolutePath().normalize());
        return relative.toString().replace('\\', '/');
    }

    private void rollback(String key) {
        try {
            storageService.delete(key);
            log.debug("Rolled back {}", key);
        } catch (RuntimeException e) {
            log.error("Rollback failed for {}: {}", key, e.getMessage());
        }
    }

    private ValidationOutcome tooLarge(long size) {
        return ValidationOutcome.of(List.of(new ValidationFailure(ValidationErrorKind.FILE_TOO_LARGE,
                String.format(Locale.ROOT, "File size (%.1fMB) exceeds maximum allowed size of %.1fMB",
                        size / (double) UploadProperties.MIB,
                        properties.getMaxFileSize() / (double) UploadProperties.MIB))));
    }

    private static String mimeTypeOf(String declared) {
        String normalized = FileClassifier.normalizeMime(declared);
        return normalized != null ? normalized : DEFAULT_MIME;
    }
}
