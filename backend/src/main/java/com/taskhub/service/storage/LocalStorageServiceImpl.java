package com.taskhub.service.storage;

import com.taskhub.config.UploadProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Set;

/**
 * Local filesystem implementation of {@link StorageService}.
 * Creates {@code tasks/} and the reserved temp directory under the root at
 * startup.
 */
@Slf4j
@Service
public class LocalStorageServiceImpl implements StorageService {

    public static final String TASKS_DIR = "tasks";

    private final Path storageRoot;

    @Autowired
    public LocalStorageServiceImpl(UploadProperties properties) {
        this(Paths.get(properties.getStorage().getRoot()), properties.getStorage().getTempDir());
    }

    public LocalStorageServiceImpl(Path storageRoot) {
        this(storageRoot, "temp");
    }

    public LocalStorageServiceImpl(Path storageRoot, String tempDir) {
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.storageRoot.resolve(TASKS_DIR));
            Files.createDirectories(this.storageRoot.resolve(tempDir));
            log.info("LocalStorageService initialized at {}", this.storageRoot);
        } catch (IOException e) {
            throw new StorageException("Failed to create local storage directory: " + this.storageRoot, e);
        }
    }

    @Override
    public StoredObject write(InputStream content, String key) {
        Path filePath = resolve(key);
        MessageDigest digest = sha256();
        try {
            Files.createDirectories(filePath.getParent());
            DigestInputStream in = new DigestInputStream(content, digest);
            long written;
            try (OutputStream out = Files.newOutputStream(filePath,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                written = in.transferTo(out);
            }
            long size = Files.size(filePath);
            log.debug("Wrote {} ({} bytes streamed, {} on disk)", key, written, size);
            return new StoredObject(key, filePath, size, HexFormat.of().formatHex(digest.digest()));
        } catch (FileAlreadyExistsException e) {
            throw new StorageException("File already exists: " + key, e);
        } catch (IOException e) {
            deleteQuietly(filePath);
            throw new StorageException("Failed to write file: " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        Path filePath = resolve(key);
        try {
            boolean deleted = Files.deleteIfExists(filePath);
            log.debug("Deleted {} (existed={})", key, deleted);
            return deleted;
        } catch (IOException e) {
            throw new StorageException("Failed to delete file: " + key, e);
        }
    }

    @Override
    public Path resolve(String key) {
        // Prevent path-traversal attacks
        Path resolved = storageRoot.resolve(key).normalize();
        if (!resolved.startsWith(storageRoot) || resolved.equals(storageRoot)) {
            throw new SecurityException("Path traversal attempt detected: " + key);
        }
        return resolved;
    }

    @Override
    public Set<Path> list(String prefix) {
        Path start = resolve(prefix);
        Set<Path> files = new HashSet<>();
        if (!Files.isDirectory(start)) {
            return files;
        }
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        files.add(file.toAbsolutePath().normalize());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Skipping {} during walk: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new StorageException("Failed to list files under: " + prefix, e);
        }
        return files;
    }

    @Override
    public Path root() {
        return storageRoot;
    }

    private void deleteQuietly(Path filePath) {
        try {
            Files.deleteIfExists(filePath);
        } catch (IOException suppressed) {
            log.error("Failed to remove partial file {}: {}", filePath, suppressed.getMessage());
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
