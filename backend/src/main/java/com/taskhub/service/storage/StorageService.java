package com.taskhub.service.storage;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Set;

/**
 * Abstraction over the attachment file tree. Keys are '/'-separated paths
 * relative to the storage root, e.g. {@code tasks/42/0b6c....pdf}.
 */
public interface StorageService {

    /**
     * Stream {@code content} into a new file at {@code key}.
     *
     * @param content source stream, not closed by this method
     * @param key     relative path; parent directories are created
     * @return size and SHA-256 of what was written
     * @throws StorageException if the file exists already or the write fails
     */
    StoredObject write(InputStream content, String key);

    /**
     * Delete the file at {@code key}.
     *
     * @return {@code false} when there was nothing to delete
     */
    boolean delete(String key);

    /**
     * Absolute path for {@code key}. Rejects keys that escape the root.
     */
    Path resolve(String key);

    /**
     * Absolute paths of every regular file below {@code prefix}. Entries that
     * vanish while the tree is walked are skipped.
     */
    Set<Path> list(String prefix);

    /** Absolute, normalized storage root. */
    Path root();
}
