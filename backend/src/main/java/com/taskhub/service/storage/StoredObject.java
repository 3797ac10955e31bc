package com.taskhub.service.storage;

import java.nio.file.Path;

/**
 * A file as written by {@link StorageService#write}.
 */
public record StoredObject(String key, Path path, long size, String sha256) {
}
