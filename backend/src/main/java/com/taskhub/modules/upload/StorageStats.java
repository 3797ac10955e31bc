package com.taskhub.modules.upload;

/**
 * Aggregate usage of the attachment tree.
 */
public record StorageStats(long fileCount, long totalBytes, String storageRoot) {

    public double totalMegabytes() {
        return Math.round(totalBytes / (1024.0 * 1024.0) * 100.0) / 100.0;
    }
}
