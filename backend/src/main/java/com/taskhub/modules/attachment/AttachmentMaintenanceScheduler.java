package com.taskhub.modules.attachment;

import com.taskhub.config.UploadProperties;
import com.taskhub.modules.upload.ratelimit.UploadRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes orphaned attachment files and forgets rate-limit
 * state of users idle for a day.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttachmentMaintenanceScheduler {

    private final TaskAttachmentService attachmentService;
    private final UploadRateLimiter rateLimiter;
    private final UploadProperties uploadProperties;

    @Scheduled(fixedRateString = "${taskhub.upload.cleanup.interval-ms:3600000}",
            initialDelayString = "${taskhub.upload.cleanup.interval-ms:3600000}")
    public void runMaintenance() {
        if (!uploadProperties.getCleanup().isEnabled()) {
            return;
        }
        try {
            int deleted = attachmentService.cleanupOrphans();
            if (deleted > 0) {
                log.info("Removed {} orphaned attachment file(s)", deleted);
            }
        } catch (RuntimeException e) {
            log.error("Orphan cleanup failed: {}", e.getMessage(), e);
        }

        int evicted = rateLimiter.evictIdle();
        if (evicted > 0) {
            log.info("Evicted {} idle rate-limit identities", evicted);
        }
    }
}
