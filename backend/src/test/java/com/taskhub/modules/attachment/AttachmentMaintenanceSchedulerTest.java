package com.taskhub.modules.attachment;

import com.taskhub.config.UploadProperties;
import com.taskhub.modules.upload.ratelimit.UploadRateLimiter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AttachmentMaintenanceSchedulerTest {

    @Mock
    TaskAttachmentService attachmentService;
    @Mock
    UploadRateLimiter rateLimiter;
    @Spy
    UploadProperties uploadProperties = new UploadProperties();

    @InjectMocks
    private AttachmentMaintenanceScheduler scheduler;

    @Test
    void runsCleanupAndEviction() {
        when(attachmentService.cleanupOrphans()).thenReturn(1);

        scheduler.runMaintenance();

        verify(attachmentService).cleanupOrphans();
        verify(rateLimiter).evictIdle();
    }

    @Test
    void cleanupFailureDoesNotSkipEviction() {
        when(attachmentService.cleanupOrphans()).thenThrow(new IllegalStateException("storage offline"));

        scheduler.runMaintenance();

        verify(rateLimiter).evictIdle();
    }

    @Test
    void disabledDoesNothing() {
        uploadProperties.getCleanup().setEnabled(false);

        scheduler.runMaintenance();

        verifyNoInteractions(attachmentService, rateLimiter);
    }
}
