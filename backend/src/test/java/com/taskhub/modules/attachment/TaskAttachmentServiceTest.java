package com.taskhub.modules.attachment;

import com.taskhub.exception.AttachmentAccessDeniedException;
import com.taskhub.exception.AttachmentNotFoundException;
import com.taskhub.model.entity.TaskAttachment;
import com.taskhub.modules.upload.AttachmentFileStore;
import com.taskhub.modules.upload.AttachmentUploadService;
import com.taskhub.modules.upload.StoredFileRecord;
import com.taskhub.modules.upload.UploadRejectedException;
import com.taskhub.modules.upload.UploadRequest;
import com.taskhub.modules.upload.validation.ValidationErrorKind;
import com.taskhub.modules.upload.validation.ValidationFailure;
import com.taskhub.modules.upload.validation.ValidationOutcome;
import com.taskhub.modules.upload.validation.ValidationProfile;
import com.taskhub.repository.TaskAttachmentRepository;
import com.taskhub.service.AuditService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskAttachmentServiceTest {

    @Mock
    AttachmentUploadService uploadService;
    @Mock
    AttachmentFileStore fileStore;
    @Mock
    TaskAttachmentRepository attachmentRepository;
    @Mock
    AuditService auditService;

    @InjectMocks
    private TaskAttachmentService attachmentService;

    @TempDir
    Path tempDir;

    // ================================================================
    // upload
    // ================================================================

    @Test
    @DisplayName("Accepted upload → persisted with stored metadata and audited")
    void uploadPersistsAndAudits() {
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain",
                "Meeting notes for the quarterly planning session.".getBytes());
        when(uploadService.upload(any(), eq(ValidationProfile.STRICT))).thenReturn(record("notes.txt"));
        when(attachmentRepository.save(any(TaskAttachment.class))).thenAnswer(inv -> {
            TaskAttachment attachment = inv.getArgument(0);
            attachment.setId(5L);
            return attachment;
        });

        TaskAttachment saved = attachmentService.upload(42L, 7L, file);

        assertEquals(5L, saved.getId());
        assertEquals(42L, saved.getTaskId());
        assertEquals("uuid.txt", saved.getFilename());
        assertEquals("notes.txt", saved.getOriginalFilename());
        assertEquals("/data/tasks/42/uuid.txt", saved.getFilePath());
        assertEquals(7L, saved.getUploadedBy());

        ArgumentCaptor<UploadRequest> captor = ArgumentCaptor.forClass(UploadRequest.class);
        verify(uploadService).upload(captor.capture(), eq(ValidationProfile.STRICT));
        assertEquals("notes.txt", captor.getValue().originalFilename());
        assertEquals("text/plain", captor.getValue().declaredContentType());
        assertEquals(file.getSize(), captor.getValue().declaredSize());
        assertEquals(42L, captor.getValue().taskId());
        assertEquals(7L, captor.getValue().uploaderId());

        verify(auditService).log(eq(7L), eq("ATTACHMENT_UPLOADED"), eq("TaskAttachment"), eq("5"), anyMap());
    }

    @Test
    @DisplayName("Rejected upload → audited and rethrown, nothing persisted")
    void rejectedUploadAudited() {
        MockMultipartFile file = new MockMultipartFile("file", "setup.exe", "application/octet-stream",
                new byte[] {1, 2, 3});
        UploadRejectedException rejection = UploadRejectedException.validation(ValidationOutcome.of(List.of(
                new ValidationFailure(ValidationErrorKind.EXTENSION, "File type '.exe' is blocked"))));
        when(uploadService.upload(any(), eq(ValidationProfile.STRICT))).thenThrow(rejection);

        UploadRejectedException thrown = assertThrows(UploadRejectedException.class,
                () -> attachmentService.upload(42L, 7L, file));

        assertSame(rejection, thrown);
        verify(auditService).log(eq(7L), eq("ATTACHMENT_REJECTED"), eq("TaskAttachment"), isNull(), anyMap());
        verify(attachmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("Persisting fails → stored file discarded, error propagated")
    void persistFailureDiscardsFile() {
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain",
                "Meeting notes for the quarterly planning session.".getBytes());
        StoredFileRecord record = record("notes.txt");
        when(uploadService.upload(any(), any())).thenReturn(record);
        when(attachmentRepository.save(any(TaskAttachment.class)))
                .thenThrow(new DataIntegrityViolationException("constraint"));

        assertThrows(DataIntegrityViolationException.class, () -> attachmentService.upload(42L, 7L, file));

        verify(uploadService).discard(record);
        verify(auditService, never()).log(any(), eq("ATTACHMENT_UPLOADED"), any(), any(), any());
    }

    @Test
    @DisplayName("Trusted import → RELAXED profile")
    void importTrustedUsesRelaxedProfile() throws IOException {
        Path source = Files.writeString(tempDir.resolve("export.csv"), "id,title\n1,Plan sprint\n");
        when(uploadService.upload(any(), eq(ValidationProfile.RELAXED))).thenReturn(record("export.csv"));
        when(attachmentRepository.save(any(TaskAttachment.class))).thenAnswer(inv -> inv.getArgument(0));

        attachmentService.importTrusted(42L, 7L, source, "text/csv");

        ArgumentCaptor<UploadRequest> captor = ArgumentCaptor.forClass(UploadRequest.class);
        verify(uploadService).upload(captor.capture(), eq(ValidationProfile.RELAXED));
        assertEquals("export.csv", captor.getValue().originalFilename());
        assertEquals(Files.size(source), captor.getValue().declaredSize());
    }

    // ================================================================
    // open / delete
    // ================================================================

    @Test
    void openReturnsStoredPath() {
        TaskAttachment attachment = attachment(7L);
        Path path = tempDir.resolve("uuid.txt");
        when(attachmentRepository.findByIdAndTaskId(5L, 42L)).thenReturn(Optional.of(attachment));
        when(fileStore.resolve(42L, "uuid.txt")).thenReturn(Optional.of(path));

        AttachmentDownload download = attachmentService.open(42L, 5L);

        assertSame(attachment, download.attachment());
        assertEquals(path, download.path());
    }

    @Test
    @DisplayName("Row exists but file is gone → not found")
    void openMissingFile() {
        when(attachmentRepository.findByIdAndTaskId(5L, 42L)).thenReturn(Optional.of(attachment(7L)));
        when(fileStore.resolve(42L, "uuid.txt")).thenReturn(Optional.empty());

        assertThrows(AttachmentNotFoundException.class, () -> attachmentService.open(42L, 5L));
    }

    @Test
    @DisplayName("Uploader deletes → row and file removed, audited")
    void uploaderCanDelete() {
        TaskAttachment attachment = attachment(7L);
        when(attachmentRepository.findByIdAndTaskId(5L, 42L)).thenReturn(Optional.of(attachment));
        when(fileStore.delete("/data/tasks/42/uuid.txt")).thenReturn(true);

        attachmentService.delete(42L, 5L, 7L);

        verify(attachmentRepository).delete(attachment);
        verify(fileStore).delete("/data/tasks/42/uuid.txt");
        verify(auditService).log(eq(7L), eq("ATTACHMENT_DELETED"), eq("TaskAttachment"), eq("5"), anyMap());
    }

    @Test
    @DisplayName("Another user deletes → forbidden, nothing removed")
    void otherUserCannotDelete() {
        when(attachmentRepository.findByIdAndTaskId(5L, 42L)).thenReturn(Optional.of(attachment(7L)));

        assertThrows(AttachmentAccessDeniedException.class, () -> attachmentService.delete(42L, 5L, 8L));

        verify(attachmentRepository, never()).delete(any(TaskAttachment.class));
        verifyNoInteractions(fileStore);
    }

    @Test
    void deleteUnknownAttachment() {
        when(attachmentRepository.findByIdAndTaskId(5L, 42L)).thenReturn(Optional.empty());

        assertThrows(AttachmentNotFoundException.class, () -> attachmentService.delete(42L, 5L, 7L));
    }

    // ================================================================
    // maintenance
    // ================================================================

    @Test
    @DisplayName("Orphan cleanup keeps every persisted path")
    void cleanupOrphansUsesPersistedPaths() {
        when(attachmentRepository.findAllFilePaths()).thenReturn(List.of("/data/tasks/1/a.txt", "/data/tasks/2/b.pdf"));
        when(fileStore.cleanupOrphans(Set.of("/data/tasks/1/a.txt", "/data/tasks/2/b.pdf"))).thenReturn(3);

        assertEquals(3, attachmentService.cleanupOrphans());

        verify(auditService).log(isNull(), eq("ATTACHMENT_ORPHANS_CLEANED"), eq("TaskAttachment"), isNull(), anyMap());
    }

    @Test
    void cleanupWithNothingToDoIsNotAudited() {
        when(attachmentRepository.findAllFilePaths()).thenReturn(List.of());
        when(fileStore.cleanupOrphans(Set.of())).thenReturn(0);

        assertEquals(0, attachmentService.cleanupOrphans());

        verifyNoInteractions(auditService);
    }

    private static StoredFileRecord record(String originalFilename) {
        return StoredFileRecord.builder()
                .storedFilename("uuid.txt")
                .originalFilename(originalFilename)
                .filePath("/data/tasks/42/uuid.txt")
                .storageKey("tasks/42/uuid.txt")
                .fileSize(49)
                .mimeType("text/plain")
                .sha256("0".repeat(64))
                .taskId(42L)
                .uploadedBy(7L)
                .createdAt(OffsetDateTime.now())
                .build();
    }

    private static TaskAttachment attachment(Long uploadedBy) {
        return TaskAttachment.builder()
                .id(5L)
                .taskId(42L)
                .filename("uuid.txt")
                .originalFilename("notes.txt")
                .filePath("/data/tasks/42/uuid.txt")
                .fileSize(49L)
                .mimeType("text/plain")
                .uploadedBy(uploadedBy)
                .build();
    }
}
