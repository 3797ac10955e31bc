package com.taskhub.modules.attachment;

import com.taskhub.config.UploadProperties;
import com.taskhub.exception.GlobalExceptionHandler;
import com.taskhub.model.entity.TaskAttachment;
import com.taskhub.modules.attachment.dto.TaskAttachmentResponse;
import com.taskhub.modules.upload.StorageStats;
import com.taskhub.modules.upload.UploadRejectedException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task attachment endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /tasks/{taskId}/attachments: upload one ({@code file}) or several ({@code files})</li>
 * <li>GET /tasks/{taskId}/attachments: list</li>
 * <li>GET /tasks/{taskId}/attachments/{id}/download</li>
 * <li>DELETE /tasks/{taskId}/attachments/{id}: uploader only</li>
 * <li>GET /attachments/storage/stats</li>
 * <li>POST /attachments/storage/cleanup</li>
 * </ul>
 * Rejections are mapped to status codes by the global exception handler. A
 * batch ({@code files}) reports each file separately: 201 when all were stored,
 * 207 when some were, otherwise the status of the first rejection.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class TaskAttachmentController {

    static final String CURRENT_USER_ID = "currentUserId";

    private final TaskAttachmentService attachmentService;
    private final UploadProperties uploadProperties;

    // ================================================================
    // POST /tasks/{taskId}/attachments
    // ================================================================

    @PostMapping(path = "/tasks/{taskId}/attachments", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> upload(@PathVariable long taskId,
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "files", required = false) List<MultipartFile> files,
            HttpServletRequest httpRequest) {
        Long userId = getCurrentUserId(httpRequest);
        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        List<MultipartFile> uploads = new ArrayList<>();
        if (file != null) {
            uploads.add(file);
        }
        if (files != null) {
            uploads.addAll(files);
        }
        if (uploads.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "NO_FILE",
                    "message", "No file provided"));
        }
        if (uploads.size() > uploadProperties.getMaxFilesPerUpload()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "TOO_MANY_FILES",
                    "message", "At most " + uploadProperties.getMaxFilesPerUpload() + " files per upload"));
        }

        if (file != null && files == null) {
            TaskAttachment attachment = attachmentService.upload(taskId, userId, file);
            return ResponseEntity.status(HttpStatus.CREATED).body(TaskAttachmentResponse.from(attachment));
        }

        // Each file is admitted on its own; one rejection does not undo the others
        List<TaskAttachmentResponse> created = new ArrayList<>();
        List<Map<String, Object>> rejected = new ArrayList<>();
        HttpStatus firstRejection = null;
        for (MultipartFile upload : uploads) {
            try {
                created.add(TaskAttachmentResponse.from(attachmentService.upload(taskId, userId, upload)));
            } catch (UploadRejectedException e) {
                log.warn("File {} of batch rejected ({}): {}", upload.getOriginalFilename(), e.getKind(), e.getReasons());
                rejected.add(rejection(upload, e));
                if (firstRejection == null) {
                    firstRejection = GlobalExceptionHandler.statusOf(e.getKind());
                }
            }
        }

        HttpStatus status;
        if (rejected.isEmpty()) {
            status = HttpStatus.CREATED;
        } else if (created.isEmpty()) {
            status = firstRejection;
        } else {
            status = HttpStatus.MULTI_STATUS;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("created", created);
        body.put("rejected", rejected);
        return ResponseEntity.status(status).body(body);
    }

    private static Map<String, Object> rejection(MultipartFile upload, UploadRejectedException e) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("filename", upload.getOriginalFilename());
        entry.put("error", e.getKind().name());
        entry.put("reasons", e.getReasons());
        if (e.getWindow() != null) {
            entry.put("window", e.getWindow().name());
        }
        return entry;
    }

    // ================================================================
    // GET /tasks/{taskId}/attachments
    // ================================================================

    @GetMapping("/tasks/{taskId}/attachments")
    public ResponseEntity<List<TaskAttachmentResponse>> list(@PathVariable long taskId,
            HttpServletRequest httpRequest) {
        if (getCurrentUserId(httpRequest) == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(attachmentService.list(taskId).stream()
                .map(TaskAttachmentResponse::from)
                .toList());
    }

    // ================================================================
    // GET /tasks/{taskId}/attachments/{id}/download
    // ================================================================

    @GetMapping("/tasks/{taskId}/attachments/{id}/download")
    public ResponseEntity<Resource> download(@PathVariable long taskId, @PathVariable long id,
            HttpServletRequest httpRequest) {
        if (getCurrentUserId(httpRequest) == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        AttachmentDownload download = attachmentService.open(taskId, id);
        TaskAttachment attachment = download.attachment();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(attachment.getMimeType()));
        headers.setContentLength(attachment.getFileSize());
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(attachment.getOriginalFilename(), StandardCharsets.UTF_8)
                .build());

        return new ResponseEntity<>(new FileSystemResource(download.path()), headers, HttpStatus.OK);
    }

    // ================================================================
    // DELETE /tasks/{taskId}/attachments/{id}
    // ================================================================

    @DeleteMapping("/tasks/{taskId}/attachments/{id}")
    public ResponseEntity<Void> delete(@PathVariable long taskId, @PathVariable long id,
            HttpServletRequest httpRequest) {
        Long userId = getCurrentUserId(httpRequest);
        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        attachmentService.delete(taskId, id, userId);
        return ResponseEntity.noContent().build();
    }

    // ================================================================
    // Storage maintenance
    // ================================================================

    @GetMapping("/attachments/storage/stats")
    public ResponseEntity<?> stats(HttpServletRequest httpRequest) {
        if (getCurrentUserId(httpRequest) == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        StorageStats stats = attachmentService.stats();
        return ResponseEntity.ok(Map.of(
                "totalFiles", stats.fileCount(),
                "totalSizeBytes", stats.totalBytes(),
                "totalSizeMb", stats.totalMegabytes(),
                "storagePath", stats.storageRoot()));
    }

    @PostMapping("/attachments/storage/cleanup")
    public ResponseEntity<?> cleanup(HttpServletRequest httpRequest) {
        Long userId = getCurrentUserId(httpRequest);
        if (userId == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        int deleted = attachmentService.cleanupOrphans();
        log.info("Orphan cleanup triggered by user {}: {} file(s) removed", userId, deleted);
        return ResponseEntity.ok(Map.of("deletedFiles", deleted));
    }

    private Long getCurrentUserId(HttpServletRequest request) {
        Object value = request.getAttribute(CURRENT_USER_ID);
        return value instanceof Number number ? number.longValue() : null;
    }
}
