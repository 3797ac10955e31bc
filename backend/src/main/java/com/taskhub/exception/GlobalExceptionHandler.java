package com.taskhub.exception;

import com.taskhub.modules.upload.UploadErrorKind;
import com.taskhub.modules.upload.UploadRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns upload rejections and other failures into JSON error responses.
 * Stack traces are never exposed in response bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String CORRELATION_ID_KEY = "correlationId";

    @ExceptionHandler(UploadRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleUploadRejected(UploadRejectedException ex) {
        HttpStatus status = statusOf(ex.getKind());

        Map<String, Object> body = body(status, ex.getKind().name(), ex.getReasons());
        if (ex.getWindow() != null) {
            body.put("window", ex.getWindow().name());
        }

        if (status.is5xxServerError()) {
            log.error("Upload failed [correlationId={}]: {}", body.get(CORRELATION_ID_KEY), ex.getMessage(), ex);
        } else {
            log.warn("Upload rejected ({}): {}", ex.getKind(), ex.getReasons());
        }
        return ResponseEntity.status(status).body(body);
    }

    public static HttpStatus statusOf(UploadErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case RATE_LIMIT -> HttpStatus.TOO_MANY_REQUESTS;
            case STORAGE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Multipart request too large: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(body(HttpStatus.PAYLOAD_TOO_LARGE, "FILE_TOO_LARGE",
                        List.of("Request exceeds the maximum upload size")));
    }

    @ExceptionHandler(AttachmentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(AttachmentNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(body(HttpStatus.NOT_FOUND, "NOT_FOUND", List.of(ex.getMessage())));
    }

    @ExceptionHandler(AttachmentAccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AttachmentAccessDeniedException ex) {
        log.warn("Attachment access denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(body(HttpStatus.FORBIDDEN, "FORBIDDEN", List.of(ex.getMessage())));
    }

    /**
     * Bean-validation failures (e.g. {@code @Valid} on a request body).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex) {

        List<String> reasons = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();

        log.warn("Validation failed: {} field error(s)", reasons.size());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "Validation Failed", reasons));
    }

    /**
     * Catch-all. Returns 500 with the correlation ID only.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        String correlationId = MDC.get(CORRELATION_ID_KEY);
        log.error("Unhandled exception [correlationId={}]: {}", correlationId, ex.getMessage(), ex);

        Map<String, Object> body = body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", List.of());
        body.put("message", "An unexpected error occurred. Please reference correlationId for support.");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static Map<String, Object> body(HttpStatus status, String error, List<String> reasons) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("reasons", reasons);
        body.put(CORRELATION_ID_KEY, MDC.get(CORRELATION_ID_KEY));
        return body;
    }
}
