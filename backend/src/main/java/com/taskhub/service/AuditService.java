package com.taskhub.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskhub.model.entity.AuditLog;
import com.taskhub.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Records audit trail entries for attachment operations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Record an audit log entry.
     *
     * @param userId     the acting user, {@code null} for scheduled jobs
     * @param action     e.g. "ATTACHMENT_UPLOADED"
     * @param entityType e.g. "TaskAttachment"
     * @param entityId   the ID of the affected entity, may be {@code null}
     * @param metadata   arbitrary key-value metadata, stored as JSON text
     */
    public void log(Long userId, String action, String entityType, String entityId,
            Map<String, Object> metadata) {
        AuditLog.AuditLogBuilder entry = AuditLog.builder()
                .userId(userId)
                .action(action)
                .entityType(entityType)
                .entityId(entityId);
        try {
            entry.metadata(metadata != null ? objectMapper.writeValueAsString(metadata) : null);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit metadata for action={}: {}", action, e.getMessage());
        }
        auditLogRepository.save(entry.build());
        log.debug("Audit logged: action={}, entity={}:{}, user={}", action, entityType, entityId, userId);
    }
}
