package com.vtrade.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtrade.backend.model.AuditEvent;
import com.vtrade.backend.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Audit writes join the caller's transaction. A failure to serialise metadata is logged and the event is
 * stored without it; the business operation is never failed by auditing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;

    public void recordEvent(Long userId, String eventType, String action, String description, Object metadata) {
        recordEvent(userId, eventType, action, null, null, description, metadata);
    }

    public void recordEvent(Long userId, String eventType, String action, String entityType, Long entityId,
                            String description, Object metadata) {
        AuditEvent event = AuditEvent.builder()
                .userId(userId)
                .eventType(eventType)
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .description(truncate(description))
                .metadata(serialize(eventType, action, metadata))
                .correlationId(MDC.get("correlationId"))
                .createdAt(Instant.now())
                .build();
        auditEventRepository.save(event);
    }

    private String serialize(String eventType, String action, Object metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (Exception e) {
            log.warn("Failed to serialise audit metadata {}:{} - {}", eventType, action, e.getMessage());
            return null;
        }
    }

    private String truncate(String description) {
        if (description == null || description.length() <= 512) {
            return description;
        }
        return description.substring(0, 512);
    }
}
