package uk.gegc.interviewledger.features.audit.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.interviewledger.features.audit.domain.model.AuditAction;
import uk.gegc.interviewledger.features.audit.domain.model.AuditEntry;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Builds audit entries with serialized details. Entries are appended by the caller inside the
 * transaction that performs the audited change.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditEntryFactory {

    public static final String TARGET_INTERVIEW = "interview";
    public static final String TARGET_ORGANIZATION = "organization";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditEntry create(UUID orgId, UUID actorId, AuditAction action,
                             String targetType, UUID targetId, Map<String, ?> details) {
        AuditEntry entry = new AuditEntry();
        entry.setOrgId(orgId);
        entry.setActorId(actorId);
        entry.setAction(action);
        entry.setTargetType(targetType);
        entry.setTargetId(targetId);
        entry.setDetailsJson(toJson(details));
        entry.setTimestamp(Instant.now(clock));
        return entry;
    }

    private String toJson(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit details {}: {}", details.keySet(), e.getMessage());
            return "{\"serializationError\":true}";
        }
    }
}
