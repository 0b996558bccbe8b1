package uk.gegc.interviewledger.features.audit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.interviewledger.features.audit.domain.model.AuditAction;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AuditEntryDto", description = "Append-only audit record")
public record AuditEntryDto(
        UUID id,
        UUID orgId,
        @Schema(description = "Caller that triggered the change; null for scheduled jobs")
        UUID actorId,
        AuditAction action,
        @Schema(example = "interview")
        String targetType,
        UUID targetId,
        @Schema(description = "Serialized event details")
        String detailsJson,
        Instant timestamp
) {}
