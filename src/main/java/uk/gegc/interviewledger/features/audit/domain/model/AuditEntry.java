package uk.gegc.interviewledger.features.audit.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit record for ledger events that are not credit mutations
 * (score computations, lifecycle transitions, quota consumption, reconciliation repairs).
 */
@Entity
@Table(name = "audit_log", indexes = {
        @Index(name = "idx_audit_log_org_ts", columnList = "org_id, recorded_at"),
        @Index(name = "idx_audit_log_target", columnList = "target_id")
})
@Getter
@Setter
public class AuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "org_id", updatable = false)
    private UUID orgId;

    @Column(name = "actor_id", updatable = false)
    private UUID actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 64, updatable = false)
    private AuditAction action;

    @Column(name = "target_type", nullable = false, length = 32, updatable = false)
    private String targetType;

    @Column(name = "target_id", updatable = false)
    private UUID targetId;

    @Column(name = "details_json", columnDefinition = "TEXT", updatable = false)
    private String detailsJson;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant timestamp;
}
