package uk.gegc.interviewledger.features.credit.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of one credit mutation. Balances are expressed in credits remaining and are
 * written in the same transaction as the mutation they document.
 */
@Entity
@Table(name = "credit_history", indexes = {
        @Index(name = "idx_credit_history_student_ts", columnList = "student_id, recorded_at, sequence_no")
})
@Getter
@Setter
public class CreditHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "org_id", nullable = false, updatable = false)
    private UUID orgId;

    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32, updatable = false)
    private CreditHistoryType type;

    @Column(name = "amount", nullable = false, updatable = false)
    private int amount;

    @Column(name = "reason", updatable = false)
    private String reason;

    @Column(name = "performed_by", updatable = false)
    private UUID performedBy;

    @Column(name = "interview_id", updatable = false)
    private UUID interviewId;

    @Column(name = "balance_before", nullable = false, updatable = false)
    private int balanceBefore;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private int balanceAfter;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant timestamp;

    /**
     * Version of the student row the mutation was applied to. Orders entries that share a timestamp.
     */
    @Column(name = "sequence_no", nullable = false, updatable = false)
    private long sequenceNo;
}
