package uk.gegc.interviewledger.features.credit.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Tenant record holding the org-initiated quota and the aggregate of credits handed to students.
 */
@Entity
@Table(name = "organizations")
@Getter
@Setter
public class Organization {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Ceiling for org-initiated interviews; 0 means unlimited.
     */
    @Column(name = "quota_limit", nullable = false)
    private int quotaLimit;

    @Column(name = "quota_used", nullable = false)
    private int quotaUsed;

    @Column(name = "student_credits_allocated", nullable = false)
    private int studentCreditsAllocated;

    /**
     * Lifetime count of student-initiated reservations. Only ever increases.
     */
    @Column(name = "student_credits_used", nullable = false)
    private int studentCreditsUsed;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean hasQuotaLimit() {
        return quotaLimit > 0;
    }

    public boolean isQuotaExhausted() {
        return hasQuotaLimit() && quotaUsed >= quotaLimit;
    }

    /**
     * Quota still available for allocating credits to students, or {@link Integer#MAX_VALUE} when unlimited.
     */
    public int getAllocatableCredits() {
        if (!hasQuotaLimit()) {
            return Integer.MAX_VALUE;
        }
        return Math.max(0, quotaLimit - quotaUsed - studentCreditsAllocated);
    }
}
