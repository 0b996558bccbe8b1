package uk.gegc.interviewledger.features.credit.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "students")
@Getter
@Setter
public class Student {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "org_id", nullable = false, updatable = false)
    private UUID orgId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "credits_allocated", nullable = false)
    private int creditsAllocated;

    @Column(name = "credits_used", nullable = false)
    private int creditsUsed;

    @Column(name = "can_self_start_interviews", nullable = false)
    private boolean canSelfStartInterviews;

    @Column(name = "dashboard_enabled", nullable = false)
    private boolean dashboardEnabled;

    @Column(name = "default_route", length = 64)
    private String defaultRoute;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Transient
    public int getCreditsRemaining() {
        return Math.max(0, creditsAllocated - creditsUsed);
    }
}
