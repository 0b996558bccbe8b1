package uk.gegc.interviewledger.features.interview.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.interviewledger.features.scoring.domain.model.ScoreReport;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "interviews", indexes = {
        @Index(name = "idx_interviews_status", columnList = "status"),
        @Index(name = "idx_interviews_user", columnList = "user_id")
})
@Getter
@Setter
public class Interview {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "org_id", nullable = false, updatable = false)
    private UUID orgId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "route", nullable = false, length = 64)
    private String route;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private InterviewStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "credit_source", nullable = false, length = 16, updatable = false)
    private CreditSource creditSource;

    @Column(name = "score")
    private Integer score;

    @Column(name = "final_score")
    private Integer finalScore;

    @Convert(converter = ScoreDetailsConverter.class)
    @Column(name = "score_details", columnDefinition = "TEXT")
    private Map<String, Integer> scoreDetails = new LinkedHashMap<>();

    @Convert(converter = ScoreReportConverter.class)
    @Column(name = "final_report", columnDefinition = "TEXT")
    private ScoreReport finalReport;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "credit_restored", nullable = false)
    private boolean creditRestored;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;
}
