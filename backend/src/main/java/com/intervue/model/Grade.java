package com.intervue.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.intervue.evaluation.model.JudgeOutcome;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Final grade for a submission: at most one per submission, written once.
 */
@Getter
@Setter
@Entity
@Table(
        name = "grades",
        uniqueConstraints = @UniqueConstraint(name = "uq_grades_submission", columnNames = "submission_id")
)
public class Grade {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "submission_id", nullable = false, updatable = false)
    private UUID submissionId;

    @Column(name = "score", nullable = false, updatable = false)
    private Double score;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "judge", nullable = false, updatable = false)
    private JsonNode judge;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "runner", updatable = false)
    private JsonNode runner;

    @Enumerated(EnumType.STRING)
    @Column(name = "judge_outcome", nullable = false, length = 32, updatable = false)
    private JudgeOutcome judgeOutcome;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
