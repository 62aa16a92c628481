package com.intervue.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.intervue.model.QuestionType;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class InterviewResponses {

    private InterviewResponses() {
    }

    public record CandidateCreated(
            boolean ok,
            @JsonProperty("candidate_id")
            Integer candidateId
    ) {
    }

    public record QuestionDetail(
            UUID id,
            String title,
            QuestionType qtype,
            JsonNode spec,
            JsonNode rubric,
            @JsonProperty("ideal_answer")
            String idealAnswer,
            Integer version
    ) {
    }

    public record PackCreated(
            boolean ok,
            @JsonProperty("pack_id")
            Integer packId
    ) {
    }

    public record AssignmentCreated(
            boolean ok,
            @JsonProperty("assignment_id")
            UUID assignmentId
    ) {
    }

    public record AssignmentStarted(
            boolean ok,
            @JsonProperty("assignment_id")
            UUID assignmentId,
            String candidate,
            String pack,
            @JsonProperty("started_at")
            OffsetDateTime startedAt
    ) {
    }

    public record AssignmentFinished(
            boolean ok,
            @JsonProperty("assignment_id")
            UUID assignmentId,
            String status,
            @JsonProperty("finished_at")
            OffsetDateTime finishedAt
    ) {
    }

    public record CandidateQuestion(
            boolean ok,
            @JsonProperty("assignment_id")
            UUID assignmentId,
            QuestionView question
    ) {
    }

    public record QuestionView(
            UUID id,
            String title,
            JsonNode spec,
            JsonNode rubric,
            QuestionType qtype,
            @JsonProperty("timer_seconds")
            Integer timerSeconds
    ) {
    }

    /**
     * Grading response for one submission; {@code judge.debug} appears only in debugging contexts.
     */
    public record SubmissionGraded(
            boolean ok,
            @JsonProperty("submission_id")
            UUID submissionId,
            @JsonProperty("grade_id")
            UUID gradeId,
            double score,
            JsonNode runner,
            JsonNode judge,
            @JsonProperty("file_url")
            String fileUrl
    ) {
    }

    public record AttachmentUploaded(
            boolean ok,
            @JsonProperty("file_url")
            String fileUrl
    ) {
    }

    public record JudgeHealth(
            boolean ok,
            JsonNode info
    ) {
    }

    public record AssignmentReport(
            boolean ok,
            @JsonProperty("assignment_id")
            UUID assignmentId,
            CandidateSummary candidate,
            PackSummary pack,
            @JsonProperty("average_score")
            double averageScore,
            List<SubmissionReport> submissions
    ) {
    }

    public record CandidateSummary(
            Integer id,
            String name,
            String email
    ) {
    }

    public record PackSummary(
            Integer id,
            String name
    ) {
    }

    public record SubmissionReport(
            @JsonProperty("submission_id")
            UUID submissionId,
            @JsonProperty("question_id")
            UUID questionId,
            @JsonProperty("question_title")
            String questionTitle,
            JsonNode answer,
            Double score,
            JsonNode runner,
            JsonNode judge,
            @JsonProperty("created_at")
            OffsetDateTime createdAt
    ) {
    }
}
