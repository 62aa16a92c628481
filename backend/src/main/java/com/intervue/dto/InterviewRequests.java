package com.intervue.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.intervue.model.PackItem;
import com.intervue.model.QuestionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public final class InterviewRequests {

    private InterviewRequests() {
    }

    public record CreateCandidateRequest(
            @NotBlank(message = "email is required")
            @Email(message = "email must be a valid address")
            @Size(max = 254, message = "email must be at most 254 characters")
            String email,

            @NotBlank(message = "name is required")
            @Size(max = 120, message = "name must be at most 120 characters")
            String name
    ) {
    }

    public record QuestionRequest(
            @NotBlank(message = "title is required")
            @Size(max = 200, message = "title must be at most 200 characters")
            String title,

            @NotNull(message = "qtype is required")
            QuestionType qtype,

            JsonNode spec,

            JsonNode rubric,

            @JsonProperty("ideal_answer")
            String idealAnswer
    ) {
    }

    public record CreatePackRequest(
            @NotBlank(message = "name is required")
            @Size(max = 120, message = "name must be at most 120 characters")
            String name,

            @Min(value = 1, message = "version must be at least 1")
            Integer version,

            @Valid
            List<PackItemRequest> items
    ) {
    }

    public record PackItemRequest(
            @NotNull(message = "question_id is required")
            @JsonProperty("question_id")
            UUID questionId,

            @Min(value = PackItem.MIN_TIMER_SECONDS, message = "timer_seconds must be at least 10")
            @JsonProperty("timer_seconds")
            Integer timerSeconds
    ) {
    }

    public record CreateAssignmentRequest(
            @NotNull(message = "candidate_id is required")
            @JsonProperty("candidate_id")
            Integer candidateId,

            @NotNull(message = "pack_id is required")
            @JsonProperty("pack_id")
            Integer packId
    ) {
    }

    public record SubmitAnswerRequest(
            @NotNull(message = "assignment_id is required")
            @JsonProperty("assignment_id")
            UUID assignmentId,

            @NotNull(message = "question_id is required")
            @JsonProperty("question_id")
            UUID questionId,

            JsonNode answer,

            @JsonProperty("file_url")
            String fileUrl
    ) {
    }
}
