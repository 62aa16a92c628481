package com.intervue.evaluation.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Submission context handed to the judge. {@code fileUrl} is the reference the judge should
 * fetch, already signed when signing succeeded.
 */
public record JudgeSubmission(
        UUID submissionId,
        JsonNode answer,
        String fileUrl,
        OffsetDateTime createdAt
) {
    public JudgeSubmission {
        Objects.requireNonNull(submissionId, "submissionId is required");
        answer = answer == null ? NullNode.getInstance() : answer.deepCopy();
    }

    public ObjectNode toJson() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("submission_id", submissionId.toString());
        root.set("answer", answer.deepCopy());
        root.put("file_url", fileUrl);
        root.put("created_at", createdAt == null ? null : createdAt.toString());
        return root;
    }
}
