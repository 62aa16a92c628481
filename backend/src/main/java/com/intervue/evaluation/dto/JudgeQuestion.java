package com.intervue.evaluation.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.UUID;

/**
 * Question context handed to the judge. {@code spec} and {@code rubric} stay opaque JSON.
 */
public record JudgeQuestion(
        UUID id,
        String title,
        JsonNode spec,
        JsonNode rubric
) {
    public JudgeQuestion {
        Objects.requireNonNull(id, "id is required");
        title = title == null ? "" : title;
        spec = spec == null || spec.isNull() ? JsonNodeFactory.instance.objectNode() : spec.deepCopy();
        rubric = rubric == null || rubric.isNull() ? JsonNodeFactory.instance.objectNode() : rubric.deepCopy();
    }

    public ObjectNode toJson() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("id", id.toString());
        root.put("title", title);
        root.set("spec", spec.deepCopy());
        root.set("rubric", rubric.deepCopy());
        return root;
    }
}
