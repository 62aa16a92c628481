package com.intervue.evaluation.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Renders runner results as {@code {passed, checks:[{name, passed, ...details}], score_runner}}.
 */
public final class RunnerResultJsonCodec {

    private static final ObjectMapper DETAIL_MAPPER = new ObjectMapper();

    private RunnerResultJsonCodec() {
    }

    public static ObjectNode toJson(RunnerResult runnerResult) {
        if (runnerResult == null) {
            throw new IllegalArgumentException("Runner result is required");
        }

        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("passed", runnerResult.passed());
        ArrayNode checks = root.putArray("checks");
        for (RunnerCheck check : runnerResult.checks()) {
            ObjectNode checkNode = checks.addObject();
            checkNode.put("name", check.name());
            checkNode.put("passed", check.passed());
            for (Map.Entry<String, Object> detail : check.details().entrySet()) {
                JsonNode detailValue = DETAIL_MAPPER.valueToTree(detail.getValue());
                checkNode.set(detail.getKey(), detailValue);
            }
        }
        root.put("score_runner", runnerResult.scoreRunner());
        return root;
    }
}
