package com.intervue.evaluation.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes free-form judge JSON into a {@link JudgeResult} and renders results back to JSON.
 * <p>
 * Normalization is lenient: each field is looked up through an ordered alias list (primary key
 * first), scores are coerced and clamped, and scalar list values are wrapped.
 */
public final class JudgeResultJsonCodec {

    public static final String FIELD_SCORE = "score";
    public static final String FIELD_VERDICT = "verdict";
    public static final String FIELD_MISTAKES = "mistakes";
    public static final String FIELD_IMPROVEMENTS = "improvements";
    public static final String FIELD_CITATIONS = "citations";
    public static final String FIELD_DEBUG = "debug";

    static final List<String> SCORE_KEYS = List.of(FIELD_SCORE, "grade");
    static final List<String> VERDICT_KEYS = List.of(FIELD_VERDICT, "summary");
    static final List<String> MISTAKES_KEYS = List.of(FIELD_MISTAKES, "errors");
    static final List<String> IMPROVEMENTS_KEYS = List.of(FIELD_IMPROVEMENTS, "advice");
    static final List<String> CITATIONS_KEYS = List.of(FIELD_CITATIONS);

    private JudgeResultJsonCodec() {
    }

    public static JudgeResult fromJudgeOutput(JsonNode judgeOutput, ObjectNode debug) {
        if (judgeOutput == null || !judgeOutput.isObject()) {
            throw new IllegalArgumentException("Judge output must be a JSON object");
        }

        return new JudgeResult(
                JudgeOutcome.JUDGED,
                coerceScore(firstPresent(judgeOutput, SCORE_KEYS)),
                coerceText(firstPresent(judgeOutput, VERDICT_KEYS)),
                coerceList(firstPresent(judgeOutput, MISTAKES_KEYS)),
                coerceList(firstPresent(judgeOutput, IMPROVEMENTS_KEYS)),
                coerceList(firstPresent(judgeOutput, CITATIONS_KEYS)),
                debug
        );
    }

    public static ObjectNode toJson(JudgeResult judgeResult, boolean includeDebug) {
        if (judgeResult == null) {
            throw new IllegalArgumentException("Judge result is required");
        }

        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put(FIELD_SCORE, judgeResult.score());
        root.put(FIELD_VERDICT, judgeResult.verdict());
        putStrings(root.putArray(FIELD_MISTAKES), judgeResult.mistakes());
        putStrings(root.putArray(FIELD_IMPROVEMENTS), judgeResult.improvements());
        putStrings(root.putArray(FIELD_CITATIONS), judgeResult.citations());
        if (includeDebug && judgeResult.debug() != null) {
            root.set(FIELD_DEBUG, judgeResult.debug().deepCopy());
        }
        return root;
    }

    /**
     * Returns a copy of a stored judge payload with the debug bag removed.
     */
    public static JsonNode redact(JsonNode storedJudgeJson) {
        if (storedJudgeJson == null || !storedJudgeJson.isObject()) {
            return storedJudgeJson;
        }
        ObjectNode copy = ((ObjectNode) storedJudgeJson).deepCopy();
        copy.remove(FIELD_DEBUG);
        return copy;
    }

    static JsonNode firstPresent(JsonNode root, List<String> keys) {
        for (String key : keys) {
            JsonNode value = root.get(key);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    static double coerceScore(JsonNode value) {
        if (value == null) {
            return JudgeResult.MIN_SCORE;
        }
        if (value.isNumber()) {
            return JudgeResult.clampScore(value.doubleValue());
        }
        if (value.isTextual()) {
            try {
                return JudgeResult.clampScore(Double.parseDouble(value.textValue().trim()));
            } catch (NumberFormatException ex) {
                return JudgeResult.MIN_SCORE;
            }
        }
        return JudgeResult.MIN_SCORE;
    }

    static String coerceText(JsonNode value) {
        if (value == null) {
            return "";
        }
        return value.isTextual() ? value.textValue() : value.toString();
    }

    static List<String> coerceList(JsonNode value) {
        if (value == null) {
            return List.of();
        }
        if (value.isArray()) {
            List<String> items = new ArrayList<>(value.size());
            for (JsonNode element : value) {
                if (element != null && !element.isNull()) {
                    items.add(coerceText(element));
                }
            }
            return items;
        }
        if (isFalsy(value)) {
            return List.of();
        }
        return List.of(coerceText(value));
    }

    /**
     * Null, {@code false}, zero, the empty string and empty containers carry no list items.
     */
    static boolean isFalsy(JsonNode value) {
        if (value.isNull() || value.isMissingNode()) {
            return true;
        }
        if (value.isBoolean()) {
            return !value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() == 0.0;
        }
        if (value.isTextual()) {
            return value.textValue().isEmpty();
        }
        if (value.isContainerNode()) {
            return value.isEmpty();
        }
        return false;
    }

    private static void putStrings(ArrayNode target, List<String> values) {
        values.forEach(target::add);
    }
}
