package com.intervue.evaluation.provider;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatCompletionEnvelopeTest {

    @Test
    void readsMessageContent() {
        String body = "{\"choices\":[{\"message\":{\"content\":\"{\\\"score\\\": 1}\"}}]}";

        assertEquals("{\"score\": 1}", ChatCompletionEnvelope.candidateText(body));
    }

    @Test
    void fallsBackToMessageText() {
        String body = "{\"choices\":[{\"message\":{\"text\":\"plain\"}}]}";

        assertEquals("plain", ChatCompletionEnvelope.candidateText(body));
    }

    @Test
    void jsonBodyWithoutContentIsUsedAsIs() {
        assertEquals("{\"score\":42}", ChatCompletionEnvelope.candidateText("{\"score\": 42}"));
    }

    @Test
    void nonJsonBodyIsReturnedVerbatim() {
        assertEquals("hello there", ChatCompletionEnvelope.candidateText("hello there"));
        assertFalse(ChatCompletionEnvelope.isJson("hello there"));
        assertTrue(ChatCompletionEnvelope.isJson("{\"ok\": true}"));
    }

    @Test
    void excerptKeepsShortTextAndTruncatesLongText() {
        assertEquals("short", ChatCompletionEnvelope.excerpt("short"));
        String excerpt = ChatCompletionEnvelope.excerpt("y".repeat(401));
        assertEquals("y".repeat(400) + "...", excerpt);
    }
}
