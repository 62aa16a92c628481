package com.intervue.evaluation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.intervue.evaluation.dto.JudgeSubmission;
import com.intervue.evaluation.model.JudgeOutcome;
import com.intervue.evaluation.model.JudgeResult;
import com.intervue.evaluation.runner.DeterministicRunner;
import com.intervue.model.Grade;
import com.intervue.model.Question;
import com.intervue.model.QuestionType;
import com.intervue.model.Submission;
import com.intervue.repository.GradeRepository;
import com.intervue.storage.ObjectStorageClient;
import com.intervue.storage.ObjectStorageException;
import com.intervue.storage.StorageProperties;
import com.intervue.web.ApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EvaluationPipelineTest {

    private final JudgeClient judgeClient = mock(JudgeClient.class);
    private final GradeRepository gradeRepository = mock(GradeRepository.class);
    private final ObjectStorageClient objectStorageClient = mock(ObjectStorageClient.class);
    private final StorageProperties storageProperties = new StorageProperties();

    private EvaluationPipeline pipeline;
    private Question question;

    @BeforeEach
    void setUp() {
        pipeline = new EvaluationPipeline(
                new DeterministicRunner(),
                judgeClient,
                gradeRepository,
                objectStorageClient,
                storageProperties
        );
        question = new Question();
        question.setId(UUID.fromString("00000000-0000-0000-0000-000000000301"));
        question.setTitle("Count orders per customer");
        question.setQtype(QuestionType.PRACTICAL);
        when(gradeRepository.saveAndFlush(any(Grade.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void finalScoreIsTheJudgeScoreEvenWhenRunnerFails() {
        when(judgeClient.judge(any(), any(), any())).thenReturn(judged(87));
        Submission submission = submission(TextNode.valueOf(""), null);

        EvaluationPipeline.GradedSubmission graded = pipeline.evaluate(question, submission);

        assertFalse(graded.runnerResult().passed());
        assertEquals(87.0, graded.grade().getScore());
        assertEquals(submission.getId(), graded.grade().getSubmissionId());
        assertEquals(JudgeOutcome.JUDGED, graded.grade().getJudgeOutcome());
        assertEquals(87.0, graded.grade().getJudge().get("score").doubleValue());
        assertEquals(0.0, graded.grade().getRunner().get("score_runner").doubleValue());
    }

    @Test
    void storedJudgePayloadKeepsDebugBag() {
        when(judgeClient.judge(any(), any(), any())).thenReturn(judged(50));

        EvaluationPipeline.GradedSubmission graded =
                pipeline.evaluate(question, submission(TextNode.valueOf("answer"), null));

        assertEquals(200, graded.grade().getJudge().get("debug").get("http_status").intValue());
    }

    @Test
    void judgeReceivesSignedAttachmentUrl() {
        when(judgeClient.judge(any(), any(), any())).thenReturn(judged(60));
        when(objectStorageClient.sign("a1/report.csv", 300L)).thenReturn("https://storage.test/signed?token=t");

        pipeline.evaluate(question, submission(TextNode.valueOf("see file"), "a1/report.csv"));

        ArgumentCaptor<JudgeSubmission> captor = ArgumentCaptor.forClass(JudgeSubmission.class);
        verify(judgeClient).judge(any(), captor.capture(), any());
        assertEquals("https://storage.test/signed?token=t", captor.getValue().fileUrl());
    }

    @Test
    void signingFailureFallsBackToUnsignedReference() {
        when(judgeClient.judge(any(), any(), any())).thenReturn(judged(60));
        when(objectStorageClient.sign(anyString(), anyLong())).thenThrow(new ObjectStorageException("not configured"));

        pipeline.evaluate(question, submission(TextNode.valueOf("see file"), "a1/report.csv"));

        ArgumentCaptor<JudgeSubmission> captor = ArgumentCaptor.forClass(JudgeSubmission.class);
        verify(judgeClient).judge(any(), captor.capture(), any());
        assertEquals("a1/report.csv", captor.getValue().fileUrl());
    }

    @Test
    void submissionWithoutAttachmentSkipsSigning() {
        when(judgeClient.judge(any(), any(), any())).thenReturn(judged(60));

        pipeline.evaluate(question, submission(TextNode.valueOf("text"), null));

        verify(objectStorageClient, never()).sign(anyString(), anyLong());
        ArgumentCaptor<JudgeSubmission> captor = ArgumentCaptor.forClass(JudgeSubmission.class);
        verify(judgeClient).judge(any(), captor.capture(), any());
        assertNull(captor.getValue().fileUrl());
    }

    @Test
    void secondGradeForSameSubmissionIsAConflict() {
        when(judgeClient.judge(any(), any(), any())).thenReturn(judged(60));
        when(gradeRepository.saveAndFlush(any(Grade.class)))
                .thenThrow(new DataIntegrityViolationException("uq_grades_submission"));

        ApiException ex = assertThrows(ApiException.class,
                () -> pipeline.evaluate(question, submission(TextNode.valueOf("text"), null)));

        assertEquals(HttpStatus.CONFLICT, ex.getStatus());
        assertEquals("grade_exists", ex.getCode());
    }

    @Test
    void degradedJudgeStillProducesGrade() {
        when(judgeClient.judge(any(), any(), any())).thenReturn(JudgeResult.degraded(
                JudgeOutcome.NO_CREDENTIAL,
                "Judge unavailable (no API key)",
                List.of("Judge API key not configured on server."),
                null
        ));

        EvaluationPipeline.GradedSubmission graded =
                pipeline.evaluate(question, submission(TextNode.valueOf("id,n\n1,a\n"), null));

        assertEquals(0.0, graded.grade().getScore());
        assertEquals(JudgeOutcome.NO_CREDENTIAL, graded.grade().getJudgeOutcome());
        assertEquals(100.0, graded.runnerResult().scoreRunner());
    }

    @Test
    void rejectsSubmissionForAnotherQuestion() {
        Submission submission = submission(TextNode.valueOf("text"), null);
        submission.setQuestionId(UUID.randomUUID());

        assertThrows(IllegalArgumentException.class, () -> pipeline.evaluate(question, submission));
        verify(judgeClient, never()).judge(any(), any(), any());
    }

    private Submission submission(JsonNode answer, String fileUrl) {
        Submission submission = new Submission();
        submission.setId(UUID.randomUUID());
        submission.setAssignmentId(UUID.randomUUID());
        submission.setQuestionId(question.getId());
        submission.setAnswer(answer);
        submission.setFileUrl(fileUrl);
        submission.setCreatedAt(OffsetDateTime.parse("2026-05-01T10:00:00Z"));
        return submission;
    }

    private static JudgeResult judged(double score) {
        ObjectNode debug = JsonNodeFactory.instance.objectNode();
        debug.put("http_status", 200);
        debug.put("raw_excerpt", "{\"score\": " + score + "}");
        return new JudgeResult(JudgeOutcome.JUDGED, score, "ok", List.of(), List.of(), List.of(), debug);
    }
}
