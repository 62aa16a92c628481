package com.intervue.evaluation.service;

import com.intervue.evaluation.dto.JudgeQuestion;
import com.intervue.evaluation.dto.JudgeSubmission;
import com.intervue.evaluation.model.JudgeResult;
import com.intervue.evaluation.model.JudgeResultJsonCodec;
import com.intervue.evaluation.model.RunnerResult;
import com.intervue.evaluation.model.RunnerResultJsonCodec;
import com.intervue.evaluation.runner.DeterministicRunner;
import com.intervue.model.Grade;
import com.intervue.model.Question;
import com.intervue.model.Submission;
import com.intervue.repository.GradeRepository;
import com.intervue.storage.ObjectStorageClient;
import com.intervue.storage.StorageProperties;
import com.intervue.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Grades one submission: deterministic checks, then the judge, then a single grade insert.
 * <p>
 * The final score is the judge score alone; the runner result is stored alongside for audit.
 * The pipeline keeps no state between calls. Uniqueness of the grade per submission is enforced
 * by the store, and a second grade for the same submission is rejected with a conflict.
 */
@Service
public class EvaluationPipeline {

    private static final Logger log = LoggerFactory.getLogger(EvaluationPipeline.class);

    private final DeterministicRunner deterministicRunner;
    private final JudgeClient judgeClient;
    private final GradeRepository gradeRepository;
    private final ObjectStorageClient objectStorageClient;
    private final StorageProperties storageProperties;

    public EvaluationPipeline(
            DeterministicRunner deterministicRunner,
            JudgeClient judgeClient,
            GradeRepository gradeRepository,
            ObjectStorageClient objectStorageClient,
            StorageProperties storageProperties
    ) {
        this.deterministicRunner = deterministicRunner;
        this.judgeClient = judgeClient;
        this.gradeRepository = gradeRepository;
        this.objectStorageClient = objectStorageClient;
        this.storageProperties = storageProperties;
    }

    public GradedSubmission evaluate(Question question, Submission submission) {
        Objects.requireNonNull(question, "question is required");
        Objects.requireNonNull(submission, "submission is required");
        if (!question.getId().equals(submission.getQuestionId())) {
            throw new IllegalArgumentException(
                    "Submission " + submission.getId() + " does not answer question " + question.getId()
            );
        }

        RunnerResult runnerResult = deterministicRunner.run(question.getSpec(), submission.getAnswer());

        JudgeQuestion judgeQuestion = new JudgeQuestion(
                question.getId(),
                question.getTitle(),
                question.getSpec(),
                question.getRubric()
        );
        JudgeSubmission judgeSubmission = new JudgeSubmission(
                submission.getId(),
                submission.getAnswer(),
                judgeFileUrl(submission.getFileUrl()),
                submission.getCreatedAt()
        );
        JudgeResult judgeResult = judgeClient.judge(judgeQuestion, judgeSubmission, runnerResult);
        if (judgeResult.degraded()) {
            log.warn("Submission {} judged as {}", submission.getId(), judgeResult.outcome());
        }

        Grade grade = new Grade();
        grade.setId(UUID.randomUUID());
        grade.setSubmissionId(submission.getId());
        grade.setScore(finalScore(runnerResult, judgeResult));
        grade.setJudge(JudgeResultJsonCodec.toJson(judgeResult, true));
        grade.setRunner(RunnerResultJsonCodec.toJson(runnerResult));
        grade.setJudgeOutcome(judgeResult.outcome());
        grade.setCreatedAt(OffsetDateTime.now());

        Grade saved;
        try {
            saved = gradeRepository.saveAndFlush(grade);
        } catch (DataIntegrityViolationException ex) {
            log.info("Rejected second grade for submission {}", submission.getId());
            throw ApiException.gradeExists("Submission " + submission.getId() + " is already graded");
        }
        return new GradedSubmission(saved, runnerResult, judgeResult);
    }

    /**
     * Judge-only policy: the runner result does not contribute to the stored score.
     */
    static double finalScore(RunnerResult runnerResult, JudgeResult judgeResult) {
        return judgeResult.score();
    }

    private String judgeFileUrl(String fileUrl) {
        if (fileUrl == null || fileUrl.isBlank()) {
            return null;
        }
        try {
            return objectStorageClient.sign(fileUrl, storageProperties.getSignedUrlTtlSeconds());
        } catch (RuntimeException ex) {
            log.warn("Could not sign attachment reference, passing it unsigned: {}", ex.getMessage());
            return fileUrl;
        }
    }

    public record GradedSubmission(
            Grade grade,
            RunnerResult runnerResult,
            JudgeResult judgeResult
    ) {
    }
}
