package com.intervue.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.intervue.dto.InterviewRequests;
import com.intervue.dto.InterviewResponses;
import com.intervue.evaluation.service.EvaluationPipeline;
import com.intervue.mapper.InterviewResponseMapper;
import com.intervue.model.Assignment;
import com.intervue.model.Candidate;
import com.intervue.model.Pack;
import com.intervue.model.PackItem;
import com.intervue.model.Question;
import com.intervue.model.Submission;
import com.intervue.repository.AssignmentRepository;
import com.intervue.repository.CandidateRepository;
import com.intervue.repository.PackItemRepository;
import com.intervue.repository.PackRepository;
import com.intervue.repository.QuestionRepository;
import com.intervue.repository.SubmissionRepository;
import com.intervue.storage.ObjectStorageClient;
import com.intervue.storage.ObjectStorageException;
import com.intervue.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Candidate-facing assignment lifecycle: start, view a question, submit, upload an attachment
 * and finish.
 */
@Service
public class CandidateFlowService {

    private static final Logger log = LoggerFactory.getLogger(CandidateFlowService.class);

    static final String STATUS_FINISHED = "finished";
    static final String DEFAULT_ATTACHMENT_NAME = "attachment";

    private final AssignmentRepository assignmentRepository;
    private final CandidateRepository candidateRepository;
    private final PackRepository packRepository;
    private final PackItemRepository packItemRepository;
    private final QuestionRepository questionRepository;
    private final SubmissionRepository submissionRepository;
    private final EvaluationPipeline evaluationPipeline;
    private final ObjectStorageClient objectStorageClient;
    private final InterviewResponseMapper responseMapper;

    public CandidateFlowService(
            AssignmentRepository assignmentRepository,
            CandidateRepository candidateRepository,
            PackRepository packRepository,
            PackItemRepository packItemRepository,
            QuestionRepository questionRepository,
            SubmissionRepository submissionRepository,
            EvaluationPipeline evaluationPipeline,
            ObjectStorageClient objectStorageClient,
            InterviewResponseMapper responseMapper
    ) {
        this.assignmentRepository = assignmentRepository;
        this.candidateRepository = candidateRepository;
        this.packRepository = packRepository;
        this.packItemRepository = packItemRepository;
        this.questionRepository = questionRepository;
        this.submissionRepository = submissionRepository;
        this.evaluationPipeline = evaluationPipeline;
        this.objectStorageClient = objectStorageClient;
        this.responseMapper = responseMapper;
    }

    @Transactional
    public InterviewResponses.AssignmentStarted start(UUID assignmentId) {
        Assignment assignment = requireAssignment(assignmentId);
        if (assignment.getStartedAt() == null) {
            assignment.setStartedAt(OffsetDateTime.now());
            assignment = assignmentRepository.save(assignment);
        }

        Candidate candidate = candidateRepository.findById(assignment.getCandidateId())
                .orElseThrow(() -> ApiException.notFound("Candidate not found for assignment " + assignmentId));
        Pack pack = packRepository.findById(assignment.getPackId())
                .orElseThrow(() -> ApiException.notFound("Pack not found for assignment " + assignmentId));
        return new InterviewResponses.AssignmentStarted(
                true,
                assignment.getId(),
                candidate.getName(),
                pack.getName(),
                assignment.getStartedAt()
        );
    }

    @Transactional(readOnly = true)
    public InterviewResponses.CandidateQuestion viewQuestion(UUID assignmentId, UUID questionId) {
        Assignment assignment = requireAssignment(assignmentId);
        PackItem item = packItemRepository.findByPackIdOrderBySortOrderAsc(assignment.getPackId()).stream()
                .filter(candidate -> candidate.getQuestionId().equals(questionId))
                .findFirst()
                .orElseThrow(() -> ApiException.notFound(
                        "Question " + questionId + " is not part of assignment " + assignmentId));
        Question question = requireQuestion(questionId);

        return new InterviewResponses.CandidateQuestion(
                true,
                assignment.getId(),
                new InterviewResponses.QuestionView(
                        question.getId(),
                        question.getTitle(),
                        question.getSpec(),
                        question.getRubric(),
                        question.getQtype(),
                        item.getTimerSeconds()
                )
        );
    }

    /**
     * Records the answer and grades it. The submission row is committed before grading so a
     * failed grade insert never loses the answer.
     */
    public InterviewResponses.SubmissionGraded submit(InterviewRequests.SubmitAnswerRequest request) {
        Assignment assignment = requireAssignment(request.assignmentId());
        if (!packItemRepository.existsByPackIdAndQuestionId(assignment.getPackId(), request.questionId())) {
            throw ApiException.invalidRequest(
                    "Question " + request.questionId() + " is not part of assignment " + assignment.getId());
        }
        Question question = requireQuestion(request.questionId());

        Submission submission = new Submission();
        submission.setId(UUID.randomUUID());
        submission.setAssignmentId(assignment.getId());
        submission.setQuestionId(question.getId());
        submission.setAnswer(answerOrEmpty(request.answer()));
        submission.setFileUrl(blankToNull(request.fileUrl()));
        submission.setCreatedAt(OffsetDateTime.now());
        Submission saved = submissionRepository.save(submission);

        EvaluationPipeline.GradedSubmission graded = evaluationPipeline.evaluate(question, saved);
        log.info("Graded submission {} for assignment {}: score={} outcome={}",
                saved.getId(), assignment.getId(), graded.grade().getScore(), graded.judgeResult().outcome());
        return responseMapper.toSubmissionGraded(saved, graded);
    }

    public InterviewResponses.AttachmentUploaded uploadAttachment(
            UUID assignmentId,
            String originalFilename,
            String contentType,
            byte[] bytes
    ) {
        requireAssignment(assignmentId);
        String destinationPath = assignmentId + "/" + UUID.randomUUID() + "-" + safeFilename(originalFilename);
        try {
            String fileUrl = objectStorageClient.put(bytes, destinationPath, contentType);
            return new InterviewResponses.AttachmentUploaded(true, fileUrl);
        } catch (ObjectStorageException ex) {
            log.warn("Attachment upload failed for assignment {}: {}", assignmentId, ex.getMessage());
            throw ApiException.storageUnavailable("Attachment upload failed: " + ex.getMessage());
        }
    }

    @Transactional
    public InterviewResponses.AssignmentFinished finish(UUID assignmentId) {
        Assignment assignment = requireAssignment(assignmentId);
        assignment.setFinishedAt(OffsetDateTime.now());
        Assignment saved = assignmentRepository.save(assignment);
        return new InterviewResponses.AssignmentFinished(true, saved.getId(), STATUS_FINISHED, saved.getFinishedAt());
    }

    private Assignment requireAssignment(UUID assignmentId) {
        return assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> ApiException.notFound("Assignment not found: " + assignmentId));
    }

    private Question requireQuestion(UUID questionId) {
        return questionRepository.findById(questionId)
                .orElseThrow(() -> ApiException.notFound("Question not found: " + questionId));
    }

    private static JsonNode answerOrEmpty(JsonNode answer) {
        return answer == null || answer.isNull() ? JsonNodeFactory.instance.objectNode() : answer;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static String safeFilename(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            return DEFAULT_ATTACHMENT_NAME;
        }
        String name = originalFilename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).trim();
        return name.isEmpty() ? DEFAULT_ATTACHMENT_NAME : name;
    }
}
