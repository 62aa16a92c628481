package com.intervue.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.intervue.dto.InterviewRequests;
import com.intervue.model.Assignment;
import com.intervue.model.Candidate;
import com.intervue.model.Pack;
import com.intervue.model.PackItem;
import com.intervue.model.Question;
import com.intervue.repository.AssignmentRepository;
import com.intervue.repository.CandidateRepository;
import com.intervue.repository.PackItemRepository;
import com.intervue.repository.PackRepository;
import com.intervue.repository.QuestionRepository;
import com.intervue.repository.SubmissionRepository;
import com.intervue.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Admin-side management of candidates, questions, packs and assignments.
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final CandidateRepository candidateRepository;
    private final QuestionRepository questionRepository;
    private final PackRepository packRepository;
    private final PackItemRepository packItemRepository;
    private final AssignmentRepository assignmentRepository;
    private final SubmissionRepository submissionRepository;

    public CatalogService(
            CandidateRepository candidateRepository,
            QuestionRepository questionRepository,
            PackRepository packRepository,
            PackItemRepository packItemRepository,
            AssignmentRepository assignmentRepository,
            SubmissionRepository submissionRepository) {
        this.candidateRepository = candidateRepository;
        this.questionRepository = questionRepository;
        this.packRepository = packRepository;
        this.packItemRepository = packItemRepository;
        this.assignmentRepository = assignmentRepository;
        this.submissionRepository = submissionRepository;
    }

    @Transactional
    public Candidate createCandidate(InterviewRequests.CreateCandidateRequest request) {
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        if (candidateRepository.existsByEmailIgnoreCase(email)) {
            throw ApiException.candidateEmailTaken("A candidate with email " + email + " already exists");
        }

        Candidate candidate = new Candidate();
        candidate.setEmail(email);
        candidate.setName(request.name().trim());
        try {
            return candidateRepository.saveAndFlush(candidate);
        } catch (DataIntegrityViolationException ex) {
            throw ApiException.candidateEmailTaken("A candidate with email " + email + " already exists");
        }
    }

    @Transactional
    public Question createQuestion(InterviewRequests.QuestionRequest request) {
        Question question = new Question();
        question.setId(UUID.randomUUID());
        question.setVersion(1);
        applyQuestionFields(question, request);
        return questionRepository.save(question);
    }

    /**
     * Applies an edit. A question already referenced by a pack item or a submission is left
     * untouched and a new row with the next version is created instead.
     *
     * @return the edited question, or the new version
     */
    @Transactional
    public Question reviseQuestion(UUID questionId, InterviewRequests.QuestionRequest request) {
        Question current = requireQuestion(questionId);
        boolean inUse = packItemRepository.existsByQuestionId(questionId)
                || submissionRepository.existsByQuestionId(questionId);
        if (!inUse) {
            applyQuestionFields(current, request);
            return questionRepository.save(current);
        }

        Question revision = new Question();
        revision.setId(UUID.randomUUID());
        revision.setVersion(current.getVersion() + 1);
        applyQuestionFields(revision, request);
        log.info("Question {} is in use; created version {} as {}", questionId, revision.getVersion(), revision.getId());
        return questionRepository.save(revision);
    }

    @Transactional
    public Pack createPack(InterviewRequests.CreatePackRequest request) {
        Pack pack = new Pack();
        pack.setName(request.name().trim());
        pack.setVersion(request.version() == null ? 1 : request.version());
        Pack saved = packRepository.save(pack);

        List<InterviewRequests.PackItemRequest> items = request.items() == null ? List.of() : request.items();
        for (int i = 0; i < items.size(); i++) {
            InterviewRequests.PackItemRequest itemRequest = items.get(i);
            requireQuestion(itemRequest.questionId());

            PackItem item = new PackItem();
            item.setPackId(saved.getId());
            item.setQuestionId(itemRequest.questionId());
            item.setSortOrder(i);
            item.setTimerSeconds(itemRequest.timerSeconds() == null
                    ? PackItem.DEFAULT_TIMER_SECONDS
                    : itemRequest.timerSeconds());
            packItemRepository.save(item);
        }
        return saved;
    }

    @Transactional
    public Assignment createAssignment(InterviewRequests.CreateAssignmentRequest request) {
        if (!candidateRepository.existsById(request.candidateId())) {
            throw ApiException.notFound("Candidate not found: " + request.candidateId());
        }
        if (!packRepository.existsById(request.packId())) {
            throw ApiException.notFound("Pack not found: " + request.packId());
        }

        Assignment assignment = new Assignment();
        assignment.setId(UUID.randomUUID());
        assignment.setCandidateId(request.candidateId());
        assignment.setPackId(request.packId());
        return assignmentRepository.save(assignment);
    }

    private Question requireQuestion(UUID questionId) {
        return questionRepository.findById(questionId)
                .orElseThrow(() -> ApiException.notFound("Question not found: " + questionId));
    }

    private static void applyQuestionFields(Question question, InterviewRequests.QuestionRequest request) {
        question.setTitle(request.title().trim());
        question.setQtype(request.qtype());
        question.setSpec(objectOrEmpty(request.spec()));
        question.setRubric(objectOrEmpty(request.rubric()));
        question.setIdealAnswer(request.idealAnswer() == null ? "" : request.idealAnswer());
        question.setCreatedAt(question.getCreatedAt() == null ? OffsetDateTime.now() : question.getCreatedAt());
    }

    private static JsonNode objectOrEmpty(JsonNode value) {
        return value == null || value.isNull() ? JsonNodeFactory.instance.objectNode() : value;
    }
}
