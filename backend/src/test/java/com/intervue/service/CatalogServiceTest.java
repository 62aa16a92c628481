package com.intervue.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.intervue.dto.InterviewRequests;
import com.intervue.model.Assignment;
import com.intervue.model.Candidate;
import com.intervue.model.Pack;
import com.intervue.model.PackItem;
import com.intervue.model.Question;
import com.intervue.model.QuestionType;
import com.intervue.model.Submission;
import com.intervue.repository.PackItemRepository;
import com.intervue.repository.QuestionRepository;
import com.intervue.repository.SubmissionRepository;
import com.intervue.web.ApiException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@Import(CatalogService.class)
class CatalogServiceTest {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Autowired
    private CatalogService catalogService;

    @Autowired
    private QuestionRepository questionRepository;

    @Autowired
    private PackItemRepository packItemRepository;

    @Autowired
    private SubmissionRepository submissionRepository;

    @Test
    void createCandidateNormalizesEmailAndRejectsDuplicates() {
        Candidate candidate = catalogService.createCandidate(
                new InterviewRequests.CreateCandidateRequest("  Ada@Example.TEST ", "Ada Lovelace"));

        assertNotNull(candidate.getId());
        assertEquals("ada@example.test", candidate.getEmail());

        ApiException ex = assertThrows(ApiException.class, () -> catalogService.createCandidate(
                new InterviewRequests.CreateCandidateRequest("ada@example.test", "Someone Else")));
        assertEquals(HttpStatus.CONFLICT, ex.getStatus());
        assertEquals("candidate_email_taken", ex.getCode());
    }

    @Test
    void unreferencedQuestionIsEditedInPlace() throws Exception {
        Question created = catalogService.createQuestion(questionRequest("Joins", "{\"dialect\": \"postgres\"}"));

        Question revised = catalogService.reviseQuestion(created.getId(), questionRequest("Joins v2", "{}"));

        assertEquals(created.getId(), revised.getId());
        assertEquals(1, revised.getVersion());
        assertEquals("Joins v2", questionRepository.findById(created.getId()).orElseThrow().getTitle());
    }

    @Test
    void questionInAPackIsRevisedAsNewVersion() throws Exception {
        Question created = catalogService.createQuestion(questionRequest("Window functions", "{}"));
        catalogService.createPack(new InterviewRequests.CreatePackRequest(
                "Analytics", 1, List.of(new InterviewRequests.PackItemRequest(created.getId(), null))));

        Question revised = catalogService.reviseQuestion(created.getId(), questionRequest("Window functions!", "{}"));

        assertNotEquals(created.getId(), revised.getId());
        assertEquals(2, revised.getVersion());
        assertEquals("Window functions", questionRepository.findById(created.getId()).orElseThrow().getTitle());
    }

    @Test
    void questionWithSubmissionIsRevisedAsNewVersion() throws Exception {
        Question created = catalogService.createQuestion(questionRequest("Indexes", "{}"));
        Submission submission = new Submission();
        submission.setId(UUID.randomUUID());
        submission.setAssignmentId(UUID.randomUUID());
        submission.setQuestionId(created.getId());
        submission.setAnswer(TextNode.valueOf("B-tree"));
        submission.setCreatedAt(OffsetDateTime.now());
        submissionRepository.save(submission);

        Question revised = catalogService.reviseQuestion(created.getId(), questionRequest("Indexes", "{}"));

        assertEquals(2, revised.getVersion());
    }

    @Test
    void createPackKeepsItemOrderAndDefaultTimer() throws Exception {
        Question first = catalogService.createQuestion(questionRequest("First", "{}"));
        Question second = catalogService.createQuestion(questionRequest("Second", "{}"));

        Pack pack = catalogService.createPack(new InterviewRequests.CreatePackRequest("Mixed", null, List.of(
                new InterviewRequests.PackItemRequest(second.getId(), 45),
                new InterviewRequests.PackItemRequest(first.getId(), null)
        )));

        List<PackItem> items = packItemRepository.findByPackIdOrderBySortOrderAsc(pack.getId());
        assertEquals(1, pack.getVersion());
        assertEquals(2, items.size());
        assertEquals(second.getId(), items.get(0).getQuestionId());
        assertEquals(45, items.get(0).getTimerSeconds());
        assertEquals(PackItem.DEFAULT_TIMER_SECONDS, items.get(1).getTimerSeconds());
    }

    @Test
    void createPackRejectsUnknownQuestion() {
        ApiException ex = assertThrows(ApiException.class, () -> catalogService.createPack(
                new InterviewRequests.CreatePackRequest("Broken", 1,
                        List.of(new InterviewRequests.PackItemRequest(UUID.randomUUID(), 60)))));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatus());
    }

    @Test
    void createAssignmentValidatesCandidateAndPack() {
        Candidate candidate = catalogService.createCandidate(
                new InterviewRequests.CreateCandidateRequest("grace@example.test", "Grace"));
        Pack pack = catalogService.createPack(new InterviewRequests.CreatePackRequest("Empty", 1, List.of()));

        Assignment assignment = catalogService.createAssignment(
                new InterviewRequests.CreateAssignmentRequest(candidate.getId(), pack.getId()));

        assertNotNull(assignment.getId());
        assertThrows(ApiException.class, () -> catalogService.createAssignment(
                new InterviewRequests.CreateAssignmentRequest(candidate.getId(), 999_999)));
        assertThrows(ApiException.class, () -> catalogService.createAssignment(
                new InterviewRequests.CreateAssignmentRequest(999_999, pack.getId())));
    }

    private static InterviewRequests.QuestionRequest questionRequest(String title, String specJson) throws Exception {
        return new InterviewRequests.QuestionRequest(
                title,
                QuestionType.THEORY,
                OBJECT_MAPPER.readTree(specJson),
                OBJECT_MAPPER.readTree("{\"points\": [\"correctness\"]}"),
                "Reference answer"
        );
    }
}
