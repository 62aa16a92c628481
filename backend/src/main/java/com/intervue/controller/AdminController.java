package com.intervue.controller;

import com.intervue.dto.InterviewRequests;
import com.intervue.dto.InterviewResponses;
import com.intervue.evaluation.config.JudgeProperties;
import com.intervue.evaluation.service.HealthProbe;
import com.intervue.mapper.InterviewResponseMapper;
import com.intervue.model.Assignment;
import com.intervue.model.Candidate;
import com.intervue.model.Pack;
import com.intervue.model.Question;
import com.intervue.service.CatalogService;
import com.intervue.service.ReportService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final CatalogService catalogService;
    private final ReportService reportService;
    private final HealthProbe healthProbe;
    private final JudgeProperties judgeProperties;
    private final InterviewResponseMapper responseMapper;

    public AdminController(
            CatalogService catalogService,
            ReportService reportService,
            HealthProbe healthProbe,
            JudgeProperties judgeProperties,
            InterviewResponseMapper responseMapper
    ) {
        this.catalogService = catalogService;
        this.reportService = reportService;
        this.healthProbe = healthProbe;
        this.judgeProperties = judgeProperties;
        this.responseMapper = responseMapper;
    }

    @PostMapping("/candidates")
    public ResponseEntity<InterviewResponses.CandidateCreated> createCandidate(
            @Valid @RequestBody InterviewRequests.CreateCandidateRequest request
    ) {
        Candidate candidate = catalogService.createCandidate(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new InterviewResponses.CandidateCreated(true, candidate.getId()));
    }

    @PostMapping("/questions")
    public ResponseEntity<InterviewResponses.QuestionDetail> createQuestion(
            @Valid @RequestBody InterviewRequests.QuestionRequest request
    ) {
        Question question = catalogService.createQuestion(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(responseMapper.toQuestionDetail(question));
    }

    @PutMapping("/questions/{questionId}")
    public ResponseEntity<InterviewResponses.QuestionDetail> reviseQuestion(
            @PathVariable UUID questionId,
            @Valid @RequestBody InterviewRequests.QuestionRequest request
    ) {
        Question question = catalogService.reviseQuestion(questionId, request);
        return ResponseEntity.ok(responseMapper.toQuestionDetail(question));
    }

    @PostMapping("/packs")
    public ResponseEntity<InterviewResponses.PackCreated> createPack(
            @Valid @RequestBody InterviewRequests.CreatePackRequest request
    ) {
        Pack pack = catalogService.createPack(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(new InterviewResponses.PackCreated(true, pack.getId()));
    }

    @PostMapping("/assignments")
    public ResponseEntity<InterviewResponses.AssignmentCreated> createAssignment(
            @Valid @RequestBody InterviewRequests.CreateAssignmentRequest request
    ) {
        Assignment assignment = catalogService.createAssignment(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new InterviewResponses.AssignmentCreated(true, assignment.getId()));
    }

    @GetMapping("/assignments/{assignmentId}/report")
    public ResponseEntity<InterviewResponses.AssignmentReport> assignmentReport(@PathVariable UUID assignmentId) {
        return ResponseEntity.ok(reportService.assignmentReport(assignmentId));
    }

    @GetMapping("/judge/health")
    public ResponseEntity<InterviewResponses.JudgeHealth> judgeHealth() {
        Duration timeout = Duration.ofSeconds(judgeProperties.getHealthTimeoutSeconds());
        return ResponseEntity.ok(responseMapper.toJudgeHealth(healthProbe.ping(timeout)));
    }
}
