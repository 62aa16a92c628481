package com.intervue.controller;

import com.intervue.dto.InterviewRequests;
import com.intervue.dto.InterviewResponses;
import com.intervue.service.CandidateFlowService;
import com.intervue.web.ApiException;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class CandidateFlowController {

    private final CandidateFlowService candidateFlowService;

    public CandidateFlowController(CandidateFlowService candidateFlowService) {
        this.candidateFlowService = candidateFlowService;
    }

    @PostMapping("/assignments/{assignmentId}/start")
    public ResponseEntity<InterviewResponses.AssignmentStarted> start(@PathVariable UUID assignmentId) {
        return ResponseEntity.ok(candidateFlowService.start(assignmentId));
    }

    @GetMapping("/assignments/{assignmentId}/questions/{questionId}")
    public ResponseEntity<InterviewResponses.CandidateQuestion> viewQuestion(
            @PathVariable UUID assignmentId,
            @PathVariable UUID questionId
    ) {
        return ResponseEntity.ok(candidateFlowService.viewQuestion(assignmentId, questionId));
    }

    @PostMapping("/submissions")
    public ResponseEntity<InterviewResponses.SubmissionGraded> submit(
            @Valid @RequestBody InterviewRequests.SubmitAnswerRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(candidateFlowService.submit(request));
    }

    @PostMapping(value = "/submissions/attachments", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<InterviewResponses.AttachmentUploaded> uploadAttachment(
            @RequestParam("assignment_id") UUID assignmentId,
            @RequestParam("file") MultipartFile file
    ) {
        if (file.isEmpty()) {
            throw ApiException.invalidRequest("file must not be empty");
        }
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException ex) {
            throw ApiException.invalidRequest("Could not read uploaded file: " + ex.getMessage());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(candidateFlowService.uploadAttachment(
                assignmentId,
                file.getOriginalFilename(),
                file.getContentType(),
                bytes
        ));
    }

    @PostMapping("/assignments/{assignmentId}/finish")
    public ResponseEntity<InterviewResponses.AssignmentFinished> finish(@PathVariable UUID assignmentId) {
        return ResponseEntity.ok(candidateFlowService.finish(assignmentId));
    }
}
