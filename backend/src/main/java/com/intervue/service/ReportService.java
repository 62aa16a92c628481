package com.intervue.service;

import com.intervue.dto.InterviewResponses;
import com.intervue.mapper.InterviewResponseMapper;
import com.intervue.model.Assignment;
import com.intervue.model.Candidate;
import com.intervue.model.Grade;
import com.intervue.model.Pack;
import com.intervue.model.Question;
import com.intervue.model.Submission;
import com.intervue.repository.AssignmentRepository;
import com.intervue.repository.CandidateRepository;
import com.intervue.repository.GradeRepository;
import com.intervue.repository.PackRepository;
import com.intervue.repository.QuestionRepository;
import com.intervue.repository.SubmissionRepository;
import com.intervue.web.ApiException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ReportService {

    private final AssignmentRepository assignmentRepository;
    private final CandidateRepository candidateRepository;
    private final PackRepository packRepository;
    private final QuestionRepository questionRepository;
    private final SubmissionRepository submissionRepository;
    private final GradeRepository gradeRepository;
    private final InterviewResponseMapper responseMapper;

    public ReportService(
            AssignmentRepository assignmentRepository,
            CandidateRepository candidateRepository,
            PackRepository packRepository,
            QuestionRepository questionRepository,
            SubmissionRepository submissionRepository,
            GradeRepository gradeRepository,
            InterviewResponseMapper responseMapper
    ) {
        this.assignmentRepository = assignmentRepository;
        this.candidateRepository = candidateRepository;
        this.packRepository = packRepository;
        this.questionRepository = questionRepository;
        this.submissionRepository = submissionRepository;
        this.gradeRepository = gradeRepository;
        this.responseMapper = responseMapper;
    }

    /**
     * Builds the per-assignment report. Submissions are ordered by creation time and the average
     * covers graded submissions only (0.0 when none is graded).
     */
    @Transactional(readOnly = true)
    public InterviewResponses.AssignmentReport assignmentReport(UUID assignmentId) {
        Assignment assignment = assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> ApiException.notFound("Assignment not found: " + assignmentId));
        Candidate candidate = candidateRepository.findById(assignment.getCandidateId())
                .orElseThrow(() -> ApiException.notFound("Candidate not found for assignment " + assignmentId));
        Pack pack = packRepository.findById(assignment.getPackId())
                .orElseThrow(() -> ApiException.notFound("Pack not found for assignment " + assignmentId));

        List<Submission> submissions = submissionRepository.findByAssignmentIdOrderByCreatedAtAsc(assignmentId);
        List<UUID> submissionIds = submissions.stream().map(Submission::getId).toList();
        Map<UUID, Grade> gradesBySubmission = submissionIds.isEmpty()
                ? Map.of()
                : gradeRepository.findBySubmissionIdIn(submissionIds).stream()
                        .collect(Collectors.toMap(Grade::getSubmissionId, Function.identity()));
        Map<UUID, String> titles = questionRepository
                .findAllById(submissions.stream().map(Submission::getQuestionId).distinct().toList())
                .stream()
                .collect(Collectors.toMap(Question::getId, Question::getTitle));

        List<InterviewResponses.SubmissionReport> rows = submissions.stream()
                .map(submission -> {
                    Grade grade = gradesBySubmission.get(submission.getId());
                    return new InterviewResponses.SubmissionReport(
                            submission.getId(),
                            submission.getQuestionId(),
                            titles.get(submission.getQuestionId()),
                            submission.getAnswer(),
                            grade == null ? null : grade.getScore(),
                            grade == null ? null : grade.getRunner(),
                            grade == null ? null : responseMapper.visibleJudge(grade.getJudge()),
                            submission.getCreatedAt()
                    );
                })
                .toList();

        double averageScore = gradesBySubmission.values().stream()
                .mapToDouble(Grade::getScore)
                .average()
                .orElse(0.0);

        return new InterviewResponses.AssignmentReport(
                true,
                assignment.getId(),
                new InterviewResponses.CandidateSummary(candidate.getId(), candidate.getName(), candidate.getEmail()),
                new InterviewResponses.PackSummary(pack.getId(), pack.getName()),
                averageScore,
                rows
        );
    }
}
