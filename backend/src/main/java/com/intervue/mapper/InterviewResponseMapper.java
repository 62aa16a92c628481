package com.intervue.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.intervue.config.IntervueRuntimeProperties;
import com.intervue.dto.InterviewResponses;
import com.intervue.evaluation.dto.HealthProbeResult;
import com.intervue.evaluation.model.JudgeResultJsonCodec;
import com.intervue.evaluation.model.RunnerResultJsonCodec;
import com.intervue.evaluation.service.EvaluationPipeline;
import com.intervue.model.Question;
import com.intervue.model.Submission;
import org.springframework.stereotype.Component;

/**
 * Builds outbound payloads. Debug-only diagnostics are stripped here, at the HTTP boundary,
 * unless {@code intervue.debug} is enabled.
 */
@Component
public class InterviewResponseMapper {

    private final IntervueRuntimeProperties runtimeProperties;

    public InterviewResponseMapper(IntervueRuntimeProperties runtimeProperties) {
        this.runtimeProperties = runtimeProperties;
    }

    public InterviewResponses.QuestionDetail toQuestionDetail(Question question) {
        return new InterviewResponses.QuestionDetail(
                question.getId(),
                question.getTitle(),
                question.getQtype(),
                question.getSpec(),
                question.getRubric(),
                question.getIdealAnswer(),
                question.getVersion()
        );
    }

    public InterviewResponses.SubmissionGraded toSubmissionGraded(
            Submission submission,
            EvaluationPipeline.GradedSubmission graded
    ) {
        return new InterviewResponses.SubmissionGraded(
                true,
                submission.getId(),
                graded.grade().getId(),
                graded.grade().getScore(),
                RunnerResultJsonCodec.toJson(graded.runnerResult()),
                JudgeResultJsonCodec.toJson(graded.judgeResult(), runtimeProperties.isDebug()),
                submission.getFileUrl()
        );
    }

    public InterviewResponses.JudgeHealth toJudgeHealth(HealthProbeResult probeResult) {
        HealthProbeResult visible = runtimeProperties.isDebug() ? probeResult : probeResult.withoutExcerpt();
        return new InterviewResponses.JudgeHealth(visible.ok(), visible.info());
    }

    /**
     * Stored judge JSON as it may be shown outside the service.
     */
    public JsonNode visibleJudge(JsonNode storedJudge) {
        return runtimeProperties.isDebug() ? storedJudge : JudgeResultJsonCodec.redact(storedJudge);
    }
}
