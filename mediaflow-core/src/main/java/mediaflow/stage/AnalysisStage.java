package mediaflow.stage;

import mediaflow.ConversationConfig;
import mediaflow.ai.InferenceGateway;
import mediaflow.ai.PromptPart;
import mediaflow.ai.PromptTemplates;
import mediaflow.dispatch.Delivery;
import mediaflow.error.FailureClassifier;
import mediaflow.error.FailureKind;
import mediaflow.error.InferenceException;
import mediaflow.error.UserMessages;
import mediaflow.spi.ConversationConfigSource;
import mediaflow.stage.StageJob.AnalysisJob;

import java.util.List;
import java.util.Objects;

/**
 * Generates the description of a processed file and delivers it.
 *
 * <p>The conversation configuration is read when the job runs, not when it was submitted.
 * Artifacts are removed once a response exists.
 */
public final class AnalysisStage implements StageHandler<AnalysisJob> {
    private final InferenceGateway gateway;
    private final StageSupport support;
    private final ConversationConfigSource configSource;
    private final PromptTemplates prompts;
    private final AnalysisPolicy policy;
    private final UserMessages messages;

    public AnalysisStage(InferenceGateway gateway, StageSupport support, ConversationConfigSource configSource,
                         PromptTemplates prompts, AnalysisPolicy policy, UserMessages messages) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.support = Objects.requireNonNull(support, "support");
        this.configSource = Objects.requireNonNull(configSource, "configSource");
        this.prompts = Objects.requireNonNull(prompts, "prompts");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.messages = Objects.requireNonNull(messages, "messages");
    }

    @Override
    public StageResult handle(AnalysisJob job, StageContext<AnalysisJob> context) {
        String text;
        try {
            ConversationConfig config = configSource.configFor(job.route().conversationId());
            String prompt = prompts.analysisPrompt(job.media().kind(), config.descriptionMode(),
                    job.media().userPrompt());
            List<PromptPart> parts = List.of(PromptPart.file(job.file()), PromptPart.text(prompt));
            text = gateway.generate(parts, config.modelConfig(), policy.timeoutFor(job.media().kind()));
        } catch (InferenceException e) {
            return support.fail(job, context, e.kind(), FailureClassifier.describe(e));
        } catch (RuntimeException e) {
            return support.fail(job, context, FailureKind.GENERAL, FailureClassifier.describe(e));
        }

        if (text == null || text.isBlank()) {
            text = messages.emptyResponse(job.media().kind());
        }
        support.cleaner().cleanup(job);
        support.dispatcher().deliver(job.target(), Delivery.response(text.strip()));
        return StageResult.completed();
    }
}
