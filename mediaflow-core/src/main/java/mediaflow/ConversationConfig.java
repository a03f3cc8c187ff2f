package mediaflow;

import mediaflow.ai.ModelConfig;

import java.util.Objects;

/**
 * Per-conversation settings read from the configuration collaborator.
 *
 * <p>The pipeline reads this at submission time (media toggles) and again at analysis
 * time (description mode, model settings); it is never carried between stages.
 *
 * @param descriptionMode    short or long descriptions
 * @param mediaImageEnabled  whether image submissions are processed
 * @param mediaVideoEnabled  whether video submissions are processed
 * @param modelConfig        model parameters for the analysis call
 */
public record ConversationConfig(
        DescriptionMode descriptionMode,
        boolean mediaImageEnabled,
        boolean mediaVideoEnabled,
        ModelConfig modelConfig) {

    public ConversationConfig {
        Objects.requireNonNull(descriptionMode, "descriptionMode");
        Objects.requireNonNull(modelConfig, "modelConfig");
    }

    /**
     * Configuration used when a conversation has no stored settings.
     *
     * @return short descriptions, all media enabled, default model
     */
    public static ConversationConfig defaults() {
        return new ConversationConfig(DescriptionMode.SHORT, true, true, ModelConfig.defaults());
    }

    /**
     * Whether the given media kind is enabled for this conversation.
     *
     * @param kind the submission kind
     * @return {@code false} for disabled or non-pipeline kinds
     */
    public boolean accepts(MediaKind kind) {
        return switch (kind) {
            case IMAGE -> mediaImageEnabled;
            case VIDEO -> mediaVideoEnabled;
            default -> false;
        };
    }

    public ConversationConfig withDescriptionMode(DescriptionMode mode) {
        return new ConversationConfig(mode, mediaImageEnabled, mediaVideoEnabled, modelConfig);
    }
}
