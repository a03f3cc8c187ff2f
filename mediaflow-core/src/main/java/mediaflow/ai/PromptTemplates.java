package mediaflow.ai;

import mediaflow.DescriptionMode;
import mediaflow.MediaKind;

/**
 * Supplies the analysis prompt text.
 */
@FunctionalInterface
public interface PromptTemplates {

    /**
     * Builds the prompt sent along with the uploaded file.
     *
     * @param kind       image or video
     * @param mode       description mode read from the conversation config
     * @param userPrompt caption sent by the user, may be {@code null}
     * @return the prompt text
     */
    String analysisPrompt(MediaKind kind, DescriptionMode mode, String userPrompt);

    /**
     * Plain built-in templates.
     *
     * @return the default templates
     */
    static PromptTemplates defaults() {
        return (kind, mode, userPrompt) -> {
            String noun = kind == MediaKind.VIDEO ? "video" : "image";
            String base = mode == DescriptionMode.LONG
                    ? "Describe this " + noun + " in detail, covering people, objects, text, setting and actions."
                    : "Describe this " + noun + " in two or three sentences.";
            if (userPrompt == null || userPrompt.isBlank()) {
                return base;
            }
            return base + "\nThe user also asked: " + userPrompt.strip();
        };
    }
}
