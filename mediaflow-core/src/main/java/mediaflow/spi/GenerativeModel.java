package mediaflow.spi;

import mediaflow.ai.PromptPart;
import mediaflow.error.InferenceException;

import java.util.List;

/**
 * A configured model that turns prompt parts into text.
 */
@FunctionalInterface
public interface GenerativeModel {

    /**
     * Generates text for the given prompt.
     *
     * @param parts the prompt, file references first
     * @return the generated text, possibly blank
     * @throws InferenceException classified failure, including safety blocks
     */
    String generate(List<PromptPart> parts) throws InferenceException;
}
