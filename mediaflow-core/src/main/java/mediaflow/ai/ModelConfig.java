package mediaflow.ai;

import java.util.Objects;

/**
 * Parameters that identify a model handle. Equal configs share one cached handle.
 *
 * @param model             backend model name
 * @param temperature       sampling temperature, 0 to 2
 * @param topK              top-k sampling, at least 1
 * @param topP              nucleus sampling, 0 to 1
 * @param maxOutputTokens   output ceiling, at least 1
 * @param systemInstruction system prompt, or {@code null}
 */
public record ModelConfig(
        String model,
        double temperature,
        int topK,
        double topP,
        int maxOutputTokens,
        String systemInstruction
) {
    public static final String DEFAULT_MODEL = "default";

    public ModelConfig {
        Objects.requireNonNull(model, "model");
        if (model.isEmpty()) {
            throw new IllegalArgumentException("model cannot be empty");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0 and 2");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1");
        }
        if (topP < 0.0 || topP > 1.0) {
            throw new IllegalArgumentException("topP must be between 0 and 1");
        }
        if (maxOutputTokens < 1) {
            throw new IllegalArgumentException("maxOutputTokens must be >= 1");
        }
    }

    public static ModelConfig defaults() {
        return new ModelConfig(DEFAULT_MODEL, 0.9, 1, 0.95, 1024, null);
    }

    public ModelConfig withSystemInstruction(String instruction) {
        return new ModelConfig(model, temperature, topK, topP, maxOutputTokens, instruction);
    }
}
