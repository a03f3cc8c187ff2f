package mediaflow.spi;

import mediaflow.ConversationConfig;

/**
 * Boundary to per-conversation configuration storage.
 *
 * <p>The pipeline calls this every time it needs a setting; implementations should not
 * expect their results to be cached.
 */
@FunctionalInterface
public interface ConversationConfigSource {

    /**
     * Returns the current configuration for a conversation.
     *
     * @param conversationId the conversation
     * @return the configuration, never {@code null}
     */
    ConversationConfig configFor(String conversationId);
}
