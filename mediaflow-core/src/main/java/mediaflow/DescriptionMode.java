package mediaflow;

/**
 * Verbosity of the generated description, chosen per conversation.
 */
public enum DescriptionMode {
    SHORT,
    LONG
}
