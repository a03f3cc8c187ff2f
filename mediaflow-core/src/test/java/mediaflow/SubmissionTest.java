package mediaflow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubmissionTest {

    @Test
    void kindIsInferredFromMimeType() {
        Submission video = Submission.builder("evt-1")
                .conversationId("chat-1")
                .mimeType("VIDEO/MP4")
                .contentRef("/tmp/v.mp4")
                .build();

        assertEquals(MediaKind.VIDEO, video.kind());
        assertEquals(MediaKind.TEXT, MediaKind.fromMimeType(null));
        assertEquals(MediaKind.AUDIO, MediaKind.fromMimeType("audio/ogg"));
    }

    @Test
    void pipelineMediaNeedsContent() {
        assertThrows(IllegalArgumentException.class, () -> Submission.builder("evt-1")
                .conversationId("chat-1")
                .mimeType("image/png")
                .build());
    }

    @Test
    void requiresIds() {
        assertThrows(NullPointerException.class, () -> Submission.builder("evt-1").build());
        assertThrows(IllegalArgumentException.class, () -> Submission.builder("").conversationId("c").build());
    }

    @Test
    void configTogglesPerKind() {
        ConversationConfig config = new ConversationConfig(DescriptionMode.LONG, false, true,
                ConversationConfig.defaults().modelConfig());

        assertFalse(config.accepts(MediaKind.IMAGE));
        assertTrue(config.accepts(MediaKind.VIDEO));
        assertFalse(config.accepts(MediaKind.TEXT));
        assertEquals(DescriptionMode.SHORT, config.withDescriptionMode(DescriptionMode.SHORT).descriptionMode());
    }
}
