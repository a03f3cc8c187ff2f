package mediaflow.stage;

import mediaflow.DescriptionMode;
import mediaflow.MediaKind;

import java.util.Objects;

/**
 * The media a job works on. Content stays on local disk under {@code contentRef}.
 *
 * @param kind            image or video
 * @param contentRef      local path of the content
 * @param mimeType        content type
 * @param userPrompt      caption sent with the media, may be {@code null}
 * @param descriptionMode mode configured at submission time; analysis reads the current
 *                        configuration again and uses that instead
 */
public record MediaPayload(MediaKind kind, String contentRef, String mimeType, String userPrompt,
                           DescriptionMode descriptionMode) {
    public MediaPayload {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(contentRef, "contentRef");
    }
}
