package mediaflow.ai;

import java.util.Objects;

/**
 * One element of a prompt: a reference to an uploaded file or a piece of text.
 */
public sealed interface PromptPart permits PromptPart.FileData, PromptPart.Text {

    static FileData file(RemoteFile file) {
        return new FileData(file.uri(), file.mimeType());
    }

    static Text text(String text) {
        return new Text(text);
    }

    record FileData(String uri, String mimeType) implements PromptPart {
        public FileData {
            Objects.requireNonNull(uri, "uri");
        }
    }

    record Text(String text) implements PromptPart {
        public Text {
            Objects.requireNonNull(text, "text");
        }
    }
}
