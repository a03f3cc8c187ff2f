package mediaflow.spi;

import mediaflow.ai.ModelConfig;
import mediaflow.ai.RemoteFile;
import mediaflow.error.InferenceException;

import java.nio.file.Path;

/**
 * Boundary to the remote inference backend.
 *
 * <p>Implementations classify every failure they raise by setting the
 * {@link mediaflow.error.FailureKind} on the thrown {@link InferenceException}; the pipeline
 * never inspects error text.
 */
public interface InferenceClient {

    /**
     * Uploads local content to the backend's file storage.
     *
     * @return a reference to the stored file, usually in the {@code PROCESSING} state
     */
    RemoteFile upload(Path path, String mimeType) throws InferenceException;

    /**
     * Reads the current state of an uploaded file.
     */
    RemoteFile getFile(String name) throws InferenceException;

    void deleteFile(String name) throws InferenceException;

    /**
     * Creates a model handle for the given parameters. Handles are cached by the
     * {@link mediaflow.ai.InferenceGateway}.
     */
    GenerativeModel model(ModelConfig config) throws InferenceException;
}
