package mediaflow.ai;

import mediaflow.error.CircuitOpenException;
import mediaflow.error.FailureClassifier;
import mediaflow.error.FailureKind;
import mediaflow.error.InferenceException;
import mediaflow.guard.CircuitBreaker;
import mediaflow.spi.GenerativeModel;
import mediaflow.spi.InferenceClient;
import mediaflow.util.DaemonThreadFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stage-facing wrapper around the {@link InferenceClient}.
 *
 * <p>Uploads and generation calls pass through the shared {@link CircuitBreaker} and race
 * against a timeout; a call that loses the race is cancelled and reported as
 * {@link FailureKind#TIMEOUT}. Only failures that point at an unhealthy backend
 * ({@link FailureKind#isServiceFailure()}) count against the breaker. Status queries are
 * cheap and unguarded; deletions are best-effort.
 */
public final class InferenceGateway implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(InferenceGateway.class.getName());

    private final InferenceClient client;
    private final CircuitBreaker breaker;
    private final ModelCache<GenerativeModel> models;
    private final ExecutorService callExecutor;

    public InferenceGateway(InferenceClient client, CircuitBreaker breaker, ModelCache<GenerativeModel> models) {
        this.client = Objects.requireNonNull(client, "client");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.models = Objects.requireNonNull(models, "models");
        this.callExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("mediaflow-inference-"));
    }

    /**
     * Uploads local content through the breaker.
     *
     * @throws CircuitOpenException if the breaker rejects the call
     * @throws InferenceException   classified upload failure or timeout
     */
    public RemoteFile upload(Path path, String mimeType, Duration timeout) throws InferenceException {
        return guarded("upload", timeout, () -> client.upload(path, mimeType));
    }

    public RemoteFile fileStatus(String name) throws InferenceException {
        return client.getFile(name);
    }

    /**
     * Deletes a remote file, logging instead of propagating failures.
     *
     * @param name the remote file name, ignored when {@code null}
     * @return {@code true} if the backend confirmed the deletion
     */
    public boolean deleteQuietly(String name) {
        if (name == null) {
            return false;
        }
        try {
            client.deleteFile(name);
            return true;
        } catch (InferenceException | RuntimeException e) {
            logger.log(Level.WARNING, "Failed to delete remote file " + name, e);
            return false;
        }
    }

    /**
     * Generates text with a cached model handle.
     *
     * @param parts   prompt parts
     * @param config  model parameters, used as the cache key
     * @param timeout ceiling for the whole call
     * @return the generated text
     * @throws CircuitOpenException if the breaker rejects the call
     * @throws InferenceException   classified failure or timeout
     */
    public String generate(List<PromptPart> parts, ModelConfig config, Duration timeout) throws InferenceException {
        return guarded("generate", timeout, () -> models.getOrCreate(config, client::model).generate(parts));
    }

    public CircuitBreaker breaker() {
        return breaker;
    }

    public ModelCache<GenerativeModel> models() {
        return models;
    }

    private <T> T guarded(String operation, Duration timeout, Callable<T> call) throws InferenceException {
        if (!breaker.canExecute()) {
            throw new CircuitOpenException(operation);
        }
        try {
            T result = race(operation, timeout, call);
            breaker.recordSuccess();
            return result;
        } catch (InferenceException e) {
            if (e.kind().isServiceFailure()) {
                breaker.recordFailure();
            } else {
                breaker.recordSuccess();
            }
            throw e;
        } catch (RuntimeException e) {
            // a rejected submit must still release a half-open trial
            breaker.recordFailure();
            throw e;
        }
    }

    private <T> T race(String operation, Duration timeout, Callable<T> call) throws InferenceException {
        Future<T> future = callExecutor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new InferenceException(FailureKind.TIMEOUT, operation + " timed out after " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InferenceException inference) {
                throw inference;
            }
            throw new InferenceException(FailureClassifier.classify(cause), FailureClassifier.describe(cause), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new InferenceException(FailureKind.GENERAL, operation + " interrupted", e);
        }
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
