package mediaflow.dispatch;

import mediaflow.MediaKind;
import mediaflow.error.FailureKind;

import java.util.Objects;

/**
 * What the dispatcher delivers for a transaction: the generated response or a
 * classified terminal failure.
 */
public sealed interface Delivery permits Delivery.Response, Delivery.Failure {

    static Response response(String text) {
        return new Response(text);
    }

    static Failure failure(FailureKind kind, MediaKind media) {
        return new Failure(kind, media);
    }

    /**
     * Generated text. Stored on the transaction before sending.
     */
    record Response(String text) implements Delivery {
        public Response {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Terminal failure, rendered through {@link mediaflow.error.UserMessages}.
     */
    record Failure(FailureKind kind, MediaKind media) implements Delivery {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(media, "media");
        }
    }
}
