package mediaflow.dispatch;

import mediaflow.error.TransportException;
import mediaflow.spi.Transport;

/**
 * Sends one message: a plain send first, then the reply form when a quote reference exists.
 */
final class DeliveryAttempt {

    private DeliveryAttempt() {
    }

    /**
     * @return {@code null} on success, otherwise the failure of the last form tried with
     *     earlier failures attached as suppressed
     */
    static TransportException send(Transport transport, String destination, String quotedMessageId, String text) {
        TransportException failure;
        try {
            transport.send(destination, text);
            return null;
        } catch (TransportException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new TransportException("send failed: " + e.getMessage(), e);
        }
        if (quotedMessageId == null) {
            return failure;
        }
        try {
            transport.reply(destination, quotedMessageId, text);
            return null;
        } catch (TransportException | RuntimeException e) {
            failure.addSuppressed(e);
            return failure;
        }
    }
}
