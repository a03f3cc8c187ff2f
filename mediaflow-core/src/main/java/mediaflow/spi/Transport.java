package mediaflow.spi;

import mediaflow.error.TransportException;

/**
 * Boundary to the chat network.
 */
public interface Transport {

    /**
     * Sends a plain message.
     *
     * @param destination the conversation address
     * @param text        message text
     * @throws TransportException if the message was not accepted
     */
    void send(String destination, String text) throws TransportException;

    /**
     * Sends a message quoting an earlier inbound message.
     *
     * @param destination     the conversation address
     * @param quotedMessageId id of the message to quote
     * @param text            message text
     * @throws TransportException if the message was not accepted
     */
    void reply(String destination, String quotedMessageId, String text) throws TransportException;
}
