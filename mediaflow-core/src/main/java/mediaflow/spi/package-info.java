/**
 * Service provider interfaces: persistence (transactions, pending notifications, purging),
 * the inference backend, the chat transport, conversation configuration and metrics.
 *
 * @see mediaflow.spi.TransactionStore
 * @see mediaflow.spi.NotificationStore
 * @see mediaflow.spi.InferenceClient
 * @see mediaflow.spi.Transport
 */
package mediaflow.spi;
