/**
 * Access to the inference backend: the guarded gateway, the model handle cache and the
 * value types exchanged with the {@link mediaflow.spi.InferenceClient}.
 */
package mediaflow.ai;
