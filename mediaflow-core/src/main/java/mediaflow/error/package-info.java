/**
 * Failure taxonomy and user-facing messages.
 *
 * <p>Classification travels as {@link mediaflow.error.FailureKind} on typed exceptions;
 * {@link mediaflow.error.FailureClassifier} handles everything else.
 */
package mediaflow.error;
