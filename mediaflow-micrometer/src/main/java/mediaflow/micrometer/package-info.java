/**
 * Micrometer bridge for pipeline metrics.
 */
package mediaflow.micrometer;
