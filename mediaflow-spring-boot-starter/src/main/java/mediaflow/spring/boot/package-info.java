/**
 * Spring Boot auto-configuration for mediaflow, bound to {@code mediaflow.*} properties.
 */
package mediaflow.spring.boot;
