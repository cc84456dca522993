/**
 * Spring Boot auto-configuration for the RQC adapter.
 */
package rqc.spring.boot;
