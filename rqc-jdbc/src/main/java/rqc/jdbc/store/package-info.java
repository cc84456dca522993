/**
 * Dialect-specific delivery task stores and their {@link java.util.ServiceLoader} registry.
 */
package rqc.jdbc.store;
