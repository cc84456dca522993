/**
 * Service provider interfaces for persistence, metrics and operator notification.
 *
 * <p>Store methods take an explicit {@link java.sql.Connection} obtained from a
 * {@link rqc.spi.ConnectionProvider}; the {@code rqc-jdbc} module supplies the implementations.
 */
package rqc.spi;
