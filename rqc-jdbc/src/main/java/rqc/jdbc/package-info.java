/**
 * JDBC implementations of the adapter's storage SPIs.
 *
 * <p>Every store works on the {@link java.sql.Connection} handed to it and never commits or
 * closes it. Schema scripts for H2, MySQL and PostgreSQL ship under {@code rqc/schema/}.
 *
 * @see rqc.jdbc.store.JdbcDeliveryTaskStores
 */
package rqc.jdbc;
