/**
 * Shapes in which the host manuscript workflow hands its state to the adapter.
 */
package rqc.host;
