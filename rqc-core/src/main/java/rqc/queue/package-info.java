/**
 * Durable retry queue for decision reports that could not be delivered synchronously.
 *
 * <p>The queue is drained only from outside, by whatever scheduler the host runs; see
 * {@link rqc.queue.DurableRetryQueue#drain(java.time.Instant)}.
 */
package rqc.queue;
