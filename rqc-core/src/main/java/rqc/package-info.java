/**
 * Review Quality Collector adapter: reports peer-review decisions from a manuscript workflow to
 * the RQC grading service.
 *
 * <p>{@link rqc.RqcAdapter} is the host-facing entry point. It normalizes workflow state into
 * the RQC taxonomy, applies reviewer consent, attempts delivery once, and parks failed decision
 * reports in a durable retry queue that an external scheduler drains via
 * {@link rqc.RqcAdapter#drainDueTasks(java.time.Instant)}.
 */
package rqc;
