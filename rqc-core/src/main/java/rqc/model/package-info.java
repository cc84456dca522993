/**
 * Value types of the RQC adapter: credentials, consent, the normalized decision event and
 * the retry queue's persisted task.
 */
package rqc.model;
