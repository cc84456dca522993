/**
 * Reviewer consent: whether identity and review text may be shared with RQC.
 */
package rqc.consent;
