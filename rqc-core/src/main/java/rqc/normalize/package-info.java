/**
 * Mapping of host submissions, editors, decisions and reviews onto the RQC taxonomy,
 * including consent-driven anonymization of reviewers.
 */
package rqc.normalize;
