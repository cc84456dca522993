package rqc.consent;

import rqc.model.ConsentRecord;

/**
 * Current consent of a reviewer and whether the host should ask the consent question now.
 */
public record ConsentLookup(ConsentRecord record, boolean promptRequired) {
}
