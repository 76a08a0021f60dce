package com.digitalgroup.zapdesk.domain.lead.service;

import com.digitalgroup.zapdesk.domain.lead.entity.Lead;

/**
 * Outcome of looking up a masked identifier.
 *
 * @param outcome      what the lookup established
 * @param existingLead lead already holding the masked id, if any
 * @param phoneDigits  real phone digits (country code included), when known
 */
public record MaskedIdentityResolution(Outcome outcome, Lead existingLead, String phoneDigits) {

    public enum Outcome {
        /** a lead or a phone number was found */
        RESOLVED,
        /** the gateway could not be asked right now */
        PENDING,
        /** nobody knows this identifier */
        UNRESOLVED
    }

    public static MaskedIdentityResolution resolved(Lead existingLead, String phoneDigits) {
        return new MaskedIdentityResolution(Outcome.RESOLVED, existingLead, phoneDigits);
    }

    public static MaskedIdentityResolution pending() {
        return new MaskedIdentityResolution(Outcome.PENDING, null, null);
    }

    public static MaskedIdentityResolution unresolved() {
        return new MaskedIdentityResolution(Outcome.UNRESOLVED, null, null);
    }

    public boolean isResolved() {
        return outcome == Outcome.RESOLVED;
    }

    public boolean isPending() {
        return outcome == Outcome.PENDING;
    }

    public boolean hasPhone() {
        return phoneDigits != null;
    }
}
