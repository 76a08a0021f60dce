package com.digitalgroup.zapdesk.domain.lead.service;

import com.digitalgroup.zapdesk.domain.lead.entity.Lead;

/**
 * @param created  the lead did not exist before this event
 * @param unmasked a masked lead just learned its real phone
 */
public record LeadResolution(Lead lead, boolean created, boolean unmasked) {
}
