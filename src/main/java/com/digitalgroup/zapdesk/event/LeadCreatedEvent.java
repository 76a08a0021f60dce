package com.digitalgroup.zapdesk.event;

public record LeadCreatedEvent(Long leadId, Long tenantId, boolean masked) {
}
