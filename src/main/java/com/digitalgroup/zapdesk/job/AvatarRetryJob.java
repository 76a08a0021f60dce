package com.digitalgroup.zapdesk.job;

import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.gateway.service.GatewayConfigService;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.lead.service.IdentityResolverService;
import com.digitalgroup.zapdesk.domain.lead.service.LeadService;
import com.digitalgroup.zapdesk.multitenancy.TenantContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Avatar Retry Job
 * One profile picture lookup for a lead. A miss that may clear up later
 * queues the next attempt until the configured cap.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvatarRetryJob {

    private final LeadService leadService;
    private final GatewayConfigService gatewayConfigService;
    private final IdentityResolverService identityResolver;

    public void run(Long leadId, Long gatewayConfigId, int attempt) {
        Lead lead = leadService.findById(leadId);
        if (lead.getAvatarUrl() != null) {
            log.debug("Lead {} already has an avatar", leadId);
            return;
        }

        GatewayConfig config = gatewayConfigService.findById(gatewayConfigId);
        TenantContext.setCurrentTenant(config.getTenantId());
        try {
            log.debug("Avatar lookup attempt {} for lead {}", attempt, leadId);
            identityResolver.fetchAvatar(lead, config, attempt);
        } finally {
            TenantContext.clear();
        }
    }
}
