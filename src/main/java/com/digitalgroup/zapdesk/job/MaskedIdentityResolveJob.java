package com.digitalgroup.zapdesk.job;

import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.gateway.service.GatewayConfigService;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.lead.service.IdentityResolverService;
import com.digitalgroup.zapdesk.domain.lead.service.LeadResolution;
import com.digitalgroup.zapdesk.domain.lead.service.LeadService;
import com.digitalgroup.zapdesk.domain.lead.service.MaskedIdentityResolution;
import com.digitalgroup.zapdesk.exception.UnresolvedIdentityException;
import com.digitalgroup.zapdesk.multitenancy.TenantContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Masked Identity Resolve Job
 * Asks the gateway again for the phone behind a masked lead and upgrades the
 * lead in place when it answers. Gives up after the configured attempts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaskedIdentityResolveJob {

    private final LeadService leadService;
    private final GatewayConfigService gatewayConfigService;
    private final IdentityResolverService identityResolver;

    /**
     * @throws UnresolvedIdentityException when the last attempt fails, so the job row records it
     */
    public void run(Long leadId, Long gatewayConfigId, int attempt) {
        Lead lead = leadService.findById(leadId);
        if (!lead.isMasked() || lead.getOriginalLid() == null) {
            log.debug("Lead {} no longer needs masked id resolution", leadId);
            return;
        }

        GatewayConfig config = gatewayConfigService.findById(gatewayConfigId);
        TenantContext.setCurrentTenant(config.getTenantId());
        try {
            MaskedIdentityResolution resolution = identityResolver.resolveMaskedIdentity(config, lead.getOriginalLid());
            if (resolution.hasPhone()) {
                LeadResolution result = leadService.unmask(lead, identityResolver.normalizeFullNumber(resolution.phoneDigits()));
                if (result.unmasked()) {
                    identityResolver.scheduleAvatarFetch(result.lead(), config);
                }
                return;
            }

            if (!identityResolver.scheduleMaskedIdentityResolution(lead, config, attempt + 1)) {
                throw new UnresolvedIdentityException(lead.getOriginalLid());
            }
        } finally {
            TenantContext.clear();
        }
    }
}
