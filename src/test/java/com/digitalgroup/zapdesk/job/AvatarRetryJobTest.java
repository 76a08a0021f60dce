package com.digitalgroup.zapdesk.job;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.gateway.service.GatewayConfigService;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.lead.service.IdentityResolverService;
import com.digitalgroup.zapdesk.domain.lead.service.LeadService;
import com.digitalgroup.zapdesk.multitenancy.TenantContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AvatarRetryJobTest {

    @Mock
    private LeadService leadService;

    @Mock
    private GatewayConfigService gatewayConfigService;

    @Mock
    private IdentityResolverService identityResolver;

    @InjectMocks
    private AvatarRetryJob job;

    @Test
    void run_NoAvatarYet_LooksUpInGatewayTenant() {
        Lead lead = Lead.builder().id(1L).tenantId(10L).phone("45999990000").build();
        GatewayConfig config = GatewayConfig.builder().id(7L).tenantId(10L).provider(GatewayProvider.WAHA).build();
        when(leadService.findById(1L)).thenReturn(lead);
        when(gatewayConfigService.findById(7L)).thenReturn(config);
        when(identityResolver.fetchAvatar(lead, config, 2)).thenAnswer(inv -> {
            assertEquals(10L, TenantContext.getCurrentTenant());
            return true;
        });

        job.run(1L, 7L, 2);

        verify(identityResolver).fetchAvatar(lead, config, 2);
        assertFalse(TenantContext.hasTenant());
    }

    @Test
    void run_AvatarAlreadyStored_Skips() {
        Lead lead = Lead.builder().id(1L).tenantId(10L).avatarUrl("https://pps.whatsapp.net/a.jpg").build();
        when(leadService.findById(1L)).thenReturn(lead);

        job.run(1L, 7L, 2);

        verifyNoInteractions(gatewayConfigService, identityResolver);
    }
}
