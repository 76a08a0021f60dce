package com.digitalgroup.zapdesk.domain.lead.service;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.lead.repository.LeadRepository;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.digitalgroup.zapdesk.exception.ProviderFailureCause;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.ProfilePictureResult;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.WhatsAppContactClient;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.WhatsAppProviderRegistry;
import com.digitalgroup.zapdesk.job.DelayedJobService;
import com.digitalgroup.zapdesk.util.NormalizedPhone;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdentityResolverServiceTest {

    private static final String MASKED_ID = "123456789012345@lid";
    private static final String MASKED_DIGITS = "123456789012345";

    @Mock
    private LeadRepository leadRepository;

    @Mock
    private WhatsAppProviderRegistry providerRegistry;

    @Mock
    private DelayedJobService delayedJobService;

    @Mock
    private WhatsAppContactClient contactClient;

    @InjectMocks
    private IdentityResolverService identityResolver;

    private GatewayConfig config;
    private Lead lead;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(identityResolver, "defaultCountryCode", "55");
        ReflectionTestUtils.setField(identityResolver, "avatarMaxAttempts", 3);
        ReflectionTestUtils.setField(identityResolver, "avatarRetryDelaySeconds", 60L);
        ReflectionTestUtils.setField(identityResolver, "maskedMaxAttempts", 3);
        ReflectionTestUtils.setField(identityResolver, "maskedRetryDelaySeconds", 120L);

        config = GatewayConfig.builder()
                .id(7L)
                .tenantId(10L)
                .name("Main line")
                .provider(GatewayProvider.WAHA)
                .active(true)
                .build();
        lead = Lead.builder()
                .id(1L)
                .tenantId(10L)
                .phone("45999990000")
                .countryCode("55")
                .masked(false)
                .build();
    }

    @Test
    void normalize_UsesConfiguredCountry() {
        assertEquals("5545999990000", identityResolver.normalize("45999990000").fullNumber());
    }

    @Test
    void normalizeFullNumber_ForeignLeadFullPhone_KeepsItsCountry() {
        Lead usLead = Lead.builder().tenantId(10L).phone("4155552671").countryCode("1").build();

        NormalizedPhone phone = identityResolver.normalizeFullNumber(usLead.getFullPhone());

        assertEquals("1", phone.countryCode());
        assertEquals("4155552671", phone.localNumber());
    }

    @Test
    void normalizeFullNumber_NoKnownCountryCode_AssumesConfiguredCountry() {
        NormalizedPhone phone = identityResolver.normalizeFullNumber("4533330000");

        assertEquals("55", phone.countryCode());
        assertEquals("4533330000", phone.localNumber());
    }

    @Test
    void resolveMaskedIdentity_KnownUnmaskedLead_ResolvesWithoutGateway() {
        lead.setOriginalLid(MASKED_ID);
        when(leadRepository.findByMaskedId(10L, MASKED_DIGITS)).thenReturn(Optional.of(lead));

        MaskedIdentityResolution resolution = identityResolver.resolveMaskedIdentity(config, MASKED_ID);

        assertTrue(resolution.isResolved());
        assertSame(lead, resolution.existingLead());
        assertEquals("5545999990000", resolution.phoneDigits());
        verifyNoInteractions(providerRegistry);
    }

    @Test
    void resolveMaskedIdentity_GatewayKnowsPhone_Resolves() {
        when(leadRepository.findByMaskedId(10L, MASKED_DIGITS)).thenReturn(Optional.empty());
        when(leadRepository.findFirstByTenantIdAndPhone(10L, "LID_" + MASKED_DIGITS)).thenReturn(Optional.empty());
        when(providerRegistry.contactClient(GatewayProvider.WAHA)).thenReturn(Optional.of(contactClient));
        when(contactClient.resolveMaskedIdentity(config, MASKED_DIGITS)).thenReturn(Optional.of("5545999990000"));

        MaskedIdentityResolution resolution = identityResolver.resolveMaskedIdentity(config, MASKED_ID);

        assertTrue(resolution.isResolved());
        assertNull(resolution.existingLead());
        assertEquals("5545999990000", resolution.phoneDigits());
    }

    @Test
    void resolveMaskedIdentity_UnknownEverywhere_IsUnresolved() {
        when(leadRepository.findByMaskedId(10L, MASKED_DIGITS)).thenReturn(Optional.empty());
        when(leadRepository.findFirstByTenantIdAndPhone(10L, "LID_" + MASKED_DIGITS)).thenReturn(Optional.empty());
        when(providerRegistry.contactClient(GatewayProvider.WAHA)).thenReturn(Optional.of(contactClient));
        when(contactClient.resolveMaskedIdentity(config, MASKED_DIGITS)).thenReturn(Optional.empty());

        MaskedIdentityResolution resolution = identityResolver.resolveMaskedIdentity(config, MASKED_ID);

        assertEquals(MaskedIdentityResolution.Outcome.UNRESOLVED, resolution.outcome());
    }

    @Test
    void resolveMaskedIdentity_GatewayDown_IsPending() {
        when(leadRepository.findByMaskedId(10L, MASKED_DIGITS)).thenReturn(Optional.empty());
        when(leadRepository.findFirstByTenantIdAndPhone(10L, "LID_" + MASKED_DIGITS)).thenReturn(Optional.empty());
        when(providerRegistry.contactClient(GatewayProvider.WAHA)).thenReturn(Optional.of(contactClient));
        when(contactClient.resolveMaskedIdentity(config, MASKED_DIGITS)).thenThrow(
                new ProviderException(GatewayProvider.WAHA, ProviderFailureCause.SESSION_NOT_FOUND, "down", 404));

        MaskedIdentityResolution resolution = identityResolver.resolveMaskedIdentity(config, MASKED_ID);

        assertTrue(resolution.isPending());
    }

    @Test
    void resolveMaskedIdentity_MaskedLeadAndNoPhone_ResolvesToThatLead() {
        Lead masked = Lead.builder().id(2L).tenantId(10L).phone("LID_" + MASKED_DIGITS).masked(true)
                .originalLid(MASKED_ID).build();
        when(leadRepository.findByMaskedId(10L, MASKED_DIGITS)).thenReturn(Optional.of(masked));
        when(providerRegistry.contactClient(GatewayProvider.WAHA)).thenReturn(Optional.of(contactClient));
        when(contactClient.resolveMaskedIdentity(config, MASKED_DIGITS)).thenReturn(Optional.empty());

        MaskedIdentityResolution resolution = identityResolver.resolveMaskedIdentity(config, MASKED_ID);

        assertTrue(resolution.isResolved());
        assertFalse(resolution.hasPhone());
        assertSame(masked, resolution.existingLead());
    }

    @Test
    void scheduleAvatarFetch_QueuesFirstAttemptImmediately() {
        when(providerRegistry.contactClient(GatewayProvider.WAHA)).thenReturn(Optional.of(contactClient));

        identityResolver.scheduleAvatarFetch(lead, config);

        verify(delayedJobService).scheduleAvatarRetry(1L, 7L, 1, 0);
    }

    @Test
    void scheduleAvatarFetch_ExistingAvatar_DoesNothing() {
        lead.setAvatarUrl("https://pps.whatsapp.net/a.jpg");

        identityResolver.scheduleAvatarFetch(lead, config);

        verifyNoInteractions(delayedJobService);
    }

    @Test
    void fetchAvatar_Found_StoresUrl() {
        when(providerRegistry.contactClient(GatewayProvider.WAHA)).thenReturn(Optional.of(contactClient));
        when(contactClient.fetchProfilePicture(config, "5545999990000", false))
                .thenReturn(ProfilePictureResult.found("https://pps.whatsapp.net/a.jpg"));

        assertTrue(identityResolver.fetchAvatar(lead, config, 1));

        assertEquals("https://pps.whatsapp.net/a.jpg", lead.getAvatarUrl());
        verify(leadRepository).save(lead);
    }

    @Test
    void fetchAvatar_RetryableMiss_SchedulesNextAttemptWithBackoff() {
        when(providerRegistry.contactClient(GatewayProvider.WAHA)).thenReturn(Optional.of(contactClient));
        when(contactClient.fetchProfilePicture(config, "5545999990000", false))
                .thenReturn(ProfilePictureResult.retryLater("not_ready"));

        assertFalse(identityResolver.fetchAvatar(lead, config, 2));

        verify(delayedJobService).scheduleAvatarRetry(1L, 7L, 3, 120L);
    }

    @Test
    void fetchAvatar_LastAttempt_GivesUp() {
        when(providerRegistry.contactClient(GatewayProvider.WAHA)).thenReturn(Optional.of(contactClient));
        when(contactClient.fetchProfilePicture(config, "5545999990000", false))
                .thenReturn(ProfilePictureResult.retryLater("not_ready"));

        identityResolver.fetchAvatar(lead, config, 3);

        verifyNoInteractions(delayedJobService);
    }

    @Test
    void scheduleMaskedIdentityResolution_StopsAtCap() {
        assertTrue(identityResolver.scheduleMaskedIdentityResolution(lead, config, 3));
        assertFalse(identityResolver.scheduleMaskedIdentityResolution(lead, config, 4));

        verify(delayedJobService).scheduleMaskedIdentityResolution(1L, 7L, 3, 360L);
        verifyNoMoreInteractions(delayedJobService);
    }
}
