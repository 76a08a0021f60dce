package com.digitalgroup.zapdesk.domain.lead.service;

import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.lead.repository.LeadRepository;
import com.digitalgroup.zapdesk.exception.PhoneValidationException;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.ProfilePictureResult;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.WhatsAppContactClient;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.WhatsAppProviderRegistry;
import com.digitalgroup.zapdesk.job.DelayedJobService;
import com.digitalgroup.zapdesk.util.ChatIdUtils;
import com.digitalgroup.zapdesk.util.NormalizedPhone;
import com.digitalgroup.zapdesk.util.PhoneUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Identity Resolver
 * Turns raw sender identifiers into canonical phones, maps masked identifiers
 * back to real numbers and keeps lead avatars filled in.
 *
 * Gateway calls happen here and never inside the lead registry, so a slow
 * gateway only delays the lookup that needs it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityResolverService {

    private final LeadRepository leadRepository;
    private final WhatsAppProviderRegistry providerRegistry;
    private final DelayedJobService delayedJobService;

    @Value("${zapdesk.phone.default-country-code:55}")
    private String defaultCountryCode;

    @Value("${zapdesk.avatar.max-attempts:3}")
    private int avatarMaxAttempts;

    @Value("${zapdesk.avatar.retry-delay-seconds:60}")
    private long avatarRetryDelaySeconds;

    @Value("${zapdesk.masked-identity.max-attempts:3}")
    private int maskedMaxAttempts;

    @Value("${zapdesk.masked-identity.retry-delay-seconds:120}")
    private long maskedRetryDelaySeconds;

    /**
     * Canonical phone for a raw identifier, assuming the configured country when
     * the input carries none.
     *
     * @throws com.digitalgroup.zapdesk.exception.PhoneValidationException when the input is not a phone
     */
    public NormalizedPhone normalize(String rawPhone) {
        return PhoneUtils.normalize(rawPhone, defaultCountryCode);
    }

    /**
     * Canonical phone for a number that arrives with its country code already in front:
     * gateway chat ids, gateway-resolved digits and stored full numbers. Falls back to the
     * configured country only when no known country code matches.
     */
    public NormalizedPhone normalizeFullNumber(String rawPhone) {
        try {
            return PhoneUtils.normalizeFullNumber(rawPhone);
        } catch (PhoneValidationException e) {
            log.debug("No country code recognized in {}, assuming {}: {}", rawPhone, defaultCountryCode, e.getMessage());
            return PhoneUtils.normalize(rawPhone, defaultCountryCode);
        }
    }

    public String getDefaultCountryCode() {
        return defaultCountryCode;
    }

    /**
     * Looks for a lead that already carries the masked id, then asks the gateway.
     * A lead still marked masked does not end the search: the gateway may know the
     * phone by now.
     */
    @Transactional(readOnly = true)
    public MaskedIdentityResolution resolveMaskedIdentity(GatewayConfig config, String maskedId) {
        String lidDigits = ChatIdUtils.maskedDigits(maskedId);
        Optional<Lead> existing = leadRepository.findByMaskedId(config.getTenantId(), lidDigits);
        if (existing.isEmpty()) {
            existing = leadRepository.findFirstByTenantIdAndPhone(config.getTenantId(),
                    ChatIdUtils.maskedPhoneKey(lidDigits));
        }
        if (existing.isPresent() && !existing.get().isMasked()) {
            return MaskedIdentityResolution.resolved(existing.get(), existing.get().getFullPhone());
        }

        Optional<WhatsAppContactClient> contactClient = providerRegistry.contactClient(config.getProvider());
        if (contactClient.isEmpty()) {
            log.debug("Provider {} cannot resolve masked ids", config.getProvider());
            return existing.map(lead -> MaskedIdentityResolution.resolved(lead, null))
                    .orElseGet(MaskedIdentityResolution::unresolved);
        }

        try {
            Optional<String> phone = contactClient.get().resolveMaskedIdentity(config, lidDigits);
            if (phone.isPresent()) {
                return MaskedIdentityResolution.resolved(existing.orElse(null), phone.get());
            }
        } catch (ProviderException e) {
            log.warn("Gateway {} unavailable while resolving masked id {}: {}",
                    config.getName(), lidDigits, e.getMessage());
            return existing.map(lead -> MaskedIdentityResolution.resolved(lead, null))
                    .orElseGet(MaskedIdentityResolution::pending);
        }

        return existing.map(lead -> MaskedIdentityResolution.resolved(lead, null))
                .orElseGet(MaskedIdentityResolution::unresolved);
    }

    /**
     * Queues the first avatar lookup for a lead, off the request path.
     */
    public void scheduleAvatarFetch(Lead lead, GatewayConfig config) {
        if (lead.getAvatarUrl() != null || providerRegistry.contactClient(config.getProvider()).isEmpty()) {
            return;
        }
        delayedJobService.scheduleAvatarRetry(lead.getId(), config.getId(), 1, 0);
    }

    /**
     * Fetches the lead's profile picture. Transient misses are retried through a
     * persisted job until the attempt cap.
     *
     * @return true when an avatar was stored
     */
    @Transactional
    public boolean fetchAvatar(Lead lead, GatewayConfig config, int attempt) {
        Optional<WhatsAppContactClient> contactClient = providerRegistry.contactClient(config.getProvider());
        if (contactClient.isEmpty()) {
            return false;
        }

        String contactId = lead.isMasked() ? lead.getOriginalLid() : lead.getFullPhone();
        if (contactId == null) {
            return false;
        }

        ProfilePictureResult result;
        try {
            result = contactClient.get().fetchProfilePicture(config, contactId, lead.isMasked());
        } catch (ProviderException e) {
            result = ProfilePictureResult.retryLater(e.getFailureCause().name().toLowerCase());
        }

        if (result.isFound()) {
            lead.setAvatarUrl(result.url());
            leadRepository.save(lead);
            log.debug("Stored avatar for lead {}", lead.getId());
            return true;
        }

        if (result.retryable() && attempt < avatarMaxAttempts) {
            delayedJobService.scheduleAvatarRetry(lead.getId(), config.getId(), attempt + 1,
                    avatarRetryDelaySeconds * attempt);
            log.debug("Avatar for lead {} not available ({}), retry {} scheduled",
                    lead.getId(), result.reason(), attempt + 1);
        } else {
            log.info("Giving up on avatar for lead {} after attempt {}: {}", lead.getId(), attempt, result.reason());
        }
        return false;
    }

    /**
     * Queues a background lookup for a lead that is only known by its masked id.
     *
     * @return false once the attempt cap is reached
     */
    public boolean scheduleMaskedIdentityResolution(Lead lead, GatewayConfig config, int attempt) {
        if (attempt > maskedMaxAttempts) {
            log.info("Masked lead {} stays unresolved after {} attempts", lead.getId(), maskedMaxAttempts);
            return false;
        }
        delayedJobService.scheduleMaskedIdentityResolution(lead.getId(), config.getId(), attempt,
                maskedRetryDelaySeconds * attempt);
        return true;
    }
}
