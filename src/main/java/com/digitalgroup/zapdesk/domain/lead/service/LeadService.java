package com.digitalgroup.zapdesk.domain.lead.service;

import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.lead.repository.LeadRepository;
import com.digitalgroup.zapdesk.event.LeadCreatedEvent;
import com.digitalgroup.zapdesk.exception.ResourceNotFoundException;
import com.digitalgroup.zapdesk.util.ChatIdUtils;
import com.digitalgroup.zapdesk.util.NormalizedPhone;
import com.digitalgroup.zapdesk.util.PhoneUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Lead registry.
 * One lead per (tenant, phone). Lookups try the national number, then the legacy
 * full-number form, then the masked id. Every interaction refreshes the lead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadService {

    static final String MASKED_NAME_PREFIX = "Lead Facebook ";

    private final LeadRepository leadRepository;
    private final LeadWriter leadWriter;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(readOnly = true)
    public Lead findById(Long id) {
        return leadRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Lead", id));
    }

    /**
     * Finds the lead behind the contact or creates it. When a concurrent event for the
     * same contact inserts the lead first, the lead it created is returned instead.
     *
     * @param observedName the name WhatsApp reports for the contact, may be null
     */
    @Transactional
    public LeadResolution findOrCreate(GatewayConfig config, ContactIdentity identity, String observedName) {
        Optional<Lead> existing = findExisting(config.getTenantId(), identity);
        if (existing.isEmpty()) {
            try {
                return new LeadResolution(create(config, identity, observedName), true, false);
            } catch (DataIntegrityViolationException e) {
                log.info("Lead for tenant {} was created concurrently, reusing it: {}",
                        config.getTenantId(), e.getMostSpecificCause().getMessage());
                existing = findExisting(config.getTenantId(), identity);
                if (existing.isEmpty()) {
                    throw e;
                }
            }
        }

        Lead lead = existing.get();
        boolean unmasked = refresh(lead, identity, observedName);
        return new LeadResolution(leadRepository.save(lead), false, unmasked);
    }

    /**
     * Lookup only: the lead behind the contact, if one was ever created.
     */
    @Transactional(readOnly = true)
    public Optional<Lead> find(Long tenantId, ContactIdentity identity) {
        return findExisting(tenantId, identity);
    }

    private Optional<Lead> findExisting(Long tenantId, ContactIdentity identity) {
        if (identity.hasPhone()) {
            NormalizedPhone phone = identity.phone();
            Optional<Lead> lead = leadRepository.findFirstByTenantIdAndPhone(tenantId, phone.localNumber());
            if (lead.isEmpty()) {
                lead = leadRepository.findFirstByTenantIdAndPhone(tenantId, phone.fullNumber());
            }
            if (lead.isPresent()) {
                return lead;
            }
        }
        if (identity.hasMaskedId()) {
            String lidDigits = ChatIdUtils.maskedDigits(identity.maskedId());
            Optional<Lead> lead = leadRepository.findByMaskedId(tenantId, lidDigits);
            if (lead.isEmpty()) {
                lead = leadRepository.findFirstByTenantIdAndPhone(tenantId, ChatIdUtils.maskedPhoneKey(lidDigits));
            }
            return lead;
        }
        return Optional.empty();
    }

    private Lead create(GatewayConfig config, ContactIdentity identity, String observedName) {
        boolean masked = !identity.hasPhone();
        Lead lead = Lead.builder()
                .tenantId(config.getTenantId())
                .phone(masked ? ChatIdUtils.maskedPhoneKey(identity.maskedId()) : identity.phone().localNumber())
                .countryCode(masked ? PhoneUtils.BRAZIL : identity.phone().countryCode())
                .masked(masked)
                .originalLid(identity.storedMaskedId())
                .source("whatsapp")
                .build();

        if (isUsableName(observedName)) {
            lead.setName(observedName.trim());
            lead.setWhatsappName(observedName.trim());
        } else {
            lead.setName(placeholderName(lead, identity));
        }
        lead.touchInteraction();

        lead = leadWriter.insert(lead);
        log.info("Created lead {} for tenant {} ({})", lead.getId(), lead.getTenantId(),
                masked ? "masked " + lead.getOriginalLid() : lead.getDisplayPhone());
        eventPublisher.publishEvent(new LeadCreatedEvent(lead.getId(), lead.getTenantId(), masked));
        return lead;
    }

    /**
     * Applies what a new interaction tells us. Returns true when a masked lead got its phone.
     */
    private boolean refresh(Lead lead, ContactIdentity identity, String observedName) {
        lead.touchInteraction();

        if (isUsableName(observedName)) {
            String name = observedName.trim();
            lead.setWhatsappName(name);
            if (lead.hasPlaceholderName()) {
                log.debug("Replacing placeholder name of lead {} with '{}'", lead.getId(), name);
                lead.setName(name);
            }
        }

        if (identity.hasMaskedId() && lead.getOriginalLid() == null) {
            lead.setOriginalLid(identity.storedMaskedId());
        }

        if (lead.isMasked() && identity.hasPhone()) {
            NormalizedPhone phone = identity.phone();
            if (leadRepository.existsByTenantIdAndPhone(lead.getTenantId(), phone.localNumber())) {
                log.warn("Masked lead {} resolved to {} but another lead already owns that phone",
                        lead.getId(), phone.fullNumber());
                return false;
            }
            lead.setPhone(phone.localNumber());
            lead.setCountryCode(phone.countryCode());
            lead.setMasked(false);
            if (lead.getName() != null && lead.getName().startsWith(MASKED_NAME_PREFIX)) {
                lead.setName(Lead.PLACEHOLDER_PREFIX + PhoneUtils.formatForDisplay(phone.localNumber(), phone.countryCode()));
            }
            log.info("Lead {} unmasked to {}", lead.getId(), phone.fullNumber());
            return true;
        }
        return false;
    }

    /**
     * Stores the phone learned for a masked lead outside of an event (background resolution).
     */
    @Transactional
    public LeadResolution unmask(Lead lead, NormalizedPhone phone) {
        boolean unmasked = refresh(lead, ContactIdentity.ofPhone(phone), null);
        return new LeadResolution(leadRepository.save(lead), false, unmasked);
    }

    /**
     * First responder becomes the lead's owner.
     */
    @Transactional
    public void assignIfUnassigned(Lead lead, Long agentId) {
        if (agentId != null && lead.getAssignedTo() == null) {
            lead.setAssignedTo(agentId);
            leadRepository.save(lead);
            log.debug("Lead {} assigned to agent {}", lead.getId(), agentId);
        }
    }

    @Transactional
    public void cacheDeliveryChatId(Lead lead, String chatId) {
        if (chatId != null && !chatId.equals(lead.getWhatsappChatId())) {
            lead.setWhatsappChatId(chatId);
            leadRepository.save(lead);
        }
    }

    private String placeholderName(Lead lead, ContactIdentity identity) {
        if (lead.isMasked()) {
            return MASKED_NAME_PREFIX + PhoneUtils.lastDigits(ChatIdUtils.maskedDigits(identity.maskedId()), 6);
        }
        return Lead.PLACEHOLDER_PREFIX + lead.getDisplayPhone();
    }

    /**
     * Names made only of digits and symbols are phone echoes, not names.
     */
    static boolean isUsableName(String name) {
        return name != null && !name.isBlank() && name.chars().anyMatch(Character::isLetter);
    }
}
