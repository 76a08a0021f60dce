package com.digitalgroup.zapdesk.domain.conversation.service;

import com.digitalgroup.zapdesk.domain.common.enums.ConversationStatus;
import com.digitalgroup.zapdesk.domain.conversation.entity.Conversation;
import com.digitalgroup.zapdesk.domain.conversation.repository.ConversationRepository;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Conversation registry.
 * A lead has at most one active (open or pending) conversation; events reuse it
 * and a new one is opened only when none is active.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private final ConversationRepository conversationRepository;

    @Transactional(readOnly = true)
    public Conversation findById(Long id) {
        return conversationRepository.findWithLeadById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Conversation", id));
    }

    /**
     * Active conversation for the lead, created when missing. A pending conversation
     * is reopened when the lead writes in.
     */
    @Transactional
    public Conversation resolveForLead(Lead lead, GatewayConfig config, boolean inbound) {
        Optional<Conversation> active = conversationRepository.findActiveByLead(lead.getId());
        if (active.isPresent()) {
            Conversation conversation = active.get();
            if (inbound && conversation.getStatus().isPending()) {
                conversation.reopen();
                log.debug("Reopened pending conversation {} on inbound message", conversation.getId());
            }
            if (conversation.getGatewayConfigId() == null && config != null) {
                conversation.setGatewayConfigId(config.getId());
            }
            return conversationRepository.save(conversation);
        }

        Conversation conversation = conversationRepository.save(Conversation.builder()
                .tenantId(lead.getTenantId())
                .lead(lead)
                .gatewayConfigId(config != null ? config.getId() : null)
                .status(ConversationStatus.OPEN)
                .assignedTo(lead.getAssignedTo())
                .build());
        log.info("Opened conversation {} for lead {}", conversation.getId(), lead.getId());
        return conversation;
    }

    @Transactional
    public Conversation registerInbound(Conversation conversation, LocalDateTime at) {
        conversation.registerInbound(at != null ? at : LocalDateTime.now());
        return conversationRepository.save(conversation);
    }

    @Transactional
    public Conversation registerOutbound(Conversation conversation, LocalDateTime at) {
        conversation.registerOutbound(at != null ? at : LocalDateTime.now());
        return conversationRepository.save(conversation);
    }

    /**
     * The first agent to answer an unassigned conversation takes it.
     *
     * @return true when the assignment changed
     */
    @Transactional
    public boolean assignIfUnassigned(Conversation conversation, Long agentId) {
        if (agentId == null || !conversation.isUnassigned()) {
            return false;
        }
        conversation.setAssignedTo(agentId);
        conversationRepository.save(conversation);
        log.info("Conversation {} assigned to first responder {}", conversation.getId(), agentId);
        return true;
    }
}
