package com.digitalgroup.zapdesk.domain.message.service;

import com.digitalgroup.zapdesk.domain.message.entity.Message;
import com.digitalgroup.zapdesk.domain.message.repository.MessageRepository;
import com.digitalgroup.zapdesk.event.MessageRecordedEvent;
import com.digitalgroup.zapdesk.util.ChatIdUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Message ledger.
 * Appends messages and finds them again by whatever form of provider id an event carries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageLedgerService {

    private final MessageRepository messageRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * True when a message with this provider id, in full or short form, is already stored.
     */
    @Transactional(readOnly = true)
    public boolean isKnown(Long tenantId, String providerMessageId) {
        if (providerMessageId == null || providerMessageId.isBlank()) {
            return false;
        }
        return messageRepository.existsByTenantIdAndExternalId(tenantId, providerMessageId)
                || messageRepository.existsByTenantIdAndShortId(tenantId, ChatIdUtils.shortMessageId(providerMessageId));
    }

    /**
     * Lookup order: short id, exact external id, then substring of legacy external ids.
     */
    @Transactional(readOnly = true)
    public Optional<Message> findByProviderId(Long tenantId, String providerMessageId) {
        if (providerMessageId == null || providerMessageId.isBlank()) {
            return Optional.empty();
        }
        String shortId = ChatIdUtils.shortMessageId(providerMessageId);

        Optional<Message> message = messageRepository.findFirstByTenantIdAndShortIdOrderByCreatedAtDesc(tenantId, shortId);
        if (message.isPresent()) {
            return message;
        }
        message = messageRepository.findFirstByTenantIdAndExternalIdOrderByCreatedAtDesc(tenantId, providerMessageId);
        if (message.isPresent()) {
            return message;
        }
        return messageRepository.findByExternalIdContaining(tenantId, shortId, PageRequest.of(0, 1))
                .stream()
                .findFirst();
    }

    /**
     * Stores a message and announces it once the transaction commits.
     */
    @Transactional
    public Message record(Message message) {
        if (message.getShortId() == null && message.getExternalId() != null) {
            message.setShortId(ChatIdUtils.shortMessageId(message.getExternalId()));
        }
        if (message.getContent() == null) {
            message.setContent("");
        }

        Message saved = messageRepository.save(message);
        log.debug("Recorded {} {} message {} (external {})",
                saved.getDirection(), saved.getType(), saved.getId(), saved.getExternalId());

        eventPublisher.publishEvent(new MessageRecordedEvent(
                saved.getId(),
                saved.getConversation().getId(),
                saved.getLead().getId(),
                saved.getTenantId(),
                saved.getDirection(),
                saved.getType(),
                saved.getOrigin()));
        return saved;
    }

    @Transactional
    public Message save(Message message) {
        return messageRepository.save(message);
    }
}
