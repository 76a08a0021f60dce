package com.digitalgroup.zapdesk.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Domain Event Listener
 * Runs after the transaction that produced the event commits, so downstream
 * consumers (automation rules, inbox refresh) never see rolled-back rows.
 */
@Slf4j
@Component
public class DomainEventListener {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Async
    public void handleLeadCreated(LeadCreatedEvent event) {
        log.info("Lead {} created for tenant {} (masked={})", event.leadId(), event.tenantId(), event.masked());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Async
    public void handleMessageRecorded(MessageRecordedEvent event) {
        log.debug("Message {} recorded in conversation {} ({} {} via {})",
                event.messageId(), event.conversationId(), event.direction(), event.type(), event.origin());
    }
}
