package com.digitalgroup.zapdesk.domain.message.service;

import com.digitalgroup.zapdesk.domain.conversation.entity.Conversation;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.message.entity.Message;
import com.digitalgroup.zapdesk.domain.message.repository.MessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
@Import(MessageLedgerService.class)
class MessageLedgerServiceTest {

    private static final String SERIALIZED_ID = "true_5545999990000@c.us_3EB0ABC";

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private MessageRepository messageRepository;

    @Autowired
    private MessageLedgerService ledger;

    private Lead lead;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        lead = entityManager.persist(Lead.builder()
                .tenantId(10L)
                .name("Maria Silva")
                .phone("45999990000")
                .countryCode("55")
                .build());
        conversation = entityManager.persist(Conversation.builder()
                .tenantId(10L)
                .lead(lead)
                .build());
    }

    private Message newMessage(String externalId) {
        return Message.builder()
                .tenantId(10L)
                .conversation(conversation)
                .lead(lead)
                .content("Olá")
                .externalId(externalId)
                .build();
    }

    @Test
    void record_SerializedId_IsFoundByEitherForm() {
        Message recorded = ledger.record(newMessage(SERIALIZED_ID));
        entityManager.flush();
        entityManager.clear();

        Optional<Message> byShort = ledger.findByProviderId(10L, "3EB0ABC");
        Optional<Message> byFull = ledger.findByProviderId(10L, SERIALIZED_ID);

        assertEquals("3EB0ABC", recorded.getShortId());
        assertEquals(recorded.getId(), byShort.map(Message::getId).orElse(null));
        assertEquals(recorded.getId(), byFull.map(Message::getId).orElse(null));
        assertEquals(1, messageRepository.count());
    }

    @Test
    void isKnown_EitherIdForm_DetectsDuplicate() {
        ledger.record(newMessage(SERIALIZED_ID));
        entityManager.flush();

        assertTrue(ledger.isKnown(10L, SERIALIZED_ID));
        assertTrue(ledger.isKnown(10L, "3EB0ABC"));
        assertTrue(ledger.isKnown(10L, "false_5545999990000@c.us_3EB0ABC"));
        assertFalse(ledger.isKnown(11L, "3EB0ABC"));
        assertFalse(ledger.isKnown(10L, null));
    }

    @Test
    void findByProviderId_ShortStoredId_MatchesSerializedReceipt() {
        Message recorded = ledger.record(newMessage("3EB0XYZ"));
        entityManager.flush();

        assertEquals(recorded.getId(),
                ledger.findByProviderId(10L, "true_5545999990000@c.us_3EB0XYZ").map(Message::getId).orElse(null));
    }

    @Test
    void findByProviderId_LegacyRowWithoutShortId_FallsBackToSubstring() {
        Message legacy = newMessage("true_5545999990000@c.us_3EB0OLD");
        legacy.setShortId("unrelated");
        entityManager.persist(legacy);
        entityManager.flush();

        assertEquals(legacy.getId(), ledger.findByProviderId(10L, "3EB0OLD").map(Message::getId).orElse(null));
        assertTrue(ledger.findByProviderId(10L, "3EB0MISSING").isEmpty());
    }
}
