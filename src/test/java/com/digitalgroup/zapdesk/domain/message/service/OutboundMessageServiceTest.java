package com.digitalgroup.zapdesk.domain.message.service;

import com.digitalgroup.zapdesk.domain.common.enums.ConversationStatus;
import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;
import com.digitalgroup.zapdesk.domain.common.enums.MessageDirection;
import com.digitalgroup.zapdesk.domain.common.enums.MessageOrigin;
import com.digitalgroup.zapdesk.domain.common.enums.MessageStatus;
import com.digitalgroup.zapdesk.domain.common.enums.SenderType;
import com.digitalgroup.zapdesk.domain.conversation.entity.Conversation;
import com.digitalgroup.zapdesk.domain.conversation.service.ConversationService;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.gateway.service.GatewayConfigService;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.lead.service.LeadService;
import com.digitalgroup.zapdesk.domain.message.entity.Message;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.digitalgroup.zapdesk.exception.ProviderFailureCause;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.ProviderSendResult;
import com.digitalgroup.zapdesk.multitenancy.TenantContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboundMessageServiceTest {

    @Mock
    private ConversationService conversationService;

    @Mock
    private GatewayConfigService gatewayConfigService;

    @Mock
    private LeadService leadService;

    @Mock
    private MessageLedgerService ledger;

    @Mock
    private OutboundDispatcher dispatcher;

    private OutboundMessageService outboundMessageService;
    private GatewayConfig config;
    private Lead lead;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        outboundMessageService = new OutboundMessageService(conversationService, gatewayConfigService, leadService,
                ledger, new TemplateVariableService("America/Sao_Paulo"), dispatcher);

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
                .name("Maria Silva")
                .phone("45999990000")
                .countryCode("55")
                .masked(false)
                .build();
        conversation = Conversation.builder()
                .id(50L)
                .tenantId(10L)
                .lead(lead)
                .status(ConversationStatus.OPEN)
                .unreadCount(0)
                .build();

        when(conversationService.findById(50L)).thenReturn(conversation);
        when(gatewayConfigService.forConversation(conversation)).thenReturn(config);
    }

    @Test
    void send_RendersTemplateAndRecordsMessage() {
        when(dispatcher.send(eq(config), eq("5545999990000"), eq("Olá Maria"), eq(MessageContentType.TEXT),
                isNull(), isNull(), isNull()))
                .thenReturn(new ProviderSendResult("true_5545999990000@c.us_3EB0", "5545999990000@c.us"));
        when(ledger.record(any(Message.class))).thenAnswer(inv -> inv.getArgument(0));
        when(conversationService.assignIfUnassigned(conversation, 33L)).thenReturn(true);

        SendOutcome outcome = outboundMessageService.send(new SendMessageCommand(50L, "Olá {{primeiro_nome}}",
                MessageContentType.TEXT, null, null, 33L, "Ana"));

        assertTrue(outcome.isRecorded());
        assertEquals("true_5545999990000@c.us_3EB0", outcome.providerMessageId());
        assertEquals(GatewayProvider.WAHA, outcome.provider());

        ArgumentCaptor<Message> recorded = ArgumentCaptor.forClass(Message.class);
        verify(ledger).record(recorded.capture());
        Message message = recorded.getValue();
        assertEquals("Olá Maria", message.getContent());
        assertEquals(MessageDirection.OUTBOUND, message.getDirection());
        assertEquals(SenderType.AGENT, message.getSenderType());
        assertEquals(MessageStatus.SENT, message.getStatus());
        assertEquals(MessageOrigin.API, message.getOrigin());
        assertEquals(33L, message.getSenderId());

        verify(conversationService).registerOutbound(eq(conversation), any());
        verify(leadService).assignIfUnassigned(lead, 33L);
        verify(leadService).cacheDeliveryChatId(lead, "5545999990000@c.us");
        assertFalse(TenantContext.hasTenant());
    }

    @Test
    void send_ProviderRejectsMedia_RecordsNothing() {
        when(dispatcher.send(eq(config), anyString(), any(), eq(MessageContentType.AUDIO),
                eq("https://cdn.example.com/v.ogg"), isNull(), isNull()))
                .thenThrow(new ProviderException(GatewayProvider.WAHA,
                        ProviderFailureCause.UNSUPPORTED_MEDIA_FOR_PLAN, "Plus version required", 422));

        ProviderException e = assertThrows(ProviderException.class, () -> outboundMessageService.send(
                new SendMessageCommand(50L, null, MessageContentType.AUDIO, "https://cdn.example.com/v.ogg",
                        null, 33L, null)));

        assertEquals(ProviderFailureCause.UNSUPPORTED_MEDIA_FOR_PLAN, e.getFailureCause());
        verify(ledger, never()).record(any());
        verify(conversationService, never()).assignIfUnassigned(any(), any());
        assertFalse(TenantContext.hasTenant());
    }

    @Test
    void send_LedgerFailureAfterSend_StillReportsSuccess() {
        when(dispatcher.send(eq(config), anyString(), eq("Oi"), eq(MessageContentType.TEXT),
                isNull(), isNull(), isNull()))
                .thenReturn(new ProviderSendResult("wamid.9", "5545999990000@c.us"));
        when(ledger.record(any(Message.class))).thenThrow(new DataIntegrityViolationException("boom"));

        SendOutcome outcome = outboundMessageService.send(new SendMessageCommand(50L, "Oi",
                MessageContentType.TEXT, null, null, null, null));

        assertEquals("wamid.9", outcome.providerMessageId());
        assertFalse(outcome.isRecorded());
    }

    @Test
    void send_MaskedLead_UsesMaskedChatId() {
        lead.setMasked(true);
        lead.setPhone("LID_123456789012345");
        lead.setOriginalLid("123456789012345@lid");
        when(dispatcher.send(eq(config), isNull(), eq("Oi"), eq(MessageContentType.TEXT),
                isNull(), eq("123456789012345@lid"), isNull()))
                .thenReturn(new ProviderSendResult("wamid.10", "123456789012345@lid"));
        when(ledger.record(any(Message.class))).thenAnswer(inv -> inv.getArgument(0));

        outboundMessageService.send(new SendMessageCommand(50L, "Oi", MessageContentType.TEXT, null, null, null, null));

        verify(leadService, never()).cacheDeliveryChatId(any(), any());
    }
}
