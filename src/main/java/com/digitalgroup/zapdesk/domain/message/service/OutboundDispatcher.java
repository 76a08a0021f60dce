package com.digitalgroup.zapdesk.domain.message.service;

import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.exception.BusinessException;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.digitalgroup.zapdesk.exception.ProviderFailureCause;
import com.digitalgroup.zapdesk.integration.storage.MediaReferenceResolver;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.OutboundMessage;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.ProviderSendResult;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.WhatsAppContactClient;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.WhatsAppProviderClient;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.WhatsAppProviderRegistry;
import com.digitalgroup.zapdesk.util.ChatIdUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Delivers one message through the gateway's adapter. Media references are
 * resolved before anything goes out; provider failures propagate as
 * {@link ProviderException}. Nothing is retried here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboundDispatcher {

    private final WhatsAppProviderRegistry providerRegistry;
    private final MediaReferenceResolver mediaResolver;

    /**
     * @param fullPhone    recipient digits with country code, null for masked contacts
     * @param cachedChatId chat id known to work for this contact, skips the existence check
     * @param mediaRef     storage reference or URL, required for media types
     */
    public ProviderSendResult send(GatewayConfig config, String fullPhone, String content, MessageContentType type,
                                   String mediaRef, String cachedChatId, String replyToId) {
        MessageContentType messageType = type != null ? type : MessageContentType.TEXT;
        String mediaUrl = mediaResolver.resolve(mediaRef);
        if (messageType.isMedia() && mediaUrl == null) {
            throw new BusinessException("A " + messageType.getCode() + " message needs a media_url", "MEDIA_REQUIRED");
        }
        if (!messageType.isMedia() && (content == null || content.isBlank())) {
            throw new BusinessException("Text messages need content", "CONTENT_REQUIRED");
        }

        String chatId = resolveChatId(config, fullPhone, cachedChatId);
        WhatsAppProviderClient client = providerRegistry.get(config.getProvider());
        OutboundMessage message = new OutboundMessage(chatId, fullPhone, content, messageType, mediaUrl,
                fileName(mediaRef), replyToId);

        ProviderSendResult result = client.send(config, message);
        log.info("Sent {} via {} to {} (provider id {})", messageType.getCode(), config.getProvider(),
                chatId, result.providerMessageId());
        return new ProviderSendResult(result.providerMessageId(),
                result.resolvedChatId() != null ? result.resolvedChatId() : chatId);
    }

    private String resolveChatId(GatewayConfig config, String fullPhone, String cachedChatId) {
        if (cachedChatId != null && !cachedChatId.isBlank()) {
            return cachedChatId;
        }
        if (fullPhone == null || fullPhone.isBlank()) {
            throw new ProviderException(config.getProvider(), ProviderFailureCause.IDENTITY_RESOLUTION_FAILURE,
                    "Recipient has neither a phone nor a known chat id", 0);
        }

        Optional<WhatsAppContactClient> contactClient = providerRegistry.contactClient(config.getProvider());
        if (contactClient.isEmpty()) {
            return ChatIdUtils.buildChatId(fullPhone);
        }
        return contactClient.get().findChatId(config, fullPhone)
                .orElseThrow(() -> new ProviderException(config.getProvider(),
                        ProviderFailureCause.IDENTITY_RESOLUTION_FAILURE,
                        "Number " + fullPhone + " is not registered on WhatsApp", 404));
    }

    static String fileName(String mediaRef) {
        if (mediaRef == null || mediaRef.isBlank()) {
            return null;
        }
        String path = mediaRef;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        return name.isBlank() ? null : name;
    }
}
