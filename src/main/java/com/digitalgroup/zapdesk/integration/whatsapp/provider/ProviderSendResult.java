package com.digitalgroup.zapdesk.integration.whatsapp.provider;

/**
 * @param providerMessageId canonical id the gateway assigned, null when it returned none
 * @param resolvedChatId    chat id the gateway accepted, cached on the lead
 */
public record ProviderSendResult(String providerMessageId, String resolvedChatId) {
}
