package com.digitalgroup.zapdesk.integration.whatsapp.provider;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the adapter for a gateway config's provider.
 */
@Slf4j
@Component
public class WhatsAppProviderRegistry {

    private final Map<GatewayProvider, WhatsAppProviderClient> senders = new EnumMap<>(GatewayProvider.class);
    private final Map<GatewayProvider, WhatsAppContactClient> contacts = new EnumMap<>(GatewayProvider.class);

    public WhatsAppProviderRegistry(List<WhatsAppProviderClient> senderClients,
                                    List<WhatsAppContactClient> contactClients) {
        senderClients.forEach(client -> senders.put(client.provider(), client));
        contactClients.forEach(client -> contacts.put(client.provider(), client));
        log.info("Registered WhatsApp providers: {} (contact lookup: {})", senders.keySet(), contacts.keySet());
    }

    public WhatsAppProviderClient get(GatewayProvider provider) {
        WhatsAppProviderClient client = senders.get(provider);
        if (client == null) {
            throw new BusinessException("No adapter registered for provider " + provider, "PROVIDER_NOT_SUPPORTED");
        }
        return client;
    }

    public Optional<WhatsAppContactClient> contactClient(GatewayProvider provider) {
        return Optional.ofNullable(contacts.get(provider));
    }
}
