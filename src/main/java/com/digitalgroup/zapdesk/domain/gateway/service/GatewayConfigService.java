package com.digitalgroup.zapdesk.domain.gateway.service;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.conversation.entity.Conversation;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.gateway.repository.GatewayConfigRepository;
import com.digitalgroup.zapdesk.exception.BusinessException;
import com.digitalgroup.zapdesk.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Looks up the gateway connection an event arrived on or a send should leave through.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayConfigService {

    private final GatewayConfigRepository gatewayConfigRepository;

    @Transactional(readOnly = true)
    public GatewayConfig findById(Long id) {
        return gatewayConfigRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("GatewayConfig", id));
    }

    /**
     * Session name (WAHA), instance name (Evolution) and phone-number-id (Meta) all live in
     * instanceName. A provider-specific match wins over a bare name match.
     */
    @Transactional(readOnly = true)
    public Optional<GatewayConfig> findForWebhook(GatewayProvider provider, String instanceKey) {
        if (instanceKey == null || instanceKey.isBlank()) {
            return Optional.empty();
        }
        if (provider != null) {
            Optional<GatewayConfig> exact =
                    gatewayConfigRepository.findFirstByProviderAndInstanceNameAndActiveTrue(provider, instanceKey);
            if (exact.isPresent()) {
                return exact;
            }
        }
        return gatewayConfigRepository.findFirstByInstanceNameAndActiveTrue(instanceKey);
    }

    /**
     * The conversation's own gateway if it has one, else the tenant's first active gateway.
     */
    @Transactional(readOnly = true)
    public GatewayConfig forConversation(Conversation conversation) {
        if (conversation.getGatewayConfigId() != null) {
            GatewayConfig config = gatewayConfigRepository.findById(conversation.getGatewayConfigId()).orElse(null);
            if (config != null && config.isActive()) {
                return config;
            }
            log.warn("Gateway {} of conversation {} is missing or inactive, falling back to tenant default",
                    conversation.getGatewayConfigId(), conversation.getId());
        }
        return gatewayConfigRepository.findFirstByTenantIdAndActiveTrueOrderByIdAsc(conversation.getTenantId())
                .orElseThrow(() -> new BusinessException(
                        "No active gateway configured for tenant " + conversation.getTenantId(), "NO_GATEWAY"));
    }
}
