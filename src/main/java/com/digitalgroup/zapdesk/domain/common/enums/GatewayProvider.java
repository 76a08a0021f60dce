package com.digitalgroup.zapdesk.domain.common.enums;

/**
 * WhatsApp gateway vendors a tenant can plug in.
 */
public enum GatewayProvider {
    WAHA,           // WhatsApp HTTP API (self-hosted)
    EVOLUTION,      // Evolution API
    ZAPI,           // Z-API
    META_CLOUD,     // WhatsApp Cloud API (Graph)
    CUSTOM          // Generic bearer-token endpoint
}
