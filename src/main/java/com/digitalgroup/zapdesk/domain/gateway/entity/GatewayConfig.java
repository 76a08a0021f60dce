package com.digitalgroup.zapdesk.domain.gateway.entity;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.util.ChatIdUtils;
import com.digitalgroup.zapdesk.util.PhoneUtils;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Connection settings of one WhatsApp number on one gateway vendor.
 */
@Entity
@Table(name = "gateway_configs", indexes = {
    @Index(name = "index_gateway_configs_on_instance_name", columnList = "instance_name"),
    @Index(name = "index_gateway_configs_on_tenant_id_and_active", columnList = "tenant_id, active")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GatewayConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull(message = "Tenant is required")
    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "name")
    private String name;

    @NotNull(message = "Provider is required")
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GatewayProvider provider;

    @NotBlank(message = "Base URL is required")
    @Column(name = "base_url", nullable = false)
    private String baseUrl;

    @Column(name = "api_key", length = 512)
    private String apiKey;

    /** WAHA session, Evolution instance, Z-API instance path or Meta phone-number-id */
    @Column(name = "instance_name")
    private String instanceName;

    // Number paired with the gateway, used to detect our own echoes
    @Column(name = "phone_number", length = 20)
    private String phoneNumber;

    @Column(name = "webhook_secret", length = 512)
    private String webhookSecret;

    @Column(name = "active")
    @Builder.Default
    private Boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    public boolean hasWebhookSecret() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }

    /**
     * True when the chat id is this gateway's own paired number.
     */
    public boolean isOwnNumber(String chatId) {
        if (phoneNumber == null || chatId == null || ChatIdUtils.isMasked(chatId)) {
            return false;
        }
        return PhoneUtils.isSameLine(phoneNumber, chatId);
    }

    public String getNormalizedBaseUrl() {
        if (baseUrl == null) {
            return "";
        }
        String url = baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
