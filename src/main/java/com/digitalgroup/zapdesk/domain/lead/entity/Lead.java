package com.digitalgroup.zapdesk.domain.lead.entity;

import com.digitalgroup.zapdesk.util.ChatIdUtils;
import com.digitalgroup.zapdesk.util.PhoneUtils;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "leads",
    uniqueConstraints = {
        @UniqueConstraint(name = "index_leads_on_tenant_id_and_phone", columnNames = {"tenant_id", "phone"})
    },
    indexes = {
        @Index(name = "index_leads_on_tenant_id_and_original_lid", columnList = "tenant_id, original_lid"),
        @Index(name = "index_leads_on_last_interaction_at", columnList = "last_interaction_at")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Lead {

    public static final String PLACEHOLDER_PREFIX = "Lead ";
    private static final String AD_ORIGIN_MARKER = "via anúncio";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull(message = "Tenant is required")
    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @NotBlank(message = "Name is required")
    @Column(nullable = false)
    private String name;

    // Name the contact set on WhatsApp, as reported by the gateway
    @Column(name = "whatsapp_name")
    private String whatsappName;

    /** National number, or LID_<digits> while the contact is only known by a masked id */
    @NotBlank(message = "Phone is required")
    @Column(nullable = false, length = 40)
    private String phone;

    @Column(name = "country_code", length = 4)
    @Builder.Default
    private String countryCode = PhoneUtils.BRAZIL;

    @Column(name = "is_masked")
    @Builder.Default
    private Boolean masked = false;

    @Column(name = "original_lid", length = 40)
    private String originalLid;

    @Column(name = "avatar_url", length = 1024)
    private String avatarUrl;

    @Column(name = "whatsapp_chat_id", length = 80)
    private String whatsappChatId;

    @Column(name = "last_interaction_at")
    private LocalDateTime lastInteractionAt;

    @Column(name = "assigned_to")
    private Long assignedTo;

    @Column(name = "email")
    private String email;

    @Column(name = "document_number", length = 20)
    private String documentNumber;

    @Column(name = "estimated_value", precision = 12, scale = 2)
    private BigDecimal estimatedValue;

    @Column(name = "benefit_type")
    private String benefitType;

    @Column(name = "source")
    private String source;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isMasked() {
        return Boolean.TRUE.equals(masked);
    }

    /**
     * Placeholder names are the ones we generate ourselves or the ad-click default.
     */
    public boolean hasPlaceholderName() {
        return name == null || name.isBlank()
                || name.startsWith(PLACEHOLDER_PREFIX)
                || name.contains(AD_ORIGIN_MARKER);
    }

    public String getFullPhone() {
        if (isMasked()) {
            return null;
        }
        return (countryCode != null ? countryCode : "") + phone;
    }

    public String getDisplayPhone() {
        return isMasked() ? phone : PhoneUtils.formatForDisplay(phone, countryCode);
    }

    /**
     * Chat id used when sending: the cached one, else the masked id, else phone@c.us.
     */
    public String getDeliveryChatId() {
        if (whatsappChatId != null && whatsappChatId.contains("@")) {
            return whatsappChatId;
        }
        if (isMasked() && originalLid != null) {
            return ChatIdUtils.maskedDigits(originalLid) + ChatIdUtils.MASKED_SUFFIX;
        }
        return ChatIdUtils.buildChatId(getFullPhone());
    }

    public void touchInteraction() {
        this.lastInteractionAt = LocalDateTime.now();
    }
}
