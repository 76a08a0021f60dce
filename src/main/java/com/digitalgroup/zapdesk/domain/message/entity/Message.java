package com.digitalgroup.zapdesk.domain.message.entity;

import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;
import com.digitalgroup.zapdesk.domain.common.enums.MessageDirection;
import com.digitalgroup.zapdesk.domain.common.enums.MessageOrigin;
import com.digitalgroup.zapdesk.domain.common.enums.MessageStatus;
import com.digitalgroup.zapdesk.domain.common.enums.SenderType;
import com.digitalgroup.zapdesk.domain.conversation.entity.Conversation;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "messages",
    indexes = {
        @Index(name = "index_messages_on_tenant_id_and_external_id", columnList = "tenant_id, external_id"),
        @Index(name = "index_messages_on_conversation_id_and_created_at", columnList = "conversation_id, created_at"),
        @Index(name = "index_messages_on_tenant_id_and_short_id", columnList = "tenant_id, short_id"),
        @Index(name = "index_messages_on_lead_id", columnList = "lead_id")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Message {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull(message = "Tenant is required")
    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @NotNull(message = "Conversation is required")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "conversation_id", nullable = false)
    private Conversation conversation;

    @NotNull(message = "Lead is required")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lead_id", nullable = false)
    private Lead lead;

    @Enumerated(EnumType.ORDINAL)
    @Column(name = "sender_type", columnDefinition = "integer default 0")
    @Builder.Default
    private SenderType senderType = SenderType.LEAD;

    // Agent who sent it, when sent through the API
    @Column(name = "sender_id")
    private Long senderId;

    @NotNull(message = "Direction is required")
    @Enumerated(EnumType.ORDINAL)
    @Column(columnDefinition = "integer default 0")
    @Builder.Default
    private MessageDirection direction = MessageDirection.INBOUND;

    @Column(nullable = false, columnDefinition = "text")
    @Builder.Default
    private String content = "";

    @Column(name = "media_url", length = 2048)
    private String mediaUrl;

    @Enumerated(EnumType.ORDINAL)
    @Column(columnDefinition = "integer default 0")
    @Builder.Default
    private MessageContentType type = MessageContentType.TEXT;

    @Enumerated(EnumType.ORDINAL)
    @Column(columnDefinition = "integer default 0")
    @Builder.Default
    private MessageStatus status = MessageStatus.SENT;

    @Column(name = "external_id", length = 255)
    private String externalId;

    @Column(name = "short_id", length = 128)
    private String shortId;

    @Enumerated(EnumType.ORDINAL)
    @Column(columnDefinition = "integer default 0")
    @Builder.Default
    private MessageOrigin origin = MessageOrigin.SYSTEM;

    @Column(name = "quoted_external_id", length = 255)
    private String quotedExternalId;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isInbound() {
        return direction == MessageDirection.INBOUND;
    }

    public boolean isOutbound() {
        return direction == MessageDirection.OUTBOUND;
    }

    public boolean hasMedia() {
        return mediaUrl != null && !mediaUrl.isEmpty();
    }

    /**
     * Advances the delivery status. Returns false when the message is already at or past it.
     */
    public boolean advanceStatus(MessageStatus newStatus) {
        if (newStatus == null || !newStatus.isAfter(status)) {
            return false;
        }
        this.status = newStatus;
        return true;
    }
}
