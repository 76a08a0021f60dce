package com.digitalgroup.zapdesk.domain.conversation.entity;

import com.digitalgroup.zapdesk.domain.common.enums.ConversationStatus;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "conversations", indexes = {
    @Index(name = "index_conversations_on_lead_id_and_status", columnList = "lead_id, status"),
    @Index(name = "index_conversations_on_tenant_id_and_last_message_at", columnList = "tenant_id, last_message_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Conversation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull(message = "Tenant is required")
    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @NotNull(message = "Lead is required")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lead_id", nullable = false)
    private Lead lead;

    @Column(name = "gateway_config_id")
    private Long gatewayConfigId;

    @Enumerated(EnumType.ORDINAL)
    @Column(columnDefinition = "integer default 0")
    @Builder.Default
    private ConversationStatus status = ConversationStatus.OPEN;

    @Column(name = "assigned_to")
    private Long assignedTo;

    @Column(name = "last_message_at")
    private LocalDateTime lastMessageAt;

    @Column(name = "unread_count", nullable = false)
    @Builder.Default
    private Integer unreadCount = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isActive() {
        return status != null && status.isActive();
    }

    public boolean isUnassigned() {
        return assignedTo == null;
    }

    public void registerInbound(LocalDateTime at) {
        this.unreadCount = (unreadCount != null ? unreadCount : 0) + 1;
        this.lastMessageAt = at;
    }

    public void registerOutbound(LocalDateTime at) {
        this.lastMessageAt = at;
    }

    public void reopen() {
        this.status = ConversationStatus.OPEN;
    }
}
