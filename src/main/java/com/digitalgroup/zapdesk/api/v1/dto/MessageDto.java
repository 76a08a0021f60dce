package com.digitalgroup.zapdesk.api.v1.dto;

import com.digitalgroup.zapdesk.domain.message.entity.Message;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageDto {

    private Long id;
    private Long conversationId;
    private Long leadId;
    private Long senderId;
    private String senderType;
    private String direction;
    private String content;
    private String type;
    private String status;
    private String origin;
    private String mediaUrl;
    private String externalId;
    private String shortId;
    private String quotedExternalId;
    private LocalDateTime sentAt;
    private LocalDateTime createdAt;

    public static MessageDto fromEntity(Message message) {
        return MessageDto.builder()
                .id(message.getId())
                .conversationId(message.getConversation() != null ? message.getConversation().getId() : null)
                .leadId(message.getLead() != null ? message.getLead().getId() : null)
                .senderId(message.getSenderId())
                .senderType(lower(message.getSenderType()))
                .direction(lower(message.getDirection()))
                .content(message.getContent())
                .type(message.getType() != null ? message.getType().getCode() : null)
                .status(lower(message.getStatus()))
                .origin(lower(message.getOrigin()))
                .mediaUrl(message.getMediaUrl())
                .externalId(message.getExternalId())
                .shortId(message.getShortId())
                .quotedExternalId(message.getQuotedExternalId())
                .sentAt(message.getSentAt())
                .createdAt(message.getCreatedAt())
                .build();
    }

    private static String lower(Enum<?> value) {
        return value != null ? value.name().toLowerCase(Locale.ROOT) : null;
    }
}
