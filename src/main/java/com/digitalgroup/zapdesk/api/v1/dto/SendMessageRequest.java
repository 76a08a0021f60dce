package com.digitalgroup.zapdesk.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the agent send API
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SendMessageRequest {

    @NotNull(message = "conversation_id is required")
    @JsonProperty("conversation_id")
    private Long conversationId;

    private String content;

    /**
     * text, image, audio, video or document. Defaults to text.
     */
    private String type;

    /**
     * storage://key reference or an absolute URL
     */
    @JsonProperty("media_url")
    private String mediaUrl;

    @JsonProperty("reply_to_external_id")
    private String replyToExternalId;

    @JsonProperty("agent_id")
    private Long agentId;

    @JsonProperty("agent_name")
    private String agentName;
}
