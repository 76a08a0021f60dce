package com.digitalgroup.zapdesk.api.v1;

import com.digitalgroup.zapdesk.api.v1.dto.SendMessageRequest;
import com.digitalgroup.zapdesk.api.v1.dto.SendMessageResponse;
import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;
import com.digitalgroup.zapdesk.domain.message.service.OutboundMessageService;
import com.digitalgroup.zapdesk.domain.message.service.SendMessageCommand;
import com.digitalgroup.zapdesk.domain.message.service.SendOutcome;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.digitalgroup.zapdesk.exception.StorageResolutionException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Outbound send API used by the agent inbox
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/messages")
@RequiredArgsConstructor
public class MessageSendController {

    private final OutboundMessageService outboundMessageService;

    /**
     * Gateway and storage failures answer 200 with success=false so the caller
     * can tell them apart from transport errors.
     */
    @PostMapping("/send")
    public ResponseEntity<SendMessageResponse> send(@Valid @RequestBody SendMessageRequest request) {
        log.info("[MessageSend] Conversation {} type {} agent {}",
                request.getConversationId(), request.getType(), request.getAgentId());

        SendMessageCommand command = new SendMessageCommand(
                request.getConversationId(),
                request.getContent(),
                MessageContentType.fromCode(request.getType()),
                request.getMediaUrl(),
                request.getReplyToExternalId(),
                request.getAgentId(),
                request.getAgentName());

        try {
            SendOutcome outcome = outboundMessageService.send(command);
            return ResponseEntity.ok(SendMessageResponse.sent(outcome));
        } catch (ProviderException e) {
            log.error("[MessageSend] {} rejected message for conversation {}: {} ({})",
                    e.getProvider(), request.getConversationId(), e.getMessage(), e.getFailureCause());
            return ResponseEntity.ok(SendMessageResponse.failed(e));
        } catch (StorageResolutionException e) {
            log.error("[MessageSend] Media for conversation {} could not be resolved: {}",
                    request.getConversationId(), e.getMessage());
            return ResponseEntity.ok(SendMessageResponse.failed(e));
        }
    }
}
