package com.digitalgroup.zapdesk.api.v1.dto;

import com.digitalgroup.zapdesk.domain.message.service.SendOutcome;
import com.digitalgroup.zapdesk.exception.BusinessException;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Send API result. Provider and storage failures are reported here with
 * success=false rather than as an HTTP error.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SendMessageResponse {

    private Boolean success;
    private String messageId;
    private MessageDto message;
    private String provider;
    private String error;
    private String errorCode;
    private String cause;

    public static SendMessageResponse sent(SendOutcome outcome) {
        return SendMessageResponse.builder()
                .success(true)
                .messageId(outcome.providerMessageId())
                .message(outcome.isRecorded() ? MessageDto.fromEntity(outcome.message()) : null)
                .provider(outcome.provider().name().toLowerCase(Locale.ROOT))
                .build();
    }

    public static SendMessageResponse failed(BusinessException e) {
        SendMessageResponseBuilder builder = SendMessageResponse.builder()
                .success(false)
                .error(e.getMessage())
                .errorCode(e.getErrorCode());
        if (e instanceof ProviderException providerError) {
            builder.cause(providerError.getFailureCause().name().toLowerCase(Locale.ROOT));
            if (providerError.getProvider() != null) {
                builder.provider(providerError.getProvider().name().toLowerCase(Locale.ROOT));
            }
        }
        return builder.build();
    }
}
