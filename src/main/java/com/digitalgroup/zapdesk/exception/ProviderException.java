package com.digitalgroup.zapdesk.exception;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import lombok.Getter;

import java.util.Locale;

/**
 * A gateway answered a send or lookup with a non-success response.
 * Reported to the caller as a business failure, never retried here.
 */
@Getter
public class ProviderException extends BusinessException {

    private final GatewayProvider provider;
    private final ProviderFailureCause failureCause;
    private final int httpStatus;

    public ProviderException(GatewayProvider provider, ProviderFailureCause failureCause,
                             String message, int httpStatus) {
        super(message, "PROVIDER_" + failureCause.name());
        this.provider = provider;
        this.failureCause = failureCause;
        this.httpStatus = httpStatus;
    }

    public ProviderException(GatewayProvider provider, String message, Throwable cause) {
        super(message, "PROVIDER_" + ProviderFailureCause.GENERIC.name(), cause);
        this.provider = provider;
        this.failureCause = ProviderFailureCause.GENERIC;
        this.httpStatus = 0;
    }

    /**
     * Builds the exception from a raw error response, picking the cause from the body text.
     */
    public static ProviderException fromResponse(GatewayProvider provider, int httpStatus, String body) {
        String text = body != null ? body : "";
        String lower = text.toLowerCase(Locale.ROOT);

        ProviderFailureCause cause;
        String message;
        if (text.contains("Plus version") || text.contains("GOWS")) {
            cause = ProviderFailureCause.UNSUPPORTED_MEDIA_FOR_PLAN;
            message = "This media type is not available on the gateway's current plan";
        } else if (lower.contains("session") && (lower.contains("not found") || lower.contains("does not exist"))) {
            cause = ProviderFailureCause.SESSION_NOT_FOUND;
            message = "Gateway session not found or not started";
        } else if (text.contains("No LID for user") || lower.contains("not exists")
                || lower.contains("not on whatsapp")) {
            cause = ProviderFailureCause.IDENTITY_RESOLUTION_FAILURE;
            message = "Recipient could not be resolved on WhatsApp";
        } else if (httpStatus == 401 || httpStatus == 403) {
            cause = ProviderFailureCause.UNAUTHORIZED;
            message = "Gateway rejected the credentials";
        } else {
            cause = ProviderFailureCause.GENERIC;
            message = "Gateway error " + httpStatus + ": " + abbreviate(text);
        }
        return new ProviderException(provider, cause, message, httpStatus);
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) : text;
    }
}
