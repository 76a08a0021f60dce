package com.digitalgroup.zapdesk.exception;

public class WebhookVerificationException extends BusinessException {

    public WebhookVerificationException(String message) {
        super(message, "WEBHOOK_VERIFICATION_FAILED");
    }
}
