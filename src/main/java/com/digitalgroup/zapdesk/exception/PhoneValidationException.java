package com.digitalgroup.zapdesk.exception;

import lombok.Getter;

/**
 * Raised when a phone number cannot be normalized. Never retried.
 */
@Getter
public class PhoneValidationException extends BusinessException {

    private final String rawPhone;

    public PhoneValidationException(String rawPhone, String reason) {
        super("Invalid phone number '" + rawPhone + "': " + reason, "INVALID_PHONE");
        this.rawPhone = rawPhone;
    }
}
