package com.digitalgroup.zapdesk.exception;

import lombok.Getter;

/**
 * A masked identifier could not be mapped to a contact.
 */
@Getter
public class UnresolvedIdentityException extends BusinessException {

    private final String maskedId;

    public UnresolvedIdentityException(String maskedId) {
        super("Masked identifier could not be resolved: " + maskedId, "UNRESOLVED_IDENTITY");
        this.maskedId = maskedId;
    }
}
