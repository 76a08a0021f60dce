package com.digitalgroup.zapdesk.exception;

import lombok.Getter;

/**
 * A stored media reference could not be turned into a fetchable URL.
 */
@Getter
public class StorageResolutionException extends BusinessException {

    private final String reference;

    public StorageResolutionException(String reference, String reason) {
        super("Cannot resolve media reference " + reference + ": " + reason, "STORAGE_RESOLUTION");
        this.reference = reference;
    }

    public StorageResolutionException(String reference, Throwable cause) {
        super("Cannot resolve media reference " + reference + ": " + cause.getMessage(),
                "STORAGE_RESOLUTION", cause);
        this.reference = reference;
    }
}
