package com.digitalgroup.zapdesk.exception;

public enum ProviderFailureCause {
    UNSUPPORTED_MEDIA_FOR_PLAN,
    SESSION_NOT_FOUND,
    IDENTITY_RESOLUTION_FAILURE,
    UNAUTHORIZED,
    GENERIC
}
