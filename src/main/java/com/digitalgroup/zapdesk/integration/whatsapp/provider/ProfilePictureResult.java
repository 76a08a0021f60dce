package com.digitalgroup.zapdesk.integration.whatsapp.provider;

/**
 * Profile picture lookup outcome. When {@code url} is null, {@code reason} says why
 * and {@code retryable} whether asking again later may help.
 */
public record ProfilePictureResult(String url, String reason, boolean retryable) {

    public static ProfilePictureResult found(String url) {
        return new ProfilePictureResult(url, null, false);
    }

    public static ProfilePictureResult retryLater(String reason) {
        return new ProfilePictureResult(null, reason, true);
    }

    public static ProfilePictureResult unavailable(String reason) {
        return new ProfilePictureResult(null, reason, false);
    }

    public boolean isFound() {
        return url != null;
    }
}
