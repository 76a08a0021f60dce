package com.digitalgroup.zapdesk.integration.whatsapp;

/**
 * A file fetched from a gateway, with the content type it was served with.
 */
public record DownloadedMedia(byte[] data, String contentType) {
}
