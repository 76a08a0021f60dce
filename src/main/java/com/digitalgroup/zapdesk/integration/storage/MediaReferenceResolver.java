package com.digitalgroup.zapdesk.integration.storage;

import com.digitalgroup.zapdesk.exception.StorageResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Turns a stored media reference into a URL a gateway can fetch.
 * References look like {@code storage://<bucket>/<key>}; plain http(s) URLs pass through.
 */
@Slf4j
@Service
public class MediaReferenceResolver {

    public static final String STORAGE_SCHEME = "storage://";

    private final MediaStorageService storageService;
    private final Duration signedUrlTtl;

    public MediaReferenceResolver(MediaStorageService storageService,
                                  @Value("${zapdesk.storage.signed-url-ttl-seconds:3600}") long ttlSeconds) {
        this.storageService = storageService;
        this.signedUrlTtl = Duration.ofSeconds(ttlSeconds);
    }

    /**
     * @return a fetchable URL, or null when there is no reference
     * @throws StorageResolutionException when the reference cannot be signed
     */
    public String resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        String ref = reference.trim();
        if (ref.startsWith("https://") || ref.startsWith("http://")) {
            return ref;
        }
        if (!ref.startsWith(STORAGE_SCHEME)) {
            throw new StorageResolutionException(ref, "unsupported scheme");
        }

        String path = ref.substring(STORAGE_SCHEME.length());
        int slash = path.indexOf('/');
        if (slash <= 0 || slash == path.length() - 1) {
            throw new StorageResolutionException(ref, "expected storage://<bucket>/<key>");
        }
        if (!storageService.isEnabled()) {
            throw new StorageResolutionException(ref, "storage is not configured");
        }

        String bucket = path.substring(0, slash);
        String key = path.substring(slash + 1);
        try {
            return storageService.getSignedUrl(bucket, key, signedUrlTtl);
        } catch (RuntimeException e) {
            log.error("Failed to sign media reference {}: {}", ref, e.getMessage());
            throw new StorageResolutionException(ref, e);
        }
    }

    public static boolean isStorageReference(String reference) {
        return reference != null && reference.startsWith(STORAGE_SCHEME);
    }
}
