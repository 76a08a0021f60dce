package com.digitalgroup.zapdesk.integration.storage;

import java.time.Duration;

/**
 * Object storage holding message attachments.
 */
public interface MediaStorageService {

    /**
     * Short-lived URL a gateway can download the object from.
     * @param bucket bucket (container) name
     * @param key    object key inside the bucket
     * @param ttl    how long the URL stays valid
     */
    String getSignedUrl(String bucket, String key, Duration ttl);

    /**
     * Stores an object, replacing any object under the same key.
     * @throws RuntimeException when the storage backend rejects the write
     */
    void upload(String bucket, String key, byte[] data, String contentType);

    /**
     * Check if storage service is enabled
     * @return true if the service is properly configured and available
     */
    boolean isEnabled();
}
