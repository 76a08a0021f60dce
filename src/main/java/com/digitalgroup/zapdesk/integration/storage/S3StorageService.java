package com.digitalgroup.zapdesk.integration.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.time.Duration;

/**
 * S3 Storage Service
 * Stores message attachments and signs their download URLs. Works with any S3-compatible endpoint.
 */
@Slf4j
@Service
public class S3StorageService implements MediaStorageService {

    @Value("${zapdesk.storage.access-key-id:}")
    private String accessKeyId;

    @Value("${zapdesk.storage.secret-access-key:}")
    private String secretAccessKey;

    @Value("${zapdesk.storage.region:us-east-1}")
    private String region;

    @Value("${zapdesk.storage.endpoint:}")
    private String endpoint;

    @Value("${zapdesk.storage.enabled:false}")
    private boolean enabled;

    private S3Client s3Client;
    private S3Presigner presigner;

    @PostConstruct
    public void initialize() {
        if (!enabled || accessKeyId.isEmpty() || secretAccessKey.isEmpty()) {
            log.info("S3 Storage is disabled or not configured");
            return;
        }

        try {
            AwsBasicCredentials credentials = AwsBasicCredentials.create(accessKeyId, secretAccessKey);

            S3ClientBuilder clientBuilder = S3Client.builder()
                    .region(Region.of(region))
                    .credentialsProvider(StaticCredentialsProvider.create(credentials));
            S3Presigner.Builder builder = S3Presigner.builder()
                    .region(Region.of(region))
                    .credentialsProvider(StaticCredentialsProvider.create(credentials));
            if (!endpoint.isEmpty()) {
                S3Configuration pathStyle = S3Configuration.builder().pathStyleAccessEnabled(true).build();
                clientBuilder.endpointOverride(URI.create(endpoint)).serviceConfiguration(pathStyle);
                builder.endpointOverride(URI.create(endpoint)).serviceConfiguration(pathStyle);
            }
            s3Client = clientBuilder.build();
            presigner = builder.build();

            log.info("S3 Storage initialized (region {})", region);

        } catch (Exception e) {
            log.error("Failed to initialize S3 storage", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (presigner != null) {
            presigner.close();
        }
        if (s3Client != null) {
            s3Client.close();
        }
    }

    @Override
    public void upload(String bucket, String key, byte[] data, String contentType) {
        if (!isEnabled()) {
            throw new IllegalStateException("S3 Storage is not enabled");
        }

        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .cacheControl("max-age=31536000")
                .build();

        s3Client.putObject(request, RequestBody.fromBytes(data));
        log.info("Uploaded {} bytes to {}/{}", data.length, bucket, key);
    }

    @Override
    public String getSignedUrl(String bucket, String key, Duration ttl) {
        if (!isEnabled()) {
            throw new IllegalStateException("S3 Storage is not enabled");
        }

        GetObjectRequest getObjectRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(ttl)
                .getObjectRequest(getObjectRequest)
                .build();

        PresignedGetObjectRequest presignedRequest = presigner.presignGetObject(presignRequest);
        log.debug("Signed {}/{} for {}", bucket, key, ttl);
        return presignedRequest.url().toString();
    }

    @Override
    public boolean isEnabled() {
        return enabled && presigner != null && s3Client != null;
    }
}
