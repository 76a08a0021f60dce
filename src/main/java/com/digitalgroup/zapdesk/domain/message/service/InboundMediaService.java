package com.digitalgroup.zapdesk.domain.message.service;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.digitalgroup.zapdesk.integration.storage.MediaReferenceResolver;
import com.digitalgroup.zapdesk.integration.storage.MediaStorageService;
import com.digitalgroup.zapdesk.integration.whatsapp.DownloadedMedia;
import com.digitalgroup.zapdesk.integration.whatsapp.GatewayHttpClient;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.InboundMessageEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Copies media of incoming messages into our own storage.
 * Gateway media URLs expire and need the gateway key, so messages keep a
 * {@code storage://<bucket>/<key>} reference instead. When storage is off or the
 * copy fails the gateway URL is kept. Inline base64 media has no such fallback and is dropped.
 */
@Slf4j
@Service
public class InboundMediaService {

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("image/jpeg", "jpg"),
            Map.entry("image/png", "png"),
            Map.entry("image/webp", "webp"),
            Map.entry("image/gif", "gif"),
            Map.entry("audio/ogg", "ogg"),
            Map.entry("audio/mpeg", "mp3"),
            Map.entry("audio/mp4", "m4a"),
            Map.entry("audio/aac", "aac"),
            Map.entry("video/mp4", "mp4"),
            Map.entry("video/3gpp", "3gp"),
            Map.entry("application/pdf", "pdf"),
            Map.entry("application/msword", "doc"),
            Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", "docx"));

    private final MediaStorageService storageService;
    private final GatewayHttpClient httpClient;
    private final String bucket;
    private final Clock clock;

    @Autowired
    public InboundMediaService(MediaStorageService storageService,
                               GatewayHttpClient httpClient,
                               @Value("${zapdesk.storage.media-bucket:message-attachments}") String bucket) {
        this(storageService, httpClient, bucket, Clock.systemUTC());
    }

    InboundMediaService(MediaStorageService storageService, GatewayHttpClient httpClient,
                        String bucket, Clock clock) {
        this.storageService = storageService;
        this.httpClient = httpClient;
        this.bucket = bucket;
        this.clock = clock;
    }

    /**
     * Stores the media an event carries, by URL or inline base64.
     *
     * @return the reference to store on the message, null when there is nothing to keep
     */
    public String store(GatewayConfig config, Lead lead, InboundMessageEvent event) {
        MessageContentType type = event.contentType();
        if (event.mediaUrl() != null && !event.mediaUrl().isBlank()) {
            return store(config, lead, type, event.mediaUrl());
        }
        if (event.mediaData() != null && !event.mediaData().isBlank() && type != MessageContentType.TEXT) {
            return storeInline(lead, type, event.mediaData(), event.mimeType());
        }
        return null;
    }

    /**
     * @return the reference to store on the message, null when the event carries no media URL
     */
    public String store(GatewayConfig config, Lead lead, MessageContentType type, String mediaUrl) {
        if (mediaUrl == null || mediaUrl.isBlank() || type == MessageContentType.TEXT) {
            return null;
        }
        if (MediaReferenceResolver.isStorageReference(mediaUrl)) {
            return mediaUrl;
        }
        if (!storageService.isEnabled()) {
            log.warn("Storage is disabled, message media for lead {} keeps gateway URL", lead.getId());
            return mediaUrl;
        }

        try {
            String url = gatewayUrl(config, mediaUrl);
            DownloadedMedia media = httpClient.download(config.getProvider(), url, authHeaders(config, url));
            String key = "leads/" + lead.getId() + "/" + clock.millis() + "." + extension(media.contentType(), type);
            storageService.upload(bucket, key, media.data(), media.contentType());
            return MediaReferenceResolver.STORAGE_SCHEME + bucket + "/" + key;
        } catch (ProviderException e) {
            log.warn("Could not download media {} for lead {}: {}", mediaUrl, lead.getId(), e.getMessage());
            return mediaUrl;
        } catch (RuntimeException e) {
            log.error("Could not store media {} for lead {}: {}", mediaUrl, lead.getId(), e.getMessage());
            return mediaUrl;
        }
    }

    private String storeInline(Lead lead, MessageContentType type, String base64, String mimeType) {
        if (!storageService.isEnabled()) {
            log.warn("Storage is disabled, inline {} for lead {} is dropped", type.getCode(), lead.getId());
            return null;
        }
        String data = base64.trim();
        int comma = data.indexOf(',');
        if (data.startsWith("data:") && comma > 0) {
            data = data.substring(comma + 1);
        }
        String contentType = mimeType != null && !mimeType.isBlank() ? mimeType : "application/octet-stream";
        try {
            byte[] bytes = Base64.getDecoder().decode(data.replaceAll("\\s", ""));
            String key = "leads/" + lead.getId() + "/" + clock.millis() + "." + extension(contentType, type);
            storageService.upload(bucket, key, bytes, contentType);
            return MediaReferenceResolver.STORAGE_SCHEME + bucket + "/" + key;
        } catch (IllegalArgumentException e) {
            log.warn("Inline {} for lead {} is not valid base64: {}", type.getCode(), lead.getId(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("Could not store inline {} for lead {}: {}", type.getCode(), lead.getId(), e.getMessage());
            return null;
        }
    }

    /**
     * Adds a scheme to bare URLs and points localhost URLs, which self-hosted gateways
     * report, at the gateway's configured host.
     */
    static String gatewayUrl(GatewayConfig config, String mediaUrl) {
        String url = mediaUrl.trim();
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            url = "https://" + url;
        }
        String baseUrl = config.getNormalizedBaseUrl();
        if (baseUrl.isEmpty()) {
            return url;
        }
        URI uri = URI.create(url);
        if ("localhost".equals(uri.getHost()) || "127.0.0.1".equals(uri.getHost())) {
            URI base = URI.create(baseUrl);
            String query = uri.getRawQuery() != null ? "?" + uri.getRawQuery() : "";
            return base.getScheme() + "://" + base.getRawAuthority() + uri.getRawPath() + query;
        }
        return url;
    }

    private static Consumer<HttpHeaders> authHeaders(GatewayConfig config, String url) {
        String apiKey = config.getApiKey();
        String baseUrl = config.getNormalizedBaseUrl();
        if (apiKey == null || apiKey.isBlank() || baseUrl.isEmpty()
                || !sameHost(url, baseUrl)) {
            return headers -> { };
        }
        if (config.getProvider() == GatewayProvider.EVOLUTION) {
            return headers -> headers.set("apikey", apiKey);
        }
        return headers -> {
            headers.set("X-Api-Key", apiKey);
            headers.setBearerAuth(apiKey);
        };
    }

    private static boolean sameHost(String url, String baseUrl) {
        String host = URI.create(url).getHost();
        return host != null && host.equalsIgnoreCase(URI.create(baseUrl).getHost());
    }

    static String extension(String contentType, MessageContentType type) {
        String mime = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        int semicolon = mime.indexOf(';');
        if (semicolon >= 0) {
            mime = mime.substring(0, semicolon).trim();
        }
        String extension = EXTENSIONS.get(mime);
        if (extension != null) {
            return extension;
        }
        return switch (type) {
            case IMAGE -> "jpg";
            case AUDIO -> "ogg";
            case VIDEO -> "mp4";
            default -> "bin";
        };
    }
}
