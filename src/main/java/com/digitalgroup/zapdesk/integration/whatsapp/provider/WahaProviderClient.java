package com.digitalgroup.zapdesk.integration.whatsapp.provider;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.digitalgroup.zapdesk.exception.ProviderFailureCause;
import com.digitalgroup.zapdesk.integration.whatsapp.GatewayHttpClient;
import com.digitalgroup.zapdesk.integration.whatsapp.GatewayResponse;
import com.digitalgroup.zapdesk.integration.whatsapp.PayloadUtils;
import com.digitalgroup.zapdesk.util.ChatIdUtils;
import com.digitalgroup.zapdesk.util.PhoneUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * WAHA (WhatsApp HTTP API) adapter.
 * Deployments differ in how they expect the API key, so every call walks the known
 * header encodings until one is not answered with 401.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WahaProviderClient implements WhatsAppProviderClient, WhatsAppContactClient {

    static final String API_KEY_HEADER = "X-Api-Key";

    private final GatewayHttpClient httpClient;

    @Override
    public GatewayProvider provider() {
        return GatewayProvider.WAHA;
    }

    @Override
    public ProviderSendResult sendText(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = baseBody(config, message);
        body.put("text", message.content());
        if (message.replyToId() != null) {
            body.put("reply_to", message.replyToId());
        }
        return dispatch(config, "/api/sendText", body, message);
    }

    @Override
    public ProviderSendResult sendImage(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = baseBody(config, message);
        body.put("file", file(message, "image/jpeg"));
        if (message.hasCaption()) {
            body.put("caption", message.content());
        }
        return dispatch(config, "/api/sendImage", body, message);
    }

    @Override
    public ProviderSendResult sendAudio(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = baseBody(config, message);
        body.put("file", file(message, "audio/ogg; codecs=opus"));
        return dispatch(config, "/api/sendVoice", body, message);
    }

    @Override
    public ProviderSendResult sendVideo(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = baseBody(config, message);
        body.put("file", file(message, "video/mp4"));
        if (message.hasCaption()) {
            body.put("caption", message.content());
        }
        return dispatch(config, "/api/sendVideo", body, message);
    }

    @Override
    public ProviderSendResult sendDocument(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = baseBody(config, message);
        body.put("file", file(message, null));
        if (message.hasCaption()) {
            body.put("caption", message.content());
        }
        return dispatch(config, "/api/sendFile", body, message);
    }

    @Override
    public Optional<String> resolveMaskedIdentity(GatewayConfig config, String maskedId) {
        String lid = ChatIdUtils.maskedDigits(maskedId);
        String url = config.getNormalizedBaseUrl() + "/api/" + config.getInstanceName() + "/lids/" + lid;

        GatewayResponse response = withAuthRetry(config, headers -> httpClient.get(provider(), url, headers));
        if (!response.isSuccess()) {
            log.debug("WAHA could not resolve masked id {}: {}", lid, response.status());
            return Optional.empty();
        }

        String candidate = PayloadUtils.firstString(response.json(), "pn", "phone", "number", "jid", "id");
        if (candidate == null || candidate.contains(ChatIdUtils.MASKED_SUFFIX)) {
            return Optional.empty();
        }
        String digits = PhoneUtils.digitsOnly(candidate);
        if (digits.length() < 10 || digits.length() > 15) {
            return Optional.empty();
        }
        log.info("Resolved masked id {} to phone {}", lid, digits);
        return Optional.of(digits);
    }

    /**
     * Checks each Brazilian variant of the number. Empty only when the gateway answered
     * that none is on WhatsApp; gateway errors are thrown.
     */
    @Override
    public Optional<String> findChatId(GatewayConfig config, String fullPhone) {
        for (String variant : PhoneUtils.brazilianVariants(PhoneUtils.digitsOnly(fullPhone))) {
            String url = UriComponentsBuilder.fromHttpUrl(config.getNormalizedBaseUrl() + "/api/contacts/check-exists")
                    .queryParam("phone", variant)
                    .queryParam("session", config.getInstanceName())
                    .toUriString();

            GatewayResponse response = withAuthRetry(config, headers -> httpClient.get(provider(), url, headers));
            if (!response.isSuccess()) {
                throw ProviderException.fromResponse(provider(), response.status(), response.body());
            }
            Map<String, Object> json = response.json();
            boolean exists = PayloadUtils.getBoolean(json, "numberExists")
                    || PayloadUtils.getBoolean(json, "exists")
                    || PayloadUtils.getBoolean(json, "isRegistered");
            if (exists) {
                String chatId = PayloadUtils.firstString(json, "chatId", "jid", "id");
                return Optional.of(chatId != null ? chatId : ChatIdUtils.buildChatId(variant));
            }
        }
        log.debug("No WhatsApp account found for {} or its variants", fullPhone);
        return Optional.empty();
    }

    @Override
    public ProfilePictureResult fetchProfilePicture(GatewayConfig config, String contactId, boolean masked) {
        String formatted;
        if (masked) {
            formatted = ChatIdUtils.maskedDigits(contactId) + ChatIdUtils.MASKED_SUFFIX;
        } else {
            String digits = PhoneUtils.digitsOnly(contactId);
            if (digits.length() < 10) {
                return ProfilePictureResult.unavailable("number_too_short");
            }
            formatted = ChatIdUtils.buildChatId(digits);
        }

        String url = UriComponentsBuilder.fromHttpUrl(config.getNormalizedBaseUrl() + "/api/contacts/profile-picture")
                .queryParam("contactId", formatted)
                .queryParam("session", config.getInstanceName())
                .queryParam("refresh", true)
                .toUriString();

        GatewayResponse response;
        try {
            response = withAuthRetry(config, headers -> httpClient.get(provider(), url, headers));
        } catch (ProviderException e) {
            return ProfilePictureResult.retryLater(e.getMessage());
        }
        if (!response.isSuccess()) {
            return ProfilePictureResult.retryLater("api_error_" + response.status());
        }

        String picture = PayloadUtils.firstString(response.json(), "profilePictureURL", "profilePicture", "url", "imgUrl");
        if (picture != null && picture.startsWith("http")) {
            return ProfilePictureResult.found(picture);
        }
        return ProfilePictureResult.retryLater("no_picture_or_private");
    }

    private ProviderSendResult dispatch(GatewayConfig config, String path, Map<String, Object> body,
                                        OutboundMessage message) {
        String url = config.getNormalizedBaseUrl() + path;
        GatewayResponse response = withAuthRetry(config, headers -> httpClient.post(provider(), url, headers, body));
        if (!response.isSuccess()) {
            throw ProviderException.fromResponse(provider(), response.status(), response.body());
        }
        String messageId = PayloadUtils.firstString(response.json(), "id", "key.id");
        log.info("WAHA {} sent to {} (id={})", message.type(), message.chatId(), messageId);
        return new ProviderSendResult(messageId, message.chatId());
    }

    /**
     * Tries X-Api-Key, then Bearer, then the raw key in Authorization. Only 401 moves on.
     */
    GatewayResponse withAuthRetry(GatewayConfig config, Function<Consumer<HttpHeaders>, GatewayResponse> call) {
        String apiKey = config.getApiKey() != null ? config.getApiKey() : "";
        List<Consumer<HttpHeaders>> encodings = List.of(
                headers -> headers.set(API_KEY_HEADER, apiKey),
                headers -> headers.setBearerAuth(apiKey),
                headers -> headers.set(HttpHeaders.AUTHORIZATION, apiKey));

        GatewayResponse last = null;
        for (int i = 0; i < encodings.size(); i++) {
            last = call.apply(encodings.get(i));
            if (!last.isUnauthorized()) {
                return last;
            }
            log.debug("WAHA auth encoding {} rejected, trying next", i + 1);
        }
        throw new ProviderException(provider(), ProviderFailureCause.UNAUTHORIZED,
                "WAHA rejected every authentication format", last.status());
    }

    private Map<String, Object> baseBody(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = new HashMap<>();
        body.put("session", config.getInstanceName());
        body.put("chatId", message.chatId());
        return body;
    }

    private Map<String, Object> file(OutboundMessage message, String mimeType) {
        Map<String, Object> file = new HashMap<>();
        file.put("url", message.mediaUrl());
        if (mimeType != null) {
            file.put("mimetype", mimeType);
        }
        if (message.fileName() != null) {
            file.put("filename", message.fileName());
        }
        return file;
    }
}
