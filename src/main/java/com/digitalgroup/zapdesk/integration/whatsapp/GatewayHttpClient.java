package com.digitalgroup.zapdesk.integration.whatsapp;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Blocking JSON calls to gateway vendors. Non-2xx responses are returned, not thrown,
 * so adapters can inspect the body; transport failures become {@link ProviderException}.
 */
@Slf4j
@Component
public class GatewayHttpClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public GatewayHttpClient(WebClient.Builder webClientBuilder,
                             ObjectMapper objectMapper,
                             @Value("${zapdesk.gateway.timeout-seconds:30}") long timeoutSeconds) {
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    public GatewayResponse post(GatewayProvider provider, String url,
                                Consumer<HttpHeaders> headers, Object body) {
        WebClient.RequestHeadersSpec<?> spec = webClientBuilder.build()
                .post()
                .uri(url)
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body);
        return exchange(provider, url, spec);
    }

    public GatewayResponse get(GatewayProvider provider, String url, Consumer<HttpHeaders> headers) {
        WebClient.RequestHeadersSpec<?> spec = webClientBuilder.build()
                .get()
                .uri(url)
                .headers(headers)
                .accept(MediaType.APPLICATION_JSON);
        return exchange(provider, url, spec);
    }

    /**
     * Downloads a binary body such as a media file.
     *
     * @throws ProviderException on transport failures and non-2xx responses
     */
    public DownloadedMedia download(GatewayProvider provider, String url, Consumer<HttpHeaders> headers) {
        DownloadedMedia media;
        try {
            media = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .headers(headers)
                    .exchangeToMono(clientResponse -> {
                        int status = clientResponse.statusCode().value();
                        if (!clientResponse.statusCode().is2xxSuccessful()) {
                            return clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(ProviderException.fromResponse(provider, status, body)));
                        }
                        String contentType = clientResponse.headers().contentType()
                                .map(MediaType::toString)
                                .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);
                        return clientResponse.bodyToMono(byte[].class)
                                .defaultIfEmpty(new byte[0])
                                .map(bytes -> new DownloadedMedia(bytes, contentType));
                    })
                    .block(timeout);
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("{} download from {} failed: {}", provider, url, e.getMessage());
            throw new ProviderException(provider, "Gateway unreachable: " + e.getMessage(), e);
        }
        if (media == null || media.data().length == 0) {
            throw new ProviderException(provider, "Gateway returned an empty file for " + url, null);
        }
        return media;
    }

    private GatewayResponse exchange(GatewayProvider provider, String url, WebClient.RequestHeadersSpec<?> spec) {
        GatewayResponse response;
        try {
            response = spec.exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new GatewayResponse(clientResponse.statusCode().value(), body, parse(body))))
                    .block(timeout);
        } catch (RuntimeException e) {
            log.error("{} request to {} failed: {}", provider, url, e.getMessage());
            throw new ProviderException(provider, "Gateway unreachable: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new ProviderException(provider, "Gateway returned no response", null);
        }
        if (!response.isSuccess()) {
            log.warn("{} request to {} returned {}: {}", provider, url, response.status(), abbreviate(response.body()));
        }
        return response;
    }

    private Map<String, Object> parse(String body) {
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(trimmed, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("Gateway body is not valid JSON: {}", e.getMessage());
            return Map.of();
        }
    }

    private static String abbreviate(String body) {
        return body != null && body.length() > 300 ? body.substring(0, 300) : body;
    }
}
