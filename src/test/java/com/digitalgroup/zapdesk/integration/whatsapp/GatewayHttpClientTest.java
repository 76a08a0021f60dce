package com.digitalgroup.zapdesk.integration.whatsapp;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GatewayHttpClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private GatewayHttpClient clientAnswering(HttpStatus status, String body) {
        ExchangeFunction exchange = request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, "application/json")
                    .body(body)
                    .build());
        };
        return new GatewayHttpClient(WebClient.builder().exchangeFunction(exchange), new ObjectMapper(), 5);
    }

    @Test
    void post_Success_ParsesJsonAndSendsHeaders() {
        GatewayHttpClient client = clientAnswering(HttpStatus.CREATED, "{\"id\":\"3EB0ABC\",\"ack\":1}");

        GatewayResponse response = client.post(GatewayProvider.WAHA, "http://waha:3000/api/sendText",
                headers -> headers.set("X-Api-Key", "key-123"), Map.of("text", "Olá"));

        assertTrue(response.isSuccess());
        assertEquals("3EB0ABC", response.json().get("id"));
        assertEquals(1, requests.size());
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals("key-123", requests.get(0).headers().getFirst("X-Api-Key"));
    }

    @Test
    void get_Unauthorized_IsReturnedNotThrown() {
        GatewayHttpClient client = clientAnswering(HttpStatus.UNAUTHORIZED, "Unauthorized");

        GatewayResponse response = client.get(GatewayProvider.WAHA, "http://waha:3000/api/contacts/check-exists",
                headers -> headers.setBearerAuth("key-123"));

        assertTrue(response.isUnauthorized());
        assertEquals("Unauthorized", response.body());
        assertTrue(response.json().isEmpty());
        assertEquals("Bearer key-123", requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void get_MalformedJson_YieldsEmptyMap() {
        GatewayHttpClient client = clientAnswering(HttpStatus.OK, "{broken");

        GatewayResponse response = client.get(GatewayProvider.EVOLUTION, "http://evo:8080/chat/x", headers -> {});

        assertTrue(response.isSuccess());
        assertTrue(response.json().isEmpty());
    }

    @Test
    void post_TransportFailure_IsProviderException() {
        ExchangeFunction failing = request -> Mono.error(new ConnectException("Connection refused"));
        GatewayHttpClient client = new GatewayHttpClient(WebClient.builder().exchangeFunction(failing),
                new ObjectMapper(), 5);

        ProviderException e = assertThrows(ProviderException.class, () -> client.post(GatewayProvider.ZAPI,
                "http://zapi/send-text", headers -> {}, Map.of()));

        assertEquals(GatewayProvider.ZAPI, e.getProvider());
        assertTrue(e.getMessage().startsWith("Gateway unreachable"));
    }
}
