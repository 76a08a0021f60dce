package com.digitalgroup.zapdesk.integration.whatsapp;

import java.util.Map;

/**
 * Raw outcome of a gateway HTTP call. {@code json} is empty when the body is not a JSON object.
 */
public record GatewayResponse(int status, String body, Map<String, Object> json) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isUnauthorized() {
        return status == 401;
    }
}
