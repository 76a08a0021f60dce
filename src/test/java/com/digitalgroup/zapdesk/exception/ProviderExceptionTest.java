package com.digitalgroup.zapdesk.exception;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProviderExceptionTest {

    @Test
    void fromResponse_PlusVersion_IsPlanRestriction() {
        ProviderException e = ProviderException.fromResponse(GatewayProvider.WAHA, 422,
                "{\"error\":\"Available only in Plus version\"}");

        assertEquals(ProviderFailureCause.UNSUPPORTED_MEDIA_FOR_PLAN, e.getFailureCause());
        assertEquals("PROVIDER_UNSUPPORTED_MEDIA_FOR_PLAN", e.getErrorCode());
        assertEquals(422, e.getHttpStatus());
    }

    @Test
    void fromResponse_MissingSession() {
        ProviderException e = ProviderException.fromResponse(GatewayProvider.WAHA, 404,
                "Session \"default\" does not exist");

        assertEquals(ProviderFailureCause.SESSION_NOT_FOUND, e.getFailureCause());
    }

    @Test
    void fromResponse_NoLid_IsIdentityFailure() {
        ProviderException e = ProviderException.fromResponse(GatewayProvider.EVOLUTION, 400,
                "No LID for user 5545999990000");

        assertEquals(ProviderFailureCause.IDENTITY_RESOLUTION_FAILURE, e.getFailureCause());
    }

    @Test
    void fromResponse_Forbidden_IsUnauthorized() {
        assertEquals(ProviderFailureCause.UNAUTHORIZED,
                ProviderException.fromResponse(GatewayProvider.META_CLOUD, 403, "").getFailureCause());
    }

    @Test
    void fromResponse_Other_IsGenericWithAbbreviatedBody() {
        ProviderException e = ProviderException.fromResponse(GatewayProvider.ZAPI, 500, "x".repeat(500));

        assertEquals(ProviderFailureCause.GENERIC, e.getFailureCause());
        assertTrue(e.getMessage().startsWith("Gateway error 500: "));
        assertTrue(e.getMessage().length() < 250);
    }

    @Test
    void fromResponse_NullBody() {
        ProviderException e = ProviderException.fromResponse(GatewayProvider.CUSTOM, 502, null);

        assertEquals(ProviderFailureCause.GENERIC, e.getFailureCause());
    }
}
