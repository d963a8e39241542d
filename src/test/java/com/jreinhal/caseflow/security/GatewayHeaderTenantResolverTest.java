package com.jreinhal.caseflow.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.caseflow.model.User;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class GatewayHeaderTenantResolverTest {
    private static final String USER_ID = "5f00000000000000000000a1";
    private static final String FIRM_ID = "5f0000000000000000000001";

    @Test
    void readsGatewayHeaders() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(GatewayHeaderTenantResolver.USER_ID_HEADER, USER_ID);
        request.addHeader(GatewayHeaderTenantResolver.FIRM_ID_HEADER, FIRM_ID);
        request.addHeader(GatewayHeaderTenantResolver.USER_NAME_HEADER, "Noura");

        User user = new GatewayHeaderTenantResolver("GATEWAY").resolve(request);

        assertEquals(USER_ID, user.getId());
        assertEquals(FIRM_ID, user.getFirmId());
        assertEquals("Noura", user.getUsername());
        assertFalse(user.isSoloLawyer());
    }

    @Test
    void missingFirmMeansSoloLawyer() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(GatewayHeaderTenantResolver.USER_ID_HEADER, USER_ID);

        User user = new GatewayHeaderTenantResolver("GATEWAY").resolve(request);

        assertTrue(user.isSoloLawyer());
        assertEquals(USER_ID, user.getUsername());
    }

    @Test
    void gatewayModeRejectsMissingOrMalformedIdentity() {
        GatewayHeaderTenantResolver resolver = new GatewayHeaderTenantResolver("GATEWAY");
        MockHttpServletRequest malformedUser = new MockHttpServletRequest();
        malformedUser.addHeader(GatewayHeaderTenantResolver.USER_ID_HEADER, "{\"$ne\":null}");
        MockHttpServletRequest malformedFirm = new MockHttpServletRequest();
        malformedFirm.addHeader(GatewayHeaderTenantResolver.USER_ID_HEADER, USER_ID);
        malformedFirm.addHeader(GatewayHeaderTenantResolver.FIRM_ID_HEADER, "firm-1");

        assertNull(resolver.resolve(new MockHttpServletRequest()));
        assertNull(resolver.resolve(malformedUser));
        assertNull(resolver.resolve(malformedFirm));
    }

    @Test
    void devModeFallsBackToDevUser() {
        User user = new GatewayHeaderTenantResolver("dev").resolve(new MockHttpServletRequest());

        assertEquals(User.DEV_USER_ID, user.getId());
        assertEquals(User.DEV_FIRM_ID, user.getFirmId());
    }
}
