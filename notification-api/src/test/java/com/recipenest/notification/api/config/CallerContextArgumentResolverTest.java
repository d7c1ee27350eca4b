package com.recipenest.notification.api.config;

import com.recipenest.notification.api.service.BadRequestException;
import com.recipenest.notification.api.service.CallerContext;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CallerContextArgumentResolverTest {

    @Test
    void testFromHeaders_ParsesIdAndScopes() {
        UUID callerId = UUID.randomUUID();

        CallerContext caller = CallerContextArgumentResolver.fromHeaders(
            callerId.toString(), " notification:admin , recipes:read,,");

        assertEquals(callerId, caller.callerId());
        assertEquals(Set.of("notification:admin", "recipes:read"), caller.scopes());
        assertTrue(caller.isAdmin());
    }

    @Test
    void testFromHeaders_WhenAbsent_ReturnsAnonymousCaller() {
        CallerContext caller = CallerContextArgumentResolver.fromHeaders(null, null);

        assertNull(caller.callerId());
        assertTrue(caller.scopes().isEmpty());
        assertFalse(caller.isAdmin());
    }

    @Test
    void testFromHeaders_WhenIdMalformed_ThrowsBadRequest() {
        assertThrows(BadRequestException.class, () -> CallerContextArgumentResolver.fromHeaders("42", null));
    }
}
