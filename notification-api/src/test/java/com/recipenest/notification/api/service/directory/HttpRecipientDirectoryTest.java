package com.recipenest.notification.api.service.directory;

import com.recipenest.notification.api.service.NotFoundException;
import com.recipenest.notification.api.service.ServiceUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpRecipientDirectoryTest {

    private final UUID recipientId = UUID.randomUUID();

    private HttpRecipientDirectory directory(ExchangeFunction exchange) {
        return new HttpRecipientDirectory(WebClient.builder().exchangeFunction(exchange),
            "http://user-service", Duration.ofMillis(500));
    }

    private static ExchangeFunction respond(HttpStatus status, String json) {
        return request -> Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(json)
            .build());
    }

    @Test
    void testLookupContactAddress_ReturnsEmail() {
        AtomicReference<URI> requested = new AtomicReference<>();
        ExchangeFunction exchange = request -> {
            requested.set(request.url());
            return respond(HttpStatus.OK, "{\"id\":\"" + recipientId + "\",\"email\":\"cook@example.com\"}")
                .exchange(request);
        };

        assertEquals("cook@example.com", directory(exchange).lookupContactAddress(recipientId));
        assertEquals("/api/v1/users/" + recipientId, requested.get().getPath());
    }

    @Test
    void testLookupContactAddress_WhenUserUnknown_ThrowsNotFound() {
        HttpRecipientDirectory directory = directory(respond(HttpStatus.NOT_FOUND, "{}"));

        assertThrows(NotFoundException.class, () -> directory.lookupContactAddress(recipientId));
    }

    @Test
    void testLookupContactAddress_WhenUserHasNoEmail_ThrowsNotFound() {
        HttpRecipientDirectory directory = directory(respond(HttpStatus.OK, "{\"id\":\"" + recipientId + "\"}"));

        assertThrows(NotFoundException.class, () -> directory.lookupContactAddress(recipientId));
    }

    @Test
    void testLookupContactAddress_WhenServerError_ThrowsServiceUnavailable() {
        HttpRecipientDirectory directory = directory(respond(HttpStatus.BAD_GATEWAY, "{}"));

        assertThrows(ServiceUnavailableException.class, () -> directory.lookupContactAddress(recipientId));
    }

    @Test
    void testLookupContactAddress_WhenUnreachable_ThrowsServiceUnavailable() {
        HttpRecipientDirectory directory = directory(request -> Mono.error(new WebClientRequestException(
            new ConnectException("Connection refused"), HttpMethod.GET, request.url(), new HttpHeaders())));

        assertThrows(ServiceUnavailableException.class, () -> directory.lookupContactAddress(recipientId));
    }

    @Test
    void testLookupContactAddress_WhenSlow_ThrowsServiceUnavailable() {
        HttpRecipientDirectory directory = directory(request -> Mono.never());

        assertThrows(ServiceUnavailableException.class, () -> directory.lookupContactAddress(recipientId));
    }
}
