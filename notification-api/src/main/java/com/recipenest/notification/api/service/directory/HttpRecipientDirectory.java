package com.recipenest.notification.api.service.directory;

import com.recipenest.notification.api.service.NotFoundException;
import com.recipenest.notification.api.service.ServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Recipient directory backed by the user service's REST API.
 *
 * Uses WebClient.block(); only called on the create path when the caller did not supply
 * a contact address.
 */
@Service
@Slf4j
public class HttpRecipientDirectory implements RecipientDirectory {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE_REF =
        new ParameterizedTypeReference<Map<String, Object>>() {};

    private final WebClient webClient;
    private final Duration timeout;

    public HttpRecipientDirectory(
            WebClient.Builder webClientBuilder,
            @Value("${notification.directory.base-url:http://user-service:8080}") String baseUrl,
            @Value("${notification.directory.timeout:5s}") Duration timeout) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.timeout = timeout;
    }

    @Override
    public String lookupContactAddress(UUID recipientId) {
        Map<String, Object> user;
        try {
            user = webClient.get()
                .uri("/api/v1/users/{userId}", recipientId)
                .retrieve()
                .bodyToMono(MAP_TYPE_REF)
                .block(timeout);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new NotFoundException("Recipient not found: " + recipientId, e);
            }
            log.error("Recipient directory returned status {} for {}", e.getStatusCode(), recipientId);
            throw new ServiceUnavailableException("Recipient directory error: " + e.getStatusCode(), e);
        } catch (WebClientRequestException e) {
            log.error("Recipient directory unreachable while looking up {}", recipientId, e);
            throw new ServiceUnavailableException("Recipient directory unavailable", e);
        } catch (IllegalStateException e) {
            // block(timeout) signals a timeout with IllegalStateException
            log.error("Recipient directory timed out while looking up {}", recipientId);
            throw new ServiceUnavailableException("Recipient directory timed out", e);
        }

        Object email = user != null ? user.get("email") : null;
        if (email == null || email.toString().isBlank()) {
            throw new NotFoundException("Recipient " + recipientId + " has no email address");
        }
        return email.toString();
    }
}
