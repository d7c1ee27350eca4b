package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.provider.EmailMessage;
import com.recipenest.notification.common.provider.EmailResult;
import com.recipenest.notification.common.provider.ProviderErrorCategory;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SendGridEmailProviderTest {

    @Mock
    private SendGrid sendGrid;

    private final EmailMessage message = new EmailMessage("ada@example.com", "Welcome!", "Hello Ada", false);

    private SendGridEmailProvider provider() {
        return new SendGridEmailProvider(sendGrid, "noreply@recipenest.app", "RecipeNest", new FailureClassifier());
    }

    @Test
    void testSendEmail_WhenAccepted_ReturnsSuccess() throws IOException {
        when(sendGrid.api(any(Request.class))).thenReturn(new Response(202, "", Map.of()));

        EmailResult result = provider().sendEmail(message);

        assertTrue(result.isSuccess());
        assertEquals(202, result.getStatusCode());
    }

    @Test
    void testSendEmail_WhenRejectedWithServerError_ReturnsTemporaryFailure() throws IOException {
        when(sendGrid.api(any(Request.class))).thenReturn(new Response(503, "unavailable", Map.of()));

        EmailResult result = provider().sendEmail(message);

        assertFalse(result.isSuccess());
        assertEquals(ProviderErrorCategory.TEMPORARY, result.getErrorCategory());
        assertEquals(503, result.getStatusCode());
    }

    @Test
    void testSendEmail_WhenClientThrowsUnauthorized_ReturnsAuthFailure() throws IOException {
        when(sendGrid.api(any(Request.class))).thenThrow(new IOException(
            "Request returned status Code 401Body:{\"errors\":[{\"message\":\"The provided authorization grant is invalid\"}]}"));

        EmailResult result = provider().sendEmail(message);

        assertFalse(result.isSuccess());
        assertEquals(ProviderErrorCategory.AUTH, result.getErrorCategory());
        assertEquals(401, result.getStatusCode());
    }

    @Test
    void testSendEmail_WhenNotConfigured_ReturnsConfigFailure() {
        SendGridEmailProvider unconfigured =
            new SendGridEmailProvider((String) null, "noreply@recipenest.app", "RecipeNest", new FailureClassifier());

        EmailResult result = unconfigured.sendEmail(message);

        assertFalse(unconfigured.isConfigured());
        assertEquals(ProviderErrorCategory.CONFIG, result.getErrorCategory());
    }

    @Test
    void testIsConfigured_WhenApiKeyBlank_ReturnsFalse() {
        SendGridEmailProvider blankKey =
            new SendGridEmailProvider("  ", "noreply@recipenest.app", "RecipeNest", new FailureClassifier());

        assertFalse(blankKey.isConfigured());
    }

    @Test
    void testExtractStatusCode() {
        assertEquals(429, SendGridEmailProvider.extractStatusCode("Request returned status Code 429Body:"));
        assertNull(SendGridEmailProvider.extractStatusCode("Connection refused"));
        assertNull(SendGridEmailProvider.extractStatusCode(null));
    }
}
