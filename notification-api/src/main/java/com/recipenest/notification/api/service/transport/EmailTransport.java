package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.NotificationChannel;
import com.recipenest.notification.common.provider.EmailMessage;
import com.recipenest.notification.common.provider.EmailProvider;
import com.recipenest.notification.common.provider.EmailResult;
import com.recipenest.notification.common.provider.ProviderName;
import com.recipenest.notification.common.retry.FailureClassification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Email channel: hands the rendered notification to the {@link EmailProvider}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmailTransport implements DeliveryTransport {

    private final EmailProvider emailProvider;
    private final FailureClassifier failureClassifier;

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public ProviderName providerName() {
        return emailProvider.getProviderName();
    }

    @Override
    public void send(DeliveryRequest request) {
        if (!emailProvider.isConfigured()) {
            throw new TransportConfigurationException(
                emailProvider.getProviderName().toConfigValue() + " is not configured");
        }
        if (request.contactAddress() == null || request.contactAddress().isBlank()) {
            throw new TransportException("Recipient has no email address");
        }

        EmailResult result = emailProvider.sendEmail(
            new EmailMessage(request.contactAddress(), request.subject(), request.body(), false));
        if (result.isSuccess()) {
            return;
        }
        if (result.getErrorCategory() != null && result.getErrorCategory().requiresOperator()) {
            throw new TransportConfigurationException(result.getErrorMessage());
        }
        FailureClassification classification =
            failureClassifier.classify(result.getStatusCode(), result.getErrorMessage(), null);
        if (classification == FailureClassification.PERMANENT) {
            throw new TransportConfigurationException(result.getErrorMessage());
        }
        throw new TransportException(result.getErrorMessage(), classification);
    }
}
