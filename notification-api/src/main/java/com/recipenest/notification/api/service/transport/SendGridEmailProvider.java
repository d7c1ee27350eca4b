package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.provider.EmailMessage;
import com.recipenest.notification.common.provider.EmailProvider;
import com.recipenest.notification.common.provider.EmailResult;
import com.recipenest.notification.common.provider.ProviderErrorCategory;
import com.recipenest.notification.common.provider.ProviderName;
import com.recipenest.notification.common.retry.FailureClassification;
import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SendGrid implementation of {@link EmailProvider}.
 */
@Service
@Slf4j
public class SendGridEmailProvider implements EmailProvider {

    private static final Pattern STATUS_CODE = Pattern.compile("status Code (\\d{3})");

    private final SendGrid sendGrid;
    private final FailureClassifier failureClassifier;
    private final String fromEmail;
    private final String fromName;

    @Autowired
    public SendGridEmailProvider(
            @Value("${sendgrid.api.key:}") String apiKey,
            @Value("${sendgrid.from.email:noreply@recipenest.app}") String fromEmail,
            @Value("${sendgrid.from.name:RecipeNest}") String fromName,
            FailureClassifier failureClassifier) {
        this(apiKey == null || apiKey.isBlank() ? null : new SendGrid(apiKey), fromEmail, fromName, failureClassifier);
    }

    SendGridEmailProvider(SendGrid sendGrid, String fromEmail, String fromName, FailureClassifier failureClassifier) {
        this.sendGrid = sendGrid;
        this.fromEmail = fromEmail;
        this.fromName = fromName;
        this.failureClassifier = failureClassifier;
    }

    @Override
    public EmailResult sendEmail(EmailMessage message) {
        if (!isConfigured()) {
            return EmailResult.createFailure("SendGrid API key is not configured", ProviderErrorCategory.CONFIG, null);
        }
        Mail mail = new Mail(
            new Email(fromEmail, fromName),
            message.subject(),
            new Email(message.to()),
            new Content(message.html() ? "text/html" : "text/plain", message.body())
        );

        try {
            Request request = new Request();
            request.setMethod(Method.POST);
            request.setEndpoint("mail/send");
            request.setBody(mail.build());

            Response response = sendGrid.api(request);
            int statusCode = response.getStatusCode();
            if (statusCode >= 200 && statusCode < 300) {
                log.info("Email accepted by SendGrid for {} with status code {}", message.to(), statusCode);
                return EmailResult.createSuccess(statusCode);
            }

            String errorMessage = String.format("SendGrid API error: Status %d - %s",
                statusCode, response.getBody() != null ? response.getBody() : "No response body");
            FailureClassification classification =
                failureClassifier.classify(statusCode, errorMessage, response.getBody());
            log.warn("SendGrid rejected email to {}: {}", message.to(), errorMessage);
            return EmailResult.createFailure(errorMessage, failureClassifier.toErrorCategory(classification), statusCode);
        } catch (IOException e) {
            // The SendGrid client reports non-2xx responses as IOExceptions carrying the body
            String errorMessage = String.format("SendGrid API IOException: %s", e.getMessage());
            Integer statusCode = extractStatusCode(e.getMessage());
            FailureClassification classification = failureClassifier.classify(statusCode, e.getMessage(), null);
            log.warn("Error sending email via SendGrid to {}: {}", message.to(), e.getMessage());
            return EmailResult.createFailure(errorMessage, failureClassifier.toErrorCategory(classification), statusCode);
        }
    }

    static Integer extractStatusCode(String message) {
        if (message == null) {
            return null;
        }
        Matcher matcher = STATUS_CODE.matcher(message);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    @Override
    public ProviderName getProviderName() {
        return ProviderName.SENDGRID;
    }

    @Override
    public boolean isConfigured() {
        return sendGrid != null;
    }
}
