package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.provider.ProviderErrorCategory;
import com.recipenest.notification.common.retry.FailureClassification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies provider failures.
 *
 * Classification rules:
 * - RATE_LIMIT: HTTP 429
 * - PERMANENT: HTTP 401/403, or an error mentioning an invalid API key / unauthorized access
 * - TRANSIENT: everything else (network errors, 5xx, rejected messages)
 */
@Service
@Slf4j
public class FailureClassifier {

    public FailureClassification classify(Integer httpStatusCode, String errorMessage, String responseBody) {
        if (httpStatusCode != null && httpStatusCode == 429) {
            return FailureClassification.RATE_LIMIT;
        }
        if (httpStatusCode != null && (httpStatusCode == 401 || httpStatusCode == 403)) {
            return FailureClassification.PERMANENT;
        }
        if (mentionsBadCredentials(errorMessage) || mentionsBadCredentials(responseBody)) {
            return FailureClassification.PERMANENT;
        }
        return FailureClassification.TRANSIENT;
    }

    public ProviderErrorCategory toErrorCategory(FailureClassification classification) {
        return switch (classification) {
            case PERMANENT -> ProviderErrorCategory.AUTH;
            case RATE_LIMIT, TRANSIENT -> ProviderErrorCategory.TEMPORARY;
        };
    }

    private boolean mentionsBadCredentials(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase();
        return lower.contains("invalid api key")
            || lower.contains("unauthorized")
            || lower.contains("authorization grant is invalid")
            || lower.contains("permission denied");
    }
}
