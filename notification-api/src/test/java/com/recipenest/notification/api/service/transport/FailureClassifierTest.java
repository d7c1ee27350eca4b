package com.recipenest.notification.api.service.transport;

import com.recipenest.notification.common.provider.ProviderErrorCategory;
import com.recipenest.notification.common.retry.FailureClassification;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    private final FailureClassifier classifier = new FailureClassifier();

    @Test
    void testClassify_RateLimit() {
        assertEquals(FailureClassification.RATE_LIMIT, classifier.classify(429, "Too many requests", null));
    }

    @Test
    void testClassify_AuthStatusIsPermanent() {
        assertEquals(FailureClassification.PERMANENT, classifier.classify(401, null, null));
        assertEquals(FailureClassification.PERMANENT, classifier.classify(403, null, null));
    }

    @Test
    void testClassify_InvalidKeyMessageIsPermanent() {
        assertEquals(FailureClassification.PERMANENT,
            classifier.classify(null, "The provided authorization grant is invalid, expired, or revoked", null));
        assertEquals(FailureClassification.PERMANENT, classifier.classify(400, null, "{\"error\":\"Invalid API key\"}"));
    }

    @Test
    void testClassify_ServerErrorsAndUnknownAreTransient() {
        assertEquals(FailureClassification.TRANSIENT, classifier.classify(503, "Service Unavailable", null));
        assertEquals(FailureClassification.TRANSIENT, classifier.classify(null, null, null));
    }

    @Test
    void testToErrorCategory() {
        assertEquals(ProviderErrorCategory.AUTH, classifier.toErrorCategory(FailureClassification.PERMANENT));
        assertEquals(ProviderErrorCategory.TEMPORARY, classifier.toErrorCategory(FailureClassification.TRANSIENT));
        assertEquals(ProviderErrorCategory.TEMPORARY, classifier.toErrorCategory(FailureClassification.RATE_LIMIT));
    }
}
