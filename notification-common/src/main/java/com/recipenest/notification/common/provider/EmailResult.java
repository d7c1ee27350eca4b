package com.recipenest.notification.common.provider;

/**
 * Immutable result of an email send.
 *
 * <pre>
 * EmailResult result = emailProvider.sendEmail(message);
 * if (!result.isSuccess() &amp;&amp; result.getErrorCategory().requiresOperator()) {
 *     // abort, do not retry
 * }
 * </pre>
 */
public record EmailResult(
    boolean success,
    String errorMessage,
    ProviderErrorCategory errorCategory,
    Integer statusCode
) implements MessageResult {

    public static EmailResult createSuccess(int statusCode) {
        return new EmailResult(true, null, null, statusCode);
    }

    public static EmailResult createFailure(String errorMessage, ProviderErrorCategory errorCategory, Integer statusCode) {
        return new EmailResult(false, errorMessage, errorCategory, statusCode);
    }

    /**
     * Failure with TEMPORARY category and no HTTP status (connection-level errors).
     */
    public static EmailResult createFailure(String errorMessage) {
        return new EmailResult(false, errorMessage, ProviderErrorCategory.TEMPORARY, null);
    }

    @Override
    public boolean isSuccess() {
        return success;
    }

    @Override
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public ProviderErrorCategory getErrorCategory() {
        return errorCategory;
    }

    @Override
    public Integer getStatusCode() {
        return statusCode;
    }
}
