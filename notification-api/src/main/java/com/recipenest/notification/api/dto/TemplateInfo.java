package com.recipenest.notification.api.dto;

import com.recipenest.notification.api.enums.NotificationCategory;
import com.recipenest.notification.common.NotificationChannel;

import java.util.Set;

/**
 * Catalog entry for one notification category.
 */
public record TemplateInfo(
    NotificationCategory category,
    String subjectTemplate,
    String titleTemplate,
    String messageTemplate,
    Set<String> requiredKeys,
    Set<NotificationChannel> channels
) {
    public static TemplateInfo from(NotificationCategory category) {
        return new TemplateInfo(
            category,
            category.subjectTemplate(),
            category.titleTemplate(),
            category.messageTemplate(),
            category.requiredKeys(),
            category.channels()
        );
    }
}
