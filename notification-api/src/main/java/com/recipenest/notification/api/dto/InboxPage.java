package com.recipenest.notification.api.dto;

import java.util.List;

public record InboxPage(
    List<InboxItem> items,
    long totalCount,
    long unreadCount,
    int limit,
    long offset
) {
}
