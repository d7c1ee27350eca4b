package com.recipenest.notification.api.enums;

import com.recipenest.notification.api.template.PlaceholderTemplate;
import com.recipenest.notification.common.NotificationChannel;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Closed set of notification categories.
 *
 * Each category carries its email subject, in-app title and message templates and the
 * channels it is delivered on. The payload keys a category needs are exactly the
 * placeholders its templates reference, so a category can never render with a key
 * nobody validated.
 */
public enum NotificationCategory {
    // Recipe events
    RECIPE_PUBLISHED("New Recipe: {recipe_title}", "Recipe Published",
        "{actor_name} published a new recipe: {recipe_title}"),
    RECIPE_LIKED("{actor_name} liked your recipe", "Someone liked your recipe",
        "{actor_name} liked {recipe_title}"),
    RECIPE_COMMENTED("New comment on {recipe_title}", "New comment on your recipe",
        "{actor_name} commented on {recipe_title}"),
    RECIPE_SHARED("{actor_name} shared a recipe with you", "Recipe shared with you",
        "{actor_name} shared {recipe_title} with you"),
    RECIPE_COLLECTED("Your recipe was added to a collection", "Recipe added to collection",
        "{actor_name} added {recipe_title} to their collection"),
    RECIPE_RATED("Your recipe was rated", "Your recipe was rated",
        "{actor_name} rated {recipe_title}"),
    RECIPE_FEATURED("Your recipe has been featured!", "Your recipe is featured!",
        "{recipe_title} has been featured"),
    RECIPE_TRENDING("Your recipe is trending!", "Your recipe is trending!",
        "{recipe_title} is trending"),

    // Social events
    NEW_FOLLOWER("{actor_name} started following you", "New follower",
        "{actor_name} started following you"),
    MENTION("{actor_name} mentioned you", "You were mentioned",
        "{actor_name} mentioned you in a comment"),
    COLLECTION_INVITE("You've been invited to a collection", "Collection invite",
        "{actor_name} invited you to collaborate on {collection_name}"),

    // System events
    WELCOME("Welcome to RecipeNest!", "Welcome!",
        "Welcome to RecipeNest, {recipient_name}"),
    PASSWORD_RESET("Reset your password", "Password Reset",
        "Your password reset link is ready: {reset_link}",
        EnumSet.of(NotificationChannel.EMAIL)),
    PASSWORD_CHANGED("Your password was changed", "Password Changed",
        "Your password was successfully changed"),
    EMAIL_CHANGED("Your email address was updated", "Email Changed",
        "Your email address was updated"),
    MAINTENANCE("Scheduled Maintenance Notice", "Scheduled Maintenance",
        "{message}"),
    SYSTEM_ALERT("System Alert", "System Alert",
        "{message}");

    private final PlaceholderTemplate subject;
    private final PlaceholderTemplate title;
    private final PlaceholderTemplate message;
    private final Set<NotificationChannel> channels;
    private final Set<String> requiredKeys;

    NotificationCategory(String subject, String title, String message) {
        this(subject, title, message, EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.IN_APP));
    }

    NotificationCategory(String subject, String title, String message, Set<NotificationChannel> channels) {
        this.subject = PlaceholderTemplate.of(subject);
        this.title = PlaceholderTemplate.of(title);
        this.message = PlaceholderTemplate.of(message);
        this.channels = Collections.unmodifiableSet(EnumSet.copyOf(channels));
        Set<String> keys = new LinkedHashSet<>();
        keys.addAll(this.subject.keys());
        keys.addAll(this.title.keys());
        keys.addAll(this.message.keys());
        this.requiredKeys = Collections.unmodifiableSet(keys);
    }

    public Set<NotificationChannel> channels() {
        return channels;
    }

    public Set<String> requiredKeys() {
        return requiredKeys;
    }

    public String subjectTemplate() {
        return subject.source();
    }

    public String titleTemplate() {
        return title.source();
    }

    public String messageTemplate() {
        return message.source();
    }

    /**
     * @return required keys absent (or null) in the payload, in template order
     */
    public List<String> missingKeys(Map<String, ?> payload) {
        return requiredKeys.stream()
            .filter(key -> payload == null || payload.get(key) == null)
            .toList();
    }

    public String renderSubject(Map<String, ?> payload) {
        return subject.render(payload);
    }

    public String renderTitle(Map<String, ?> payload) {
        return title.render(payload);
    }

    /**
     * Message text, used both as the in-app message and the email body.
     */
    public String renderMessage(Map<String, ?> payload) {
        return message.render(payload);
    }
}
