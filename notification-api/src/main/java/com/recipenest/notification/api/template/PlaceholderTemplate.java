package com.recipenest.notification.api.template;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text template with {@code {key}} placeholders, parsed once.
 *
 * Rendering fails when a referenced key is missing from the payload; there is no
 * fallback to the raw template text.
 */
public final class PlaceholderTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z][a-z0-9_]*)}");

    private final String source;
    private final Set<String> keys;

    private PlaceholderTemplate(String source) {
        this.source = source;
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(source);
        while (matcher.find()) {
            found.add(matcher.group(1));
        }
        this.keys = Collections.unmodifiableSet(found);
    }

    public static PlaceholderTemplate of(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Template source cannot be blank");
        }
        return new PlaceholderTemplate(source);
    }

    public Set<String> keys() {
        return keys;
    }

    public String source() {
        return source;
    }

    /**
     * @throws IllegalArgumentException if the payload lacks a referenced key
     */
    public String render(Map<String, ?> payload) {
        Matcher matcher = PLACEHOLDER.matcher(source);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            Object value = payload != null ? payload.get(key) : null;
            if (value == null) {
                throw new IllegalArgumentException("Missing template value for '" + key + "'");
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(String.valueOf(value)));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
