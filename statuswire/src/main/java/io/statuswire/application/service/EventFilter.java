package io.statuswire.application.service;

import io.statuswire.application.service.WebhookValidationException.Reason;
import io.statuswire.domain.model.WebhookEventType;
import io.statuswire.domain.model.WebhookSubscription;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Subscription event filters: {@code "*"} or a comma separated list of event names.
 */
public final class EventFilter {

    public static final String ALL = "*";

    /**
     * Normalizes a filter for storage: trimmed, lower-cased, de-duplicated. Null or blank means all events.
     *
     * @throws WebhookValidationException if a name is not a known event type
     */
    public static String parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        Set<String> names = new LinkedHashSet<>();
        for (String token : raw.split(",")) {
            String name = token.trim().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            if (name.equals(ALL)) {
                return ALL;
            }
            if (WebhookEventType.fromWire(name).isEmpty()) {
                throw new WebhookValidationException(Reason.UNSUPPORTED_EVENT, "Unsupported event type: " + name);
            }
            names.add(name);
        }
        return names.isEmpty() ? ALL : String.join(",", names);
    }

    public static boolean matches(String filter, WebhookEventType type) {
        if (filter == null || filter.isBlank()) {
            return true;
        }
        String trimmed = filter.trim();
        if (trimmed.equals(ALL)) {
            return true;
        }
        return Arrays.stream(trimmed.split(","))
            .map(String::trim)
            .anyMatch(name -> name.equals(ALL) || name.equalsIgnoreCase(type.wireName()));
    }

    /**
     * Active subscription whose filter admits the event.
     */
    public static boolean shouldSend(WebhookSubscription subscription, WebhookEventType type) {
        return subscription.active() && matches(subscription.events(), type);
    }

    private EventFilter() {}
}
