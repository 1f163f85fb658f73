package com.phillippitts.livefacts.service.delivery;

import com.phillippitts.livefacts.domain.ParsedContent;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;

/**
 * Renders user-facing messages from the {@code messages*.properties} bundles.
 */
@Component
public class FactMessageFormatter {

    private final MessageSource messages;

    public FactMessageFormatter(MessageSource messages) {
        this.messages = Objects.requireNonNull(messages, "messages");
    }

    /** Numbered fact message. */
    public String fact(int number, ParsedContent content, Locale locale) {
        return messages.getMessage("fact.format",
                new Object[]{String.valueOf(number), content.place(), content.summary()}, locale);
    }

    /** Numbered message sent when a cycle produced no content. */
    public String placeholder(int number, Locale locale) {
        return messages.getMessage("fact.placeholder", new Object[]{String.valueOf(number)}, locale);
    }

    public String notification(NotificationKind kind, Locale locale, Object... args) {
        return messages.getMessage(kind.messageKey(), args, locale);
    }

    /** Place label used when the generated text names no place. */
    public String nearYou(Locale locale) {
        return messages.getMessage("place.near-you", null, locale);
    }

    public String venueAddress(String place, Locale locale) {
        return messages.getMessage("venue.address", new Object[]{place}, locale);
    }
}
