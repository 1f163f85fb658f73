package com.phillippitts.livefacts.testutil;

import org.springframework.context.MessageSource;
import org.springframework.context.support.ResourceBundleMessageSource;

/**
 * MessageSource over the application's {@code messages*.properties}, configured the way
 * Spring Boot configures it.
 */
public final class TestMessages {

    private TestMessages() {
    }

    public static MessageSource messageSource() {
        ResourceBundleMessageSource source = new ResourceBundleMessageSource();
        source.setBasename("messages");
        source.setDefaultEncoding("UTF-8");
        source.setFallbackToSystemLocale(false);
        return source;
    }
}
