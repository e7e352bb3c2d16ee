package com.klubtool.backend.global.i18n;

import java.util.Locale;

import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

@Component
public class Messages {

    private final MessageSource messageSource;

    public Messages(MessageSource messageSource) {
        this.messageSource = messageSource;
    }

    /**
     * Localized text for {@code key}; the key itself when no bundle defines it.
     */
    public String get(String key, Locale locale) {
        return messageSource.getMessage(key, null, key, locale);
    }
}
