package com.klubtool.backend.modules.auth.application;

import java.util.Locale;
import java.util.Set;

import com.klubtool.backend.modules.auth.domain.PortalUser;

import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.stereotype.Component;

/**
 * A user's preferred language wins over the request's {@code Accept-Language}.
 */
@Component
public class UserLocaleResolver {

    public static final Set<String> SUPPORTED_LANGUAGES = Set.of("en", "de");

    public Locale resolve(PortalUser user) {
        if (user != null && user.getLanguage() != null && SUPPORTED_LANGUAGES.contains(user.getLanguage())) {
            return Locale.forLanguageTag(user.getLanguage());
        }
        return LocaleContextHolder.getLocale();
    }
}
